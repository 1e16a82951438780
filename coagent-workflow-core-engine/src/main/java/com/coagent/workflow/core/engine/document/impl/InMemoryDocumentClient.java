package com.coagent.workflow.core.engine.document.impl;

import com.coagent.workflow.integration.contract.ICoAgentDocumentClient;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Document client keeping records in memory. Stands in for the real document store in tests
 * and local runs, and records every operation so callers can see what happened and when.
 */
@Slf4j
public class InMemoryDocumentClient implements ICoAgentDocumentClient {

    public static final String STATUS_DRAFT = "Draft";
    public static final String STATUS_SUBMITTED = "Submitted";
    public static final String STATUS_CANCELLED = "Cancelled";

    private final Map<String, Map<String, Object>> records = new ConcurrentHashMap<>();
    private final List<String> operations = Collections.synchronizedList(new ArrayList<>());
    private final AtomicLong nameCounter = new AtomicLong();

    @Override
    public Mono<Map<String, Object>> create(String recordType, Map<String, Object> data) {
        return Mono.fromCallable(() -> {
            String name = recordType.toUpperCase().replace(' ', '-') + "-" + String.format("%05d", nameCounter.incrementAndGet());
            Map<String, Object> record = new LinkedHashMap<>(data);
            record.put("name", name);
            record.put("doctype", recordType);
            record.put("status", STATUS_DRAFT);
            records.put(key(recordType, name), record);
            record("create", recordType, name);
            return Collections.unmodifiableMap(new LinkedHashMap<>(record));
        });
    }

    @Override
    public Mono<Map<String, Object>> update(String recordType, String name, Map<String, Object> data) {
        return Mono.fromCallable(() -> {
            Map<String, Object> record = require(recordType, name);
            record.putAll(data);
            record("update", recordType, name);
            return Collections.unmodifiableMap(new LinkedHashMap<>(record));
        });
    }

    @Override
    public Mono<Map<String, Object>> submit(String recordType, String name) {
        return changeStatus("submit", recordType, name, STATUS_SUBMITTED);
    }

    @Override
    public Mono<Map<String, Object>> cancel(String recordType, String name) {
        return changeStatus("cancel", recordType, name, STATUS_CANCELLED);
    }

    /**
     * @return operations in call order, formatted as {@code "create:Folio:FOLIO-00001"}
     */
    public List<String> getOperations() {
        synchronized (operations) {
            return List.copyOf(operations);
        }
    }

    public List<String> getOperations(String recordType) {
        return getOperations().stream()
                .filter(operation -> operation.split(":")[1].equals(recordType))
                .toList();
    }

    private Mono<Map<String, Object>> changeStatus(String operation, String recordType, String name, String status) {
        return Mono.fromCallable(() -> {
            Map<String, Object> record = require(recordType, name);
            record.put("status", status);
            record(operation, recordType, name);
            return Collections.unmodifiableMap(new LinkedHashMap<>(record));
        });
    }

    private Map<String, Object> require(String recordType, String name) {
        Map<String, Object> record = records.get(key(recordType, name));
        if (record == null) {
            throw new IllegalArgumentException(recordType + " [" + name + "] does not exist");
        }
        return record;
    }

    private void record(String operation, String recordType, String name) {
        operations.add(operation + ":" + recordType + ":" + name);
        log.debug("Document operation: {} {} {}", operation, recordType, name);
    }

    private static String key(String recordType, String name) {
        return recordType + "/" + name;
    }
}
