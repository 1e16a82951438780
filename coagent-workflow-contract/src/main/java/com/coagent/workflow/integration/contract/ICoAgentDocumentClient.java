package com.coagent.workflow.integration.contract;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Document-operation client consumed by node business logic.
 * The engine never calls it; nodes reach it through their node context.
 */
public interface ICoAgentDocumentClient {

    Mono<Map<String, Object>> create(String recordType, Map<String, Object> data);

    Mono<Map<String, Object>> update(String recordType, String name, Map<String, Object> data);

    Mono<Map<String, Object>> submit(String recordType, String name);

    Mono<Map<String, Object>> cancel(String recordType, String name);
}
