package com.coagent.workflow.plugins.mongodb;

import com.coagent.workflow.core.engine.misc.CoAgentObjectMapper;
import com.coagent.workflow.integration.models.execution.CoAgentCheckpoint;
import com.mongodb.DuplicateKeyException;
import com.mongodb.ErrorCategory;
import com.mongodb.MongoWriteException;
import org.bson.Document;

import java.nio.charset.StandardCharsets;
import java.util.Date;

/**
 * Maps checkpoints to and from the documents of the checkpoint collection.
 *
 * <p>The checkpoint itself is kept as its JSON text in {@code payload}; state keys are chosen by
 * workflows and may contain characters MongoDB does not accept in field names. The fields the
 * store filters on are copied next to it.</p>
 */
final class MongoCheckpointDocuments {

    static final String ID = "_id";
    static final String VERSION = "version";
    static final String STATUS = "status";
    static final String WORKFLOW_NAME = "workflow_name";
    static final String NODE_NAME = "node_name";
    static final String TIMESTAMP = "timestamp";
    static final String PAYLOAD = "payload";

    private static final CoAgentObjectMapper OBJECT_MAPPER = CoAgentObjectMapper.getInstance();

    private MongoCheckpointDocuments() {
    }

    static Document toDocument(CoAgentCheckpoint checkpoint) {
        Document document = new Document(ID, checkpoint.getThreadId())
                .append(VERSION, checkpoint.getVersion())
                .append(WORKFLOW_NAME, checkpoint.getWorkflowName())
                .append(NODE_NAME, checkpoint.getNodeName())
                .append(STATUS, checkpoint.getStatus() != null ? checkpoint.getStatus().name() : null)
                .append(PAYLOAD, OBJECT_MAPPER.toJson(checkpoint));
        if (checkpoint.getTimestamp() != null) {
            document.append(TIMESTAMP, Date.from(checkpoint.getTimestamp()));
        }
        return document;
    }

    static CoAgentCheckpoint fromDocument(Document document) {
        String payload = document.getString(PAYLOAD);
        if (payload == null) {
            throw new IllegalStateException("Checkpoint document without payload: " + document.get(ID));
        }
        return OBJECT_MAPPER.fromJson(payload.getBytes(StandardCharsets.UTF_8), CoAgentCheckpoint.class);
    }

    static long versionOf(Document document) {
        Number version = document.get(VERSION, Number.class);
        return version != null ? version.longValue() : 0L;
    }

    /**
     * The reactive driver reports a unique index violation of a single write as a
     * {@link MongoWriteException}, bulk paths as a {@link DuplicateKeyException}.
     */
    static boolean isDuplicateKey(Throwable error) {
        if (error instanceof DuplicateKeyException) {
            return true;
        }
        return error instanceof MongoWriteException
                && ((MongoWriteException) error).getError().getCategory() == ErrorCategory.DUPLICATE_KEY;
    }

    static String maskConnectionString(String connectionString) {
        if (connectionString == null) {
            return "null";
        }
        return connectionString.replaceAll("://[^:]+:[^@]+@", "://***:***@");
    }
}
