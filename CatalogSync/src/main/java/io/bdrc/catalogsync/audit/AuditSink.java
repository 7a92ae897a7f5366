package io.bdrc.catalogsync.audit;

import java.util.List;

import io.bdrc.catalogsync.model.RecordType;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Append-only log of record changes.  Emitting never fails the caller.
 */
public interface AuditSink {
    String ACTION_CREATE = "create";
    String ACTION_EDIT = "edit";
    String ACTION_MERGE = "merge";
    String ACTION_WITHDRAW = "withdraw";
    String ACTION_IMPORT_CREATE = "import_create";
    String ACTION_IMPORT_UPDATE = "import_update";

    int DEFAULT_HISTORY_SIZE = 50;

    void emit(String id, RecordType type, String action, String actor, ObjectNode diff, String correlationId);

    default void emit(String id, RecordType type, String action, String actor) {
        emit(id, type, action, actor, null, null);
    }

    /** Events of one record, newest first. */
    List<AuditEvent> getHistory(String id, int size);

    default List<AuditEvent> getHistory(String id) {
        return getHistory(id, DEFAULT_HISTORY_SIZE);
    }
}
