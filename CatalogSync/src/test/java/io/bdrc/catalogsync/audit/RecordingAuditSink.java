package io.bdrc.catalogsync.audit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import io.bdrc.catalogsync.model.RecordType;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Keeps emitted events in memory, newest last.
 */
public class RecordingAuditSink implements AuditSink {
    private final List<AuditEvent> events = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void emit(String id, RecordType type, String action, String actor, ObjectNode diff, String correlationId) {
        events.add(AuditEvent.builder()
            .id(id)
            .type(type.getValue())
            .action(action)
            .actor(actor)
            .diff(diff)
            .correlationId(correlationId)
            .build());
    }

    @Override
    public List<AuditEvent> getHistory(String id, int size) {
        var forId = events.stream().filter(e -> e.getId().equals(id)).collect(Collectors.toList());
        Collections.reverse(forId);
        return forId.stream().limit(size).collect(Collectors.toList());
    }

    public List<AuditEvent> getEvents() {
        return List.copyOf(events);
    }

    public List<String> actionsFor(String id) {
        return events.stream().filter(e -> e.getId().equals(id)).map(AuditEvent::getAction)
            .collect(Collectors.toList());
    }
}
