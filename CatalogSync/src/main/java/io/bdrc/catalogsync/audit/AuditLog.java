package io.bdrc.catalogsync.audit;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import io.bdrc.catalogsync.common.CatalogSyncException;
import io.bdrc.catalogsync.common.ObjectMapperFactory;
import io.bdrc.catalogsync.common.RestClient;
import io.bdrc.catalogsync.common.http.HttpResponse;
import io.bdrc.catalogsync.model.RecordType;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link AuditSink} writing to its own OpenSearch index.  Events are not refreshed on write, so a
 * history read right after an emit may not show it yet.
 */
@Slf4j
public class AuditLog implements AuditSink {
    private static final ObjectMapper OBJECT_MAPPER = ObjectMapperFactory.createDefaultMapper();
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final RestClient client;
    @Getter
    private final String indexName;
    private final Clock clock;
    private final Duration requestTimeout;

    public AuditLog(RestClient client, String indexName) {
        this(client, indexName, Clock.systemUTC());
    }

    public AuditLog(RestClient client, String indexName, Clock clock) {
        this(client, indexName, clock, DEFAULT_REQUEST_TIMEOUT);
    }

    AuditLog(RestClient client, String indexName, Clock clock, Duration requestTimeout) {
        this.client = client;
        this.indexName = indexName;
        this.clock = clock;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public void emit(String id, RecordType type, String action, String actor, ObjectNode diff, String correlationId) {
        var event = AuditEvent.builder()
            .timestamp(clock.instant().toString())
            .actor(actor)
            .type(type.getValue())
            .id(id)
            .action(action)
            .diff(diff)
            .correlationId(correlationId)
            .build();
        try {
            var response = client.postAsync(indexName + "/_doc", OBJECT_MAPPER.writeValueAsString(event))
                .block(requestTimeout);
            if (response == null || !response.isSuccess()) {
                log.atError().setMessage("Audit event {} for {} was rejected: {}")
                    .addArgument(action).addArgument(id).addArgument(response).log();
            }
        } catch (JsonProcessingException | RuntimeException e) {
            log.atError().setCause(e).setMessage("Failed to write audit event {} for {}")
                .addArgument(action).addArgument(id).log();
        }
    }

    @Override
    public List<AuditEvent> getHistory(String id, int size) {
        var query = OBJECT_MAPPER.createObjectNode();
        query.putObject("query").putObject("term").put("id", id);
        query.putArray("sort").addObject().putObject("timestamp").put("order", "desc");

        HttpResponse response;
        try {
            response = client.postAsync(indexName + "/_search?size=" + size, query.toString()).block(requestTimeout);
        } catch (RuntimeException e) {
            throw new CatalogSyncException("Audit history query for " + id + " failed", e);
        }
        if (response == null || !response.isSuccess()) {
            throw new CatalogSyncException("Audit history query for " + id + " failed: " + response);
        }
        try {
            var events = new ArrayList<AuditEvent>();
            for (var hit : OBJECT_MAPPER.readTree(response.body).path("hits").path("hits")) {
                events.add(OBJECT_MAPPER.treeToValue(hit.path("_source"), AuditEvent.class));
            }
            return events;
        } catch (JsonProcessingException e) {
            throw new CatalogSyncException("Unreadable audit history for " + id, e);
        }
    }
}
