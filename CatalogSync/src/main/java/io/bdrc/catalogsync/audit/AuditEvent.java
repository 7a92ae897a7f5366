package io.bdrc.catalogsync.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One entry of a record's change history.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuditEvent {
    @JsonProperty("timestamp")
    String timestamp;
    @JsonProperty("actor")
    String actor;
    @JsonProperty("type")
    String type;
    @JsonProperty("id")
    String id;
    @JsonProperty("action")
    String action;
    @JsonProperty("diff")
    ObjectNode diff;
    @JsonProperty("correlation_id")
    String correlationId;
}
