package io.bdrc.catalogsync.store;

import java.io.IOException;
import java.net.HttpURLConnection;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.bdrc.catalogsync.common.CatalogSyncException;
import io.bdrc.catalogsync.common.ObjectMapperFactory;
import io.bdrc.catalogsync.common.RestClient;
import io.bdrc.catalogsync.common.http.HttpResponse;
import io.bdrc.catalogsync.model.CatalogFields;
import io.bdrc.catalogsync.parsing.BulkResponseParser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * {@link CatalogStore} over the OpenSearch REST API of one index.
 * <p>
 * Guarded upserts are sent as painless {@code scripted_upsert} operations of a single {@code _bulk}
 * request.  All of them share one script; what differs between documents travels in its params.
 */
@Slf4j
public class OpenSearchCatalogStore implements CatalogStore {
    protected static final ObjectMapper OBJECT_MAPPER = ObjectMapperFactory.createDefaultMapper();

    private static final int DEFAULT_MAX_RETRY_ATTEMPTS = 3;
    private static final Duration DEFAULT_BACKOFF = Duration.ofSeconds(1);
    private static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(10);
    private static final Retry DEFAULT_RETRY_STRATEGY = Retry.backoff(DEFAULT_MAX_RETRY_ATTEMPTS, DEFAULT_BACKOFF)
        .maxBackoff(DEFAULT_MAX_BACKOFF)
        .filter(OpenSearchCatalogStore::isRetryable)
        .onRetryExhaustedThrow((spec, signal) -> signal.failure());

    private static final int BULK_MAX_RETRY_ATTEMPTS = 15;
    private static final Duration BULK_BACKOFF = Duration.ofSeconds(2);
    private static final Duration BULK_MAX_BACKOFF = Duration.ofSeconds(60);
    /** Retries for up 10 minutes */
    private static final Retry BULK_RETRY_STRATEGY = Retry.backoff(BULK_MAX_RETRY_ATTEMPTS, BULK_BACKOFF)
        .maxBackoff(BULK_MAX_BACKOFF)
        .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    public static final int BULK_TRUNCATED_RESPONSE_MAX_LENGTH = 1500;

    static final String LEASE_HOLDER_FIELD = "lease_holder";
    static final String LEASE_EXPIRES_AT_FIELD = "lease_expires_at";

    // painless has no notion of 'now'; the client's clock is passed in
    static final String GUARDED_UPSERT_SCRIPT =
        "Map parentOf(Map root, String path, boolean create) {"
        + "  String[] parts = path.splitOnToken('.');"
        + "  Map cur = root;"
        + "  for (int i = 0; i < parts.length - 1; i++) {"
        + "    def next = cur[parts[i]];"
        + "    if (next == null) {"
        + "      if (!create) { return null; }"
        + "      next = new HashMap();"
        + "      cur[parts[i]] = next;"
        + "    }"
        + "    cur = (Map) next;"
        + "  }"
        + "  return cur;"
        + "}"
        + "String leafOf(String path) {"
        + "  String[] parts = path.splitOnToken('.');"
        + "  return parts[parts.length - 1];"
        + "}"
        + "for (def e : params.always.entrySet()) {"
        + "  parentOf(ctx._source, e.getKey(), true)[leafOf(e.getKey())] = e.getValue();"
        + "}"
        + "Map g = parentOf(ctx._source, params.guard, false);"
        + "boolean guarded = g != null && g[leafOf(params.guard)] == true;"
        + "if (!guarded) {"
        + "  for (def e : params.guarded.entrySet()) {"
        + "    if (e.getValue() != null) {"
        + "      parentOf(ctx._source, e.getKey(), true)[leafOf(e.getKey())] = e.getValue();"
        + "    }"
        + "  }"
        + "}"
        + "parentOf(ctx._source, params.outcome, true)[leafOf(params.outcome)] ="
        + "  guarded ? params.outcome_guarded : params.outcome_applied;"
        + "for (def e : params.defaults.entrySet()) {"
        + "  if (ctx._source[e.getKey()] == null) { ctx._source[e.getKey()] = e.getValue(); }"
        + "}";

    static final String CHANGE_STATUS_SCRIPT =
        "Map src = ctx._source;"
        + "if (src['" + CatalogFields.RECORD_STATUS + "'] == params.status"
        + "    && (params.canonical_id == null || src['" + CatalogFields.CANONICAL_ID + "'] == params.canonical_id)) {"
        + "  ctx.op = 'noop';"
        + "} else {"
        + "  src['" + CatalogFields.RECORD_STATUS + "'] = params.status;"
        + "  if (params.canonical_id != null) { src['" + CatalogFields.CANONICAL_ID + "'] = params.canonical_id; }"
        + "  if (src['" + CatalogFields.CURATION + "'] == null) { src['" + CatalogFields.CURATION + "'] = new HashMap(); }"
        + "  Map c = src['" + CatalogFields.CURATION + "'];"
        + "  def version = c['" + CatalogFields.CURATION_EDIT_VERSION + "'];"
        + "  c['" + CatalogFields.CURATION_EDIT_VERSION + "'] = (version == null ? 0 : version) + 1;"
        + "  c['" + CatalogFields.CURATION_MODIFIED_BY + "'] = params.actor;"
        + "  c['" + CatalogFields.CURATION_MODIFIED_AT + "'] = params.now;"
        + "}";
    private static final int STATUS_CHANGE_CONFLICT_RETRIES = 3;

    static final String ACQUIRE_LEASE_SCRIPT =
        "if (ctx._source." + LEASE_HOLDER_FIELD + " == null"
        + "    || ctx._source." + LEASE_HOLDER_FIELD + " == params.holder"
        + "    || ctx._source." + LEASE_EXPIRES_AT_FIELD + " < params.now) {"
        + "  ctx._source." + LEASE_HOLDER_FIELD + " = params.holder;"
        + "  ctx._source." + LEASE_EXPIRES_AT_FIELD + " = params.now + params.duration;"
        + "} else {"
        + "  ctx.op = 'noop';"
        + "}";

    static final String RELEASE_LEASE_SCRIPT =
        "if (ctx._source." + LEASE_HOLDER_FIELD + " == params.holder) {"
        + "  ctx._source." + LEASE_HOLDER_FIELD + " = null;"
        + "  ctx._source." + LEASE_EXPIRES_AT_FIELD + " = 0;"
        + "} else {"
        + "  ctx.op = 'noop';"
        + "}";

    protected final RestClient client;
    protected final FailedRequestsLogger failedRequestsLogger;
    @Getter
    private final String indexName;
    private final Clock clock;

    public OpenSearchCatalogStore(RestClient client, String indexName) {
        this(client, indexName, new FailedRequestsLogger(), Clock.systemUTC());
    }

    public OpenSearchCatalogStore(RestClient client, String indexName, FailedRequestsLogger failedRequestsLogger,
                                  Clock clock) {
        this.client = client;
        this.indexName = indexName;
        this.failedRequestsLogger = failedRequestsLogger;
        this.clock = clock;
    }

    protected Retry getRetryStrategy() {
        return DEFAULT_RETRY_STRATEGY;
    }

    protected Retry getBulkRetryStrategy() {
        return BULK_RETRY_STRATEGY;
    }

    private static boolean isRetryable(Throwable t) {
        if (t instanceof OperationFailed) {
            var response = ((OperationFailed) t).response;
            return response == null || response.isRetryable();
        }
        return true;
    }

    @Override
    public Optional<ObjectNode> get(String id) {
        var path = indexName + "/_doc/" + id;
        var response = execute(client.getAsync(path)
            .flatMap(resp -> resp.isSuccess() || resp.isNotFound()
                ? Mono.just(resp)
                : Mono.error(new OperationFailed("Could not read document " + id, resp))), path);
        if (response.isNotFound()) {
            return Optional.empty();
        }
        var source = readJson(response).path("_source");
        return source.isObject() ? Optional.of((ObjectNode) source) : Optional.empty();
    }

    @Override
    public void index(String id, ObjectNode document) {
        var path = indexName + "/_doc/" + id + "?refresh=true";
        execute(client.putAsync(path, document.toString())
            .flatMap(resp -> requireSuccess(resp, "Could not index document " + id)), path);
    }

    @Override
    public void update(String id, ObjectNode partial) {
        var path = indexName + "/_update/" + id + "?refresh=true";
        var body = OBJECT_MAPPER.createObjectNode();
        body.set("doc", partial);
        execute(client.postAsync(path, body.toString())
            .flatMap(resp -> requireSuccess(resp, "Could not update document " + id)), path);
    }

    @Override
    public StatusChange changeStatus(String id, String status, String canonicalId, String actor, String now) {
        var path = indexName + "/_update/" + id + "?refresh=true&retry_on_conflict=" + STATUS_CHANGE_CONFLICT_RETRIES;
        var params = OBJECT_MAPPER.createObjectNode()
            .put("status", status)
            .put("canonical_id", canonicalId)
            .put("actor", actor)
            .put("now", now);
        var body = OBJECT_MAPPER.createObjectNode();
        body.set("script", script(CHANGE_STATUS_SCRIPT, params));

        var response = execute(client.postAsync(path, body.toString())
            .flatMap(resp -> resp.isSuccess() || resp.isNotFound()
                ? Mono.just(resp)
                : Mono.error(new OperationFailed("Could not change the status of " + id, resp))), path);
        if (response.isNotFound()) {
            return StatusChange.MISSING;
        }
        var result = BulkItemResult.Outcome.fromResult(readJson(response).path("result").asText(null));
        return result == BulkItemResult.Outcome.NOOP ? StatusChange.UNCHANGED : StatusChange.APPLIED;
    }

    @Override
    public ObjectNode search(ObjectNode query, int size) {
        var path = indexName + "/_search?size=" + size;
        var response = execute(client.postAsync(path, query.toString())
            .flatMap(resp -> requireSuccess(resp, "Search on " + indexName + " failed")), path);
        return readJson(response);
    }

    @Override
    public void refresh() {
        var path = indexName + "/_refresh";
        execute(client.postAsync(path, null)
            .flatMap(resp -> requireSuccess(resp, "Refresh of " + indexName + " failed")), path);
    }

    @Override
    public List<BulkItemResult> bulkUpsert(List<GuardedUpsert> upserts) {
        if (upserts.isEmpty()) {
            return List.of();
        }
        final String targetPath = indexName + "/_bulk";
        final String body = toBulkNdjson(upserts);
        log.atTrace().setMessage("Sending bulk upsert of {} documents").addArgument(upserts::size).log();
        return Mono.defer(() -> client.postAsync(targetPath, body, RestClient.NDJSON_CONTENT_TYPE))
            .flatMap(response -> {
                var resp = new BulkResponse(response.statusCode, response.statusText, response.headers, response.body);
                if (!resp.hasBadStatusCode()) {
                    return Mono.just(resp);
                }
                log.atWarn()
                    .setMessage("Bulk upsert into '{}' failed with status {}: {}")
                    .addArgument(indexName)
                    .addArgument(resp.statusCode)
                    .addArgument(truncateMessageIfNeeded(resp.body, BULK_TRUNCATED_RESPONSE_MAX_LENGTH))
                    .log();
                return Mono.error(new OperationFailed(resp.getFailureMessage(), resp));
            })
            .retryWhen(getBulkRetryStrategy())
            .doOnError(error -> failedRequestsLogger.logBulkFailure(indexName, upserts::size, () -> body, error))
            .onErrorMap(e -> !(e instanceof OperationFailed),
                e -> new OperationFailed("Bulk upsert into " + indexName + " failed", null, e))
            .map(BulkResponse::getItemResults)
            .block();
    }

    @Override
    public boolean acquireLease(String leaseId, String holder, Duration duration) {
        var path = indexName + "/_update/" + leaseId + "?refresh=true";
        var upsert = OBJECT_MAPPER.createObjectNode();
        upsert.putNull(LEASE_HOLDER_FIELD);
        upsert.put(LEASE_EXPIRES_AT_FIELD, 0L);
        var params = OBJECT_MAPPER.createObjectNode()
            .put("holder", holder)
            .put("now", clock.millis() / 1000)
            .put("duration", duration.toSeconds());
        var body = OBJECT_MAPPER.createObjectNode();
        body.put("scripted_upsert", true);
        body.set("upsert", upsert);
        body.set("script", script(ACQUIRE_LEASE_SCRIPT, params));

        var response = execute(client.postAsync(path, body.toString())
            .flatMap(resp -> requireSuccess(resp, "Could not acquire lease " + leaseId)), path);
        var result = BulkItemResult.Outcome.fromResult(readJson(response).path("result").asText(null));
        log.atDebug().setMessage("Lease {} for {}: {}").addArgument(leaseId).addArgument(holder)
            .addArgument(result).log();
        return result == BulkItemResult.Outcome.CREATED || result == BulkItemResult.Outcome.UPDATED;
    }

    @Override
    public void releaseLease(String leaseId, String holder) {
        var path = indexName + "/_update/" + leaseId + "?refresh=true";
        var body = OBJECT_MAPPER.createObjectNode();
        body.set("script", script(RELEASE_LEASE_SCRIPT, OBJECT_MAPPER.createObjectNode().put("holder", holder)));
        var response = execute(client.postAsync(path, body.toString())
            .flatMap(resp -> resp.isSuccess() || resp.isNotFound()
                ? Mono.just(resp)
                : Mono.error(new OperationFailed("Could not release lease " + leaseId, resp))), path);
        if (response.isNotFound()) {
            log.atWarn().setMessage("Lease {} did not exist when released").addArgument(leaseId).log();
        }
    }

    String toBulkNdjson(List<GuardedUpsert> upserts) {
        var sb = new StringBuilder();
        for (var upsert : upserts) {
            var action = OBJECT_MAPPER.createObjectNode();
            action.putObject("update").put("_id", upsert.getId());

            var params = OBJECT_MAPPER.createObjectNode();
            params.set("always", toObject(upsert.getAlwaysFields()));
            params.put("guard", upsert.getGuardField());
            params.set("guarded", toObject(upsert.getGuardedFields()));
            params.put("outcome", upsert.getOutcomeField());
            params.put("outcome_applied", upsert.getOutcomeWhenApplied());
            params.put("outcome_guarded", upsert.getOutcomeWhenGuarded());
            params.set("defaults", toObject(upsert.getDefaultFields()));

            var operation = OBJECT_MAPPER.createObjectNode();
            operation.put("scripted_upsert", true);
            operation.set("upsert", upsert.getUpsertDocument());
            operation.set("script", script(GUARDED_UPSERT_SCRIPT, params));

            sb.append(action).append('\n').append(operation).append('\n');
        }
        return sb.toString();
    }

    private static ObjectNode toObject(Map<String, JsonNode> fields) {
        var node = OBJECT_MAPPER.createObjectNode();
        fields.forEach((k, v) -> node.set(k, GuardedUpsert.isPresent(v) ? v : node.nullNode()));
        return node;
    }

    private static ObjectNode script(String source, ObjectNode params) {
        var script = OBJECT_MAPPER.createObjectNode();
        script.put("lang", "painless");
        script.put("source", source);
        script.set("params", params);
        return script;
    }

    private HttpResponse execute(Mono<HttpResponse> request, String path) {
        return Mono.defer(() -> request)
            .doOnError(e -> log.atWarn().setMessage("Request to {} failed: {}").addArgument(path)
                .addArgument(e::getMessage).log())
            .retryWhen(getRetryStrategy())
            .onErrorMap(e -> !(e instanceof OperationFailed),
                e -> new OperationFailed("Request to " + path + " failed", null, e))
            .block();
    }

    private static Mono<HttpResponse> requireSuccess(HttpResponse resp, String errorMessage) {
        return resp.isSuccess() ? Mono.just(resp) : Mono.error(new OperationFailed(errorMessage, resp));
    }

    private static ObjectNode readJson(HttpResponse response) {
        try {
            var node = OBJECT_MAPPER.readTree(response.body);
            if (node == null || !node.isObject()) {
                throw new OperationFailed("Expected a JSON object in the response", response);
            }
            return (ObjectNode) node;
        } catch (JsonProcessingException e) {
            throw new OperationFailed("Unparseable response body", response, e);
        }
    }

    private static String truncateMessageIfNeeded(String input, int maxCharacters) {
        if (input == null || input.length() <= maxCharacters) {
            return input;
        }
        int partLength = maxCharacters / 2;
        String head = input.substring(0, partLength);
        String tail = input.substring(input.length() - partLength);
        return head + "... [truncated] ..." + tail;
    }

    public static class BulkResponse extends HttpResponse {
        public BulkResponse(int statusCode, String statusText, Map<String, String> headers, String body) {
            super(statusCode, statusText, headers, body);
        }

        public boolean hasBadStatusCode() {
            return !(statusCode == HttpURLConnection.HTTP_OK || statusCode == HttpURLConnection.HTTP_CREATED);
        }

        public List<BulkItemResult> getItemResults() {
            try {
                return BulkResponseParser.parseItems(body);
            } catch (IOException ioe) {
                throw new OperationFailed("Unable to read the bulk response", this, ioe);
            }
        }

        public String getFailureMessage() {
            return "Bulk request failed.  Status code: " + statusCode + ", Response body: " + body;
        }
    }

    public static class OperationFailed extends CatalogSyncException {
        public final transient HttpResponse response;

        public OperationFailed(String message, HttpResponse response) {
            super(message + "\nBody:\n" + response);
            this.response = response;
        }

        public OperationFailed(String message, HttpResponse response, Throwable cause) {
            super(message + (response != null ? "\nBody:\n" + response : ""), cause);
            this.response = response;
        }
    }
}
