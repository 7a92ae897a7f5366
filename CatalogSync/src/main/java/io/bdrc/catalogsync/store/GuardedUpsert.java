package io.bdrc.catalogsync.store;

import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A create-or-update of one document whose effect on an existing document depends on a boolean flag
 * already stored in it.  The decision is taken by the store, inside the write, so a concurrent change
 * of the flag cannot be overwritten.
 * <p>
 * Paths are dotted ({@code import_meta.last_run_at}); missing intermediate objects are created.
 * The same rules run when the document is first created from {@link #upsertDocument}.
 */
@Value
@Builder
public class GuardedUpsert {
    @NonNull
    String id;
    /** Initial content when the document does not exist yet. */
    @NonNull
    ObjectNode upsertDocument;
    /** Written unconditionally. */
    @Singular
    Map<String, JsonNode> alwaysFields;
    /** Path of the boolean that, when {@code true}, protects {@link #guardedFields}. */
    @NonNull
    String guardField;
    /** Written only while the guard is not {@code true}, and only when the value is not null. */
    @Singular
    Map<String, JsonNode> guardedFields;
    @NonNull
    String outcomeField;
    @NonNull
    String outcomeWhenApplied;
    @NonNull
    String outcomeWhenGuarded;
    /** Top-level fields filled in only when absent. */
    @Singular
    Map<String, JsonNode> defaultFields;

    public static boolean isPresent(JsonNode value) {
        return value != null && !value.isNull() && !value.isMissingNode();
    }
}
