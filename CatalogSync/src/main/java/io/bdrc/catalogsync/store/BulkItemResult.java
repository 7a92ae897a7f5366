package io.bdrc.catalogsync.store;

import lombok.Builder;
import lombok.Value;

/**
 * The outcome of one item of a bulk request.
 */
@Value
@Builder
public class BulkItemResult {
    public enum Outcome {
        CREATED,
        UPDATED,
        NOOP,
        ERROR;

        public static Outcome fromResult(String result) {
            if (result == null) {
                return ERROR;
            }
            switch (result) {
                case "created":
                    return CREATED;
                case "updated":
                    return UPDATED;
                case "noop":
                    return NOOP;
                default:
                    return ERROR;
            }
        }
    }

    String id;
    Outcome outcome;
    Integer status;
    String errorType;
    String errorReason;

    public static BulkItemResult error(String id, String errorType, String errorReason) {
        return BulkItemResult.builder()
            .id(id)
            .outcome(Outcome.ERROR)
            .errorType(errorType)
            .errorReason(errorReason)
            .build();
    }
}
