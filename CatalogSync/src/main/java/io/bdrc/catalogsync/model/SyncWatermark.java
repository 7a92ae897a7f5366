package io.bdrc.catalogsync.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * The last source revision that was fully imported for one record type.
 */
@Value
public class SyncWatermark {
    @JsonProperty("last_revision_imported")
    String lastRevisionImported;
    @JsonProperty("last_updated_at")
    String lastUpdatedAt;

    @JsonCreator
    public SyncWatermark(@JsonProperty("last_revision_imported") String lastRevisionImported,
                         @JsonProperty("last_updated_at") String lastUpdatedAt) {
        this.lastRevisionImported = lastRevisionImported;
        this.lastUpdatedAt = lastUpdatedAt;
    }
}
