package io.bdrc.catalogsync.records;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class CatalogStats {
    @JsonProperty("works_total")
    long worksTotal;
    @JsonProperty("persons_total")
    long personsTotal;
}
