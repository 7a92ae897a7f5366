package io.bdrc.catalogsync.records;

import java.util.List;

import io.bdrc.catalogsync.common.ObjectMapperFactory;
import io.bdrc.catalogsync.model.CatalogFields;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Curator-supplied content for a create or an edit.  Fields left null are not written.
 */
@Value
@Builder
public class RecordInput {
    public static final String DATES = "dates";
    private static final ObjectMapper OBJECT_MAPPER = ObjectMapperFactory.createDefaultMapper();

    @NonNull
    String modifiedBy;
    String preferredLabel;
    List<String> alternateLabels;
    List<String> authors;
    /** Life dates, persons only. */
    String dates;

    public ObjectNode toFields() {
        var fields = OBJECT_MAPPER.createObjectNode();
        if (preferredLabel != null) {
            fields.put(CatalogFields.PREF_LABEL, preferredLabel);
        }
        if (alternateLabels != null) {
            fields.set(CatalogFields.ALT_LABELS, OBJECT_MAPPER.valueToTree(alternateLabels));
        }
        if (authors != null) {
            fields.set(CatalogFields.AUTHORS, OBJECT_MAPPER.valueToTree(authors));
        }
        if (dates != null) {
            fields.put(DATES, dates);
        }
        return fields;
    }
}
