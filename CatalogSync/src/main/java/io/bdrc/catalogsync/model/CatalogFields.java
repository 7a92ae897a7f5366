package io.bdrc.catalogsync.model;

/**
 * Field names of catalog documents as stored in the index.
 */
public final class CatalogFields {
    public static final String TYPE = "type";
    public static final String ORIGIN = "origin";
    public static final String RECORD_STATUS = "record_status";
    public static final String CANONICAL_ID = "canonical_id";
    public static final String PREF_LABEL = "pref_label_bo";
    public static final String ALT_LABELS = "alt_label_bo";
    public static final String AUTHORS = "authors";
    public static final String DB_SCORE = "db_score";

    public static final String CURATION = "curation";
    public static final String CURATION_MODIFIED = "modified";
    public static final String CURATION_MODIFIED_AT = "modified_at";
    public static final String CURATION_MODIFIED_BY = "modified_by";
    public static final String CURATION_EDIT_VERSION = "edit_version";

    public static final String SOURCE_META = "source_meta";
    public static final String IMPORT_META = "import_meta";
    public static final String UPDATED_AT = "updated_at";
    public static final String LAST_RUN_AT = "last_run_at";
    public static final String LAST_RESULT = "last_result";

    public static final String LAST_RESULT_APPLIED = "updated_or_created";
    public static final String LAST_RESULT_SKIPPED_MODIFIED = "skipped_modified";

    public static final String IMPORTER_ACTOR = "importer";

    private CatalogFields() {}
}
