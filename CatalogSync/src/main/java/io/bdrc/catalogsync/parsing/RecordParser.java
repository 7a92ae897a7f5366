package io.bdrc.catalogsync.parsing;

import java.nio.file.Path;

import io.bdrc.catalogsync.model.ParsedRecord;

/**
 * Turns one source file into a {@link ParsedRecord}.  Implementations must not depend on anything but
 * the file's name and content.
 */
public interface RecordParser {
    ParsedRecord parse(Path file) throws RecordParseException;
}
