package io.bdrc.catalogsync.transliteration;

/**
 * Converts a romanized transliteration into native script.
 */
@FunctionalInterface
public interface TransliterationDecoder {
    String decode(String transliterated);
}
