package io.bdrc.catalogsync.transliteration;

import io.bdrc.ewtsconverter.EwtsConverter;

/**
 * Decodes Extended Wylie (EWTS) into Tibetan Unicode with BDRC's {@link EwtsConverter}.
 */
public class EwtsDecoder implements TransliterationDecoder {
    private final EwtsConverter converter;

    public EwtsDecoder() {
        this(new EwtsConverter());
    }

    public EwtsDecoder(EwtsConverter converter) {
        this.converter = converter;
    }

    @Override
    public String decode(String transliterated) {
        if (transliterated == null) {
            return null;
        }
        return converter.toUnicode(transliterated);
    }
}
