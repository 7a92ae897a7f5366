package io.bdrc.catalogsync.records;

import java.security.SecureRandom;
import java.util.Random;

import io.bdrc.catalogsync.model.RecordType;

/**
 * Identifiers for locally created records: a type prefix followed by random upper-case letters and
 * digits.  Local works use {@code WA} so they never collide with imported {@code W} ids of the same
 * shape.
 */
public class IdGenerator {
    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    public static final int SUFFIX_LENGTH = 7;

    private final Random random;

    public IdGenerator() {
        this(new SecureRandom());
    }

    public IdGenerator(Random random) {
        this.random = random;
    }

    public String newId(RecordType type) {
        var sb = new StringBuilder(prefixFor(type));
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }

    static String prefixFor(RecordType type) {
        switch (type) {
            case WORK:
                return "WA";
            case PERSON:
                return "P";
            default:
                throw new IllegalArgumentException("Cannot create records of type " + type);
        }
    }
}
