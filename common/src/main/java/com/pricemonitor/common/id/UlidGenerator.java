package com.pricemonitor.common.id;

import java.security.SecureRandom;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * ULID identifiers for change and alert records: 48-bit millisecond timestamp followed by
 * 80 random bits, as 26 Crockford Base32 characters. Identifiers sort by their timestamp.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class UlidGenerator {

    private static final char[] ALPHABET = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();
    private static final int TIME_CHARS = 10;
    private static final int RANDOM_BYTES = 10;
    private static final SecureRandom RANDOM = new SecureRandom();

    /**
     * Generates an identifier whose time component is {@code at}, so ids of records
     * observed earlier sort first regardless of when they were ingested.
     */
    public static String generate(Instant at) {
        var randomness = new byte[RANDOM_BYTES];
        RANDOM.nextBytes(randomness);

        var chars = new char[TIME_CHARS + RANDOM_BYTES * 8 / 5];
        long millis = at.toEpochMilli();
        for (int i = TIME_CHARS - 1; i >= 0; i--) {
            chars[i] = ALPHABET[(int) (millis & 0x1F)];
            millis >>>= 5;
        }

        // 80 bits in 5-bit groups, consumed from a rolling bit buffer
        int buffer = 0;
        int bits = 0;
        int out = TIME_CHARS;
        for (byte b : randomness) {
            buffer = (buffer << 8) | (b & 0xFF);
            bits += 8;
            while (bits >= 5) {
                bits -= 5;
                chars[out++] = ALPHABET[(buffer >>> bits) & 0x1F];
            }
        }
        return new String(chars);
    }
}
