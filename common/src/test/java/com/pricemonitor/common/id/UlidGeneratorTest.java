package com.pricemonitor.common.id;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class UlidGeneratorTest {

    @Test
    void generateReturns26CrockfordCharacters() {
        assertThat(UlidGenerator.generate(Instant.parse("2026-03-01T08:00:00Z"))).matches("^[0-9A-HJKMNP-TV-Z]{26}$");
    }

    @Test
    void generatedIdsAreUnique() {
        var at = Instant.parse("2026-03-01T08:00:00Z");
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            ids.add(UlidGenerator.generate(at));
        }
        assertThat(ids).hasSize(1000);
    }

    @Test
    void idsSortByTheGivenInstant() {
        var earlier = UlidGenerator.generate(Instant.parse("2026-03-01T08:00:00Z"));
        var later = UlidGenerator.generate(Instant.parse("2026-03-01T08:00:00.001Z"));

        assertThat(earlier.compareTo(later)).isLessThan(0);
    }

    @Test
    void epochEncodesAsZeroTimePrefix() {
        assertThat(UlidGenerator.generate(Instant.EPOCH)).startsWith("0000000000");
    }
}
