package com.pricemonitor.engine.domain.snapshot;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.pricemonitor.engine.domain.exceptions.ValidationException;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class PriceParserTest {

    private final PriceParser parser = new PriceParser();

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "169.00 Dhs|169.00|MAD",
            "1 299,00 DH|1299.00|MAD",
            "1.299,00 MAD|1299.00|MAD",
            "1,299.50|1299.50|",
            "2,499|2499|",
            "€ 19,99|19.99|EUR",
            "$12.5|12.5|USD",
            "169.00 Dhs - 179.00 Dhs|169.00|MAD",
            "0|0|"
    })
    void parse_priceText_yieldsAmountAndCurrency(String text, String amount, String currency) {
        var parsed = parser.parse(text);

        assertThat(parsed.amount()).isEqualByComparingTo(amount);
        assertThat(parsed.currency()).isEqualTo(currency);
    }

    @Test
    void parse_nonBreakingSpaces_areIgnored() {
        var parsed = parser.parse("12\u00A0999,00\u202FDhs");

        assertThat(parsed.amount()).isEqualByComparingTo("12999.00");
    }

    @Test
    void parse_numbers_areTakenAsIs() {
        assertThat(parser.parse(42).amount()).isEqualByComparingTo("42");
        assertThat(parser.parse(19.95d).amount()).isEqualByComparingTo("19.95");
        assertThat(parser.parse(new BigDecimal("7.10")).amount()).isEqualTo(new BigDecimal("7.10"));
    }

    @Test
    void parse_negativeValue_isRejectedAsNegative() {
        assertThatThrownBy(() -> parser.parse("-15,00 Dhs"))
                .isInstanceOf(ValidationException.class)
                .extracting(e -> ((ValidationException) e).getReason())
                .isEqualTo(RejectedSnapshot.NEGATIVE_PRICE);
        assertThatThrownBy(() -> parser.parse(-1))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void parse_textWithoutDigits_isUnparseable() {
        assertThatThrownBy(() -> parser.parse("Prix sur demande"))
                .isInstanceOf(ValidationException.class)
                .extracting(e -> ((ValidationException) e).getReason())
                .isEqualTo(RejectedSnapshot.UNPARSEABLE_PRICE);
    }

    @Test
    void parse_notANumber_isUnparseable() {
        assertThatThrownBy(() -> parser.parse(Double.NaN))
                .isInstanceOf(ValidationException.class)
                .extracting(e -> ((ValidationException) e).getReason())
                .isEqualTo(RejectedSnapshot.UNPARSEABLE_PRICE);
    }

    @Test
    void resolveSeparators_handlesGroupingAndDecimalMarks() {
        assertThat(PriceParser.resolveSeparators("1.234.567")).isEqualTo("1234567");
        assertThat(PriceParser.resolveSeparators("1.234.567,89")).isEqualTo("1234567.89");
        assertThat(PriceParser.resolveSeparators("12,5")).isEqualTo("12.5");
        assertThat(PriceParser.resolveSeparators("99")).isEqualTo("99");
    }
}
