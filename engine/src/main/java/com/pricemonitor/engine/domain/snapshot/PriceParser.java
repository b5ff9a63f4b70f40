package com.pricemonitor.engine.domain.snapshot;

import com.pricemonitor.engine.domain.exceptions.ValidationException;
import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns scraped price values into decimals. Handles currency words and symbols, comma or dot
 * separators, non-breaking spaces and ranges such as {@code "169.00 Dhs - 179.00 Dhs"}, where the
 * first (lower) price is taken.
 */
public class PriceParser {

    private static final Pattern RANGE_SEPARATOR = Pattern.compile("\\s+[-\u2013\u2014]\\s+");
    private static final Pattern CURRENCY_WORD =
            Pattern.compile("(?i)(dhs|dh|mad|eur|euros?|usd)\\b|[\u20ac$]");
    private static final Pattern LEADING_MINUS = Pattern.compile("^[^\\d]*-\\s*\\d.*");

    public record ParsedPrice(BigDecimal amount, String currency) {}

    public ParsedPrice parse(Object raw) {
        if (raw instanceof BigDecimal decimal) {
            return checked(decimal, null, raw);
        }
        if (raw instanceof Number number) {
            return checked(fromNumber(number), null, raw);
        }
        var text = raw.toString().replace('\u00A0', ' ').replace('\u202F', ' ').trim();
        if (text.isEmpty()) {
            throw ValidationException.unparseable(RejectedSnapshot.UNPARSEABLE_PRICE, raw);
        }

        var range = RANGE_SEPARATOR.split(text, 2);
        text = range[0];

        String currency = null;
        var matcher = CURRENCY_WORD.matcher(text);
        if (matcher.find()) {
            currency = currencyCode(matcher.group());
        }
        var negative = LEADING_MINUS.matcher(text).matches();

        var digits = text.replaceAll("[^\\d.,]", "");
        if (digits.chars().noneMatch(Character::isDigit)) {
            throw ValidationException.unparseable(RejectedSnapshot.UNPARSEABLE_PRICE, raw);
        }
        try {
            var amount = new BigDecimal(resolveSeparators(digits));
            return checked(negative ? amount.negate() : amount, currency, raw);
        } catch (NumberFormatException e) {
            throw ValidationException.unparseable(RejectedSnapshot.UNPARSEABLE_PRICE, raw);
        }
    }

    private ParsedPrice checked(BigDecimal amount, String currency, Object raw) {
        if (amount.signum() < 0) {
            throw ValidationException.negativePrice(raw);
        }
        return new ParsedPrice(amount, currency);
    }

    private BigDecimal fromNumber(Number number) {
        if (number instanceof Double || number instanceof Float) {
            var value = number.doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw ValidationException.unparseable(RejectedSnapshot.UNPARSEABLE_PRICE, number);
            }
        }
        return new BigDecimal(number.toString());
    }

    // Whichever separator comes last is the decimal point when both appear. A lone separator
    // followed by exactly three digits is a thousands separator ("1,099"), otherwise decimal.
    static String resolveSeparators(String digits) {
        int lastComma = digits.lastIndexOf(',');
        int lastDot = digits.lastIndexOf('.');
        if (lastComma >= 0 && lastDot >= 0) {
            char decimal = lastComma > lastDot ? ',' : '.';
            char grouping = decimal == ',' ? '.' : ',';
            return digits.replace(String.valueOf(grouping), "").replace(decimal, '.');
        }
        if (lastComma < 0 && lastDot < 0) {
            return digits;
        }
        char separator = lastComma >= 0 ? ',' : '.';
        int occurrences = (int) digits.chars().filter(c -> c == separator).count();
        int last = Math.max(lastComma, lastDot);
        int fractionDigits = digits.length() - last - 1;
        var sep = String.valueOf(separator);
        if (occurrences > 1) {
            if (fractionDigits == 3) {
                return digits.replace(sep, "");
            }
            return digits.substring(0, last).replace(sep, "") + "." + digits.substring(last + 1);
        }
        if (separator == ',' && fractionDigits == 3) {
            return digits.replace(sep, "");
        }
        return digits.replace(separator, '.');
    }

    private static String currencyCode(String token) {
        var lower = token.toLowerCase(Locale.ROOT);
        if (lower.startsWith("dh") || lower.equals("mad")) {
            return "MAD";
        }
        if (lower.startsWith("eur") || lower.equals("\u20ac")) {
            return "EUR";
        }
        return "USD";
    }
}
