package com.geoinsight.backend.scoring;

import com.geoinsight.backend.exception.InputParseException;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses amounts such as {@code "85 L"}, {@code "Rs. 1.2 Cr"},
 * {@code "10,00,000"} or {@code "2.5M"} into a plain number.
 *
 * <p>Ambiguous or malformed text is rejected rather than guessed at.
 */
public class AmountParser {

    private static final Pattern CURRENCY_PREFIX = Pattern.compile("^(?:rs\\.?|inr|₹)\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern AMOUNT = Pattern.compile("^(\\d[\\d,]*(?:\\.\\d+)?)\\s*([a-z]+)?\\.?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern MULTIPLE_NUMBERS = Pattern.compile("\\d[\\d,.]*\\s+[^\\d]*\\d");
    private static final Pattern WESTERN_GROUPING = Pattern.compile("^\\d{1,3}(?:,\\d{3})+$");
    private static final Pattern INDIAN_GROUPING = Pattern.compile("^\\d{1,2}(?:,\\d{2})*,\\d{3}$");

    private static final Map<String, BigDecimal> MULTIPLIERS = Map.ofEntries(
            Map.entry("k", BigDecimal.valueOf(1_000L)),
            Map.entry("thousand", BigDecimal.valueOf(1_000L)),
            Map.entry("l", BigDecimal.valueOf(100_000L)),
            Map.entry("lakh", BigDecimal.valueOf(100_000L)),
            Map.entry("lakhs", BigDecimal.valueOf(100_000L)),
            Map.entry("lac", BigDecimal.valueOf(100_000L)),
            Map.entry("lacs", BigDecimal.valueOf(100_000L)),
            Map.entry("m", BigDecimal.valueOf(1_000_000L)),
            Map.entry("mn", BigDecimal.valueOf(1_000_000L)),
            Map.entry("million", BigDecimal.valueOf(1_000_000L)),
            Map.entry("cr", BigDecimal.valueOf(10_000_000L)),
            Map.entry("crore", BigDecimal.valueOf(10_000_000L)),
            Map.entry("crores", BigDecimal.valueOf(10_000_000L)),
            Map.entry("b", BigDecimal.valueOf(1_000_000_000L)),
            Map.entry("bn", BigDecimal.valueOf(1_000_000_000L)),
            Map.entry("billion", BigDecimal.valueOf(1_000_000_000L)));

    public double parse(String text) {
        if (text == null || text.isBlank()) {
            throw new InputParseException("Amount is empty");
        }
        String value = CURRENCY_PREFIX.matcher(text.trim()).replaceFirst("").trim();
        if (value.isEmpty()) {
            throw new InputParseException("Amount has no number: '" + text + "'");
        }
        if (value.startsWith("-")) {
            throw new InputParseException("Negative amounts are not allowed: '" + text + "'");
        }
        if (MULTIPLE_NUMBERS.matcher(value).find()) {
            throw new InputParseException("Amount contains more than one number: '" + text + "'");
        }

        Matcher matcher = AMOUNT.matcher(value);
        if (!matcher.matches()) {
            throw new InputParseException("Unrecognized amount: '" + text + "'");
        }

        String number = matcher.group(1);
        String suffix = matcher.group(2);

        BigDecimal amount = new BigDecimal(normalizeDigits(number, text));
        if (suffix != null) {
            BigDecimal multiplier = MULTIPLIERS.get(suffix.toLowerCase(Locale.ROOT));
            if (multiplier == null) {
                throw new InputParseException("Unknown magnitude suffix '" + suffix + "' in '" + text + "'");
            }
            amount = amount.multiply(multiplier);
        }
        return amount.doubleValue();
    }

    private static String normalizeDigits(String number, String original) {
        if (!number.contains(",")) {
            return number;
        }
        int dot = number.indexOf('.');
        String integerPart = dot >= 0 ? number.substring(0, dot) : number;
        String fraction = dot >= 0 ? number.substring(dot) : "";
        if (!WESTERN_GROUPING.matcher(integerPart).matches() && !INDIAN_GROUPING.matcher(integerPart).matches()) {
            throw new InputParseException("Inconsistent digit grouping in '" + original + "'");
        }
        return integerPart.replace(",", "") + fraction;
    }
}
