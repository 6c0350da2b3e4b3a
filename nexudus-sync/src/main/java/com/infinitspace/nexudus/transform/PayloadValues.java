package com.infinitspace.nexudus.transform;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.regex.Pattern;

/**
 * Lenient readers for Nexudus JSON values. Nexudus is loose with types (numbers
 * sometimes arrive as strings, booleans as 0/1), so every reader returns null
 * rather than failing on a value it cannot coerce.
 */
public final class PayloadValues {

    private static final Pattern HTML_TAG = Pattern.compile("<[^>]+>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // 2024-03-01, 2024-03-01T09:00:00, 2024-03-01T09:00:00.123Z, 2024-03-01T09:00:00+01:00
    private static final DateTimeFormatter ISO_FLEXIBLE = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .toFormatter();

    private PayloadValues() {}

    public static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    /** Trimmed text, or null when absent or blank. */
    public static String str(JsonNode node) {
        if (isAbsent(node) || node.isContainerNode()) return null;
        String s = node.asText().trim();
        return s.isEmpty() ? null : s;
    }

    /** 1/0 by JSON truthiness; null stays null. */
    public static Integer bit(JsonNode node) {
        if (isAbsent(node)) return null;
        return truthy(node) ? 1 : 0;
    }

    /** Like {@link #bit} but absent means 0. */
    public static int bitOrZero(JsonNode node) {
        Integer bit = bit(node);
        return bit == null ? 0 : bit;
    }

    public static Integer toInt(JsonNode node) {
        if (isAbsent(node)) return null;
        if (node.isBoolean()) return node.booleanValue() ? 1 : 0;
        if (node.isNumber()) return node.intValue();
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.textValue().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public static Long toLong(JsonNode node) {
        if (isAbsent(node)) return null;
        if (node.isBoolean()) return node.booleanValue() ? 1L : 0L;
        if (node.isNumber()) return node.longValue();
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.textValue().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public static BigDecimal decimal(JsonNode node) {
        if (isAbsent(node)) return null;
        if (node.isBoolean()) return node.booleanValue() ? BigDecimal.ONE : BigDecimal.ZERO;
        if (node.isNumber()) return node.decimalValue();
        if (node.isTextual()) {
            try {
                return new BigDecimal(node.textValue().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public static Double toDouble(JsonNode node) {
        BigDecimal value = decimal(node);
        return value == null ? null : value.doubleValue();
    }

    /**
     * ISO-8601 timestamp as UTC. Offset-less values are taken as-is, a bare date
     * becomes midnight, anything else is null.
     */
    public static LocalDateTime dateTime(JsonNode node) {
        String text = str(node);
        if (text == null) return null;
        try {
            TemporalAccessor parsed = ISO_FLEXIBLE.parseBest(text,
                    OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
            }
            if (parsed instanceof LocalDateTime) {
                return (LocalDateTime) parsed;
            }
            return ((LocalDate) parsed).atStartOfDay();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /** Tags replaced by a space, whitespace collapsed. Null when nothing is left. */
    public static String stripHtml(JsonNode node) {
        String text = str(node);
        if (text == null) return null;
        String stripped = WHITESPACE.matcher(HTML_TAG.matcher(text).replaceAll(" ")).replaceAll(" ").trim();
        return stripped.isEmpty() ? null : stripped;
    }

    /**
     * @throws IllegalArgumentException if the field is missing or not an integer
     */
    public static long requireLong(JsonNode raw, String field) {
        Long value = toLong(raw.get(field));
        if (value == null) {
            throw new IllegalArgumentException("Missing required field " + field);
        }
        return value;
    }

    /** First non-null of the given text values. */
    public static String firstText(JsonNode... nodes) {
        for (JsonNode node : nodes) {
            String s = str(node);
            if (s != null) return s;
        }
        return null;
    }

    private static boolean truthy(JsonNode node) {
        if (node.isBoolean()) return node.booleanValue();
        if (node.isNumber()) return node.doubleValue() != 0d;
        if (node.isTextual()) return !node.textValue().isEmpty();
        if (node.isContainerNode()) return node.size() > 0;
        return false;
    }
}
