package com.schemalens.core.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * One catalog result row: column label to value, looked up case-insensitively.
 * Values are strings, booleans or exact numbers.
 */
public final class RawRow {
    private final Map<String, Object> values;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public RawRow(Map<String, Object> values) {
        TreeMap<String, Object> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        map.putAll(values);
        this.values = Collections.unmodifiableMap(map);
    }

    public static RawRow of(Object... pairs) {
        if (pairs.length % 2 != 0) {
            throw new IllegalArgumentException("expected label/value pairs");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((String) pairs[i], pairs[i + 1]);
        }
        return new RawRow(map);
    }

    @JsonValue
    public Map<String, Object> values() {
        return values;
    }

    public boolean has(String label) {
        return values.get(label) != null;
    }

    public Object get(String label) {
        return values.get(label);
    }

    /** The {@code row_kind} discriminator of mixed-shape results, upper-cased. */
    public String kind() {
        String kind = string("row_kind");
        return kind == null ? "" : kind.toUpperCase(Locale.ROOT);
    }

    public String string(String label) {
        Object value = values.get(label);
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        return value.toString();
    }

    /** Like {@link #string} but trims and turns blank into null. */
    public String text(String label) {
        String value = string(label);
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public Integer integer(String label) {
        BigDecimal value = bigDecimal(label);
        if (value == null) {
            return null;
        }
        try {
            return value.intValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Column " + label + " is out of integer range: "
                    + value.toPlainString(), e);
        }
    }

    public Long longValue(String label) {
        BigDecimal value = bigDecimal(label);
        if (value == null) {
            return null;
        }
        try {
            return value.longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Column " + label + " is out of long range: "
                    + value.toPlainString(), e);
        }
    }

    public BigInteger bigInteger(String label) {
        BigDecimal value = bigDecimal(label);
        return value == null ? null : value.toBigInteger();
    }

    public BigDecimal bigDecimal(String label) {
        Object value = values.get(label);
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof BigInteger) {
            return new BigDecimal((BigInteger) value);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof Number) {
            return new BigDecimal(value.toString());
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? BigDecimal.ONE : BigDecimal.ZERO;
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Column " + label + " is not numeric: " + text, e);
        }
    }

    /**
     * Reads flags in any of the spellings catalogs use: booleans, {@code 1/0},
     * {@code YES/NO}, {@code Y/N}, {@code t/f}.
     */
    public Boolean bool(String label) {
        Object value = values.get(label);
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue() != 0;
        }
        String text = value.toString().trim().toUpperCase(Locale.ROOT);
        return switch (text) {
            case "1", "Y", "YES", "T", "TRUE", "ENABLED" -> true;
            case "0", "N", "NO", "F", "FALSE", "DISABLED", "" -> false;
            default -> throw new IllegalArgumentException("Column " + label + " is not a flag: " + value);
        };
    }

    public boolean flag(String label) {
        Boolean value = bool(label);
        return value != null && value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RawRow && values.equals(((RawRow) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
