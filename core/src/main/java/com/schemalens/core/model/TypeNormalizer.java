package com.schemalens.core.model;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps dialect-native type strings such as {@code nvarchar(50)}, {@code NUMBER(10,2)} or
 * {@code timestamp with time zone} onto a {@link TypeFamily}, pulling length, precision
 * and scale out of the argument list.
 */
public final class TypeNormalizer {
    private static final Pattern ARGS = Pattern.compile("^([^(]*)\\(([^)]*)\\)(.*)$", Pattern.DOTALL);
    private static final Map<String, TypeFamily> FAMILIES = new HashMap<>();

    static {
        register(TypeFamily.STRING, "char", "character", "varchar", "character varying", "nchar", "nvarchar",
                "national character", "national character varying", "text", "ntext", "tinytext", "mediumtext",
                "longtext", "clob", "nclob", "varchar2", "nvarchar2", "string", "bpchar", "citext", "name",
                "long", "sysname", "set");
        register(TypeFamily.INTEGER, "int", "integer", "smallint", "tinyint", "mediumint", "bigint", "int2",
                "int4", "int8", "serial", "bigserial", "smallserial", "serial4", "serial8", "pls_integer",
                "binary_integer", "year");
        register(TypeFamily.DECIMAL, "decimal", "numeric", "number", "dec", "money", "smallmoney");
        register(TypeFamily.FLOAT, "float", "real", "double", "double precision", "float4", "float8",
                "binary_float", "binary_double");
        register(TypeFamily.BOOLEAN, "bool", "boolean", "bit");
        register(TypeFamily.DATE, "date");
        register(TypeFamily.TIME, "time", "timetz", "time without time zone", "time with time zone");
        register(TypeFamily.TIMESTAMP, "timestamp", "timestamptz", "datetime", "datetime2", "smalldatetime",
                "datetimeoffset", "timestamp without time zone", "timestamp with time zone",
                "timestamp with local time zone");
        register(TypeFamily.BINARY, "blob", "binary", "varbinary", "bytea", "image", "raw", "long raw",
                "tinyblob", "mediumblob", "longblob", "bfile", "rowversion", "bit varying", "varbit");
        register(TypeFamily.UUID, "uuid", "uniqueidentifier");
        register(TypeFamily.JSON, "json", "jsonb");
        register(TypeFamily.XML, "xml", "xmltype");
        register(TypeFamily.ENUM, "enum");
        register(TypeFamily.SPATIAL, "geometry", "geography", "point", "polygon", "linestring", "multipoint",
                "multipolygon", "multilinestring", "geometrycollection", "sdo_geometry");
    }

    private TypeNormalizer() {}

    private static void register(TypeFamily family, String... names) {
        for (String name : names) {
            FAMILIES.put(name, family);
        }
    }

    public static DataType normalize(String nativeType) {
        return normalize(nativeType, null, null, null);
    }

    /**
     * Normalizes a native type string. Explicit length, precision or scale reported by the
     * catalog win over values parsed from the string.
     */
    public static DataType normalize(String nativeType, Integer length, Integer precision, Integer scale) {
        String display = nativeType == null || nativeType.isBlank() ? "unknown" : nativeType.trim();
        String lower = display.toLowerCase(Locale.ROOT);

        if (lower.endsWith("[]") || lower.startsWith("array")) {
            return new DataType(display, TypeFamily.ARRAY, null, null, null);
        }

        String base = lower;
        Integer parsedFirst = null;
        Integer parsedSecond = null;
        Matcher m = ARGS.matcher(lower);
        if (m.matches()) {
            base = (m.group(1) + " " + m.group(3)).trim();
            String[] args = m.group(2).split(",");
            parsedFirst = parseInt(args[0]);
            parsedSecond = args.length > 1 ? parseInt(args[1]) : null;
        }
        base = base.replace(" unsigned", "").replace(" zerofill", "").replaceAll("\\s+", " ").trim();

        TypeFamily family = familyOf(base);
        Integer bits = length != null ? length : parsedFirst;
        if (base.equals("bit") && bits != null && bits > 1) {
            family = TypeFamily.BINARY;
        }
        Integer len = null;
        Integer prec = null;
        Integer scl = null;
        switch (family) {
            case STRING, BINARY -> len = parsedFirst;
            case DECIMAL, FLOAT -> {
                prec = parsedFirst;
                scl = parsedSecond;
            }
            case TIME, TIMESTAMP -> prec = parsedFirst;
            default -> {
            }
        }
        return new DataType(display, family,
                length != null ? length : len,
                precision != null ? precision : prec,
                scale != null ? scale : scl);
    }

    public static TypeFamily familyOf(String baseName) {
        String base = baseName.toLowerCase(Locale.ROOT).trim();
        TypeFamily exact = FAMILIES.get(base);
        if (exact != null) {
            return exact;
        }
        if (base.startsWith("timestamp")) return TypeFamily.TIMESTAMP;
        if (base.startsWith("interval")) return TypeFamily.INTERVAL;
        if (base.startsWith("time")) return TypeFamily.TIME;
        if (base.startsWith("character varying") || base.startsWith("varchar")) return TypeFamily.STRING;
        if (base.startsWith("double")) return TypeFamily.FLOAT;
        return TypeFamily.OTHER;
    }

    private static Integer parseInt(String text) {
        String t = text.trim();
        if (t.isEmpty()) {
            return null;
        }
        for (int i = 0; i < t.length(); i++) {
            if (!Character.isDigit(t.charAt(i))) {
                return null;
            }
        }
        try {
            return Integer.valueOf(t);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
