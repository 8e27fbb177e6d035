package com.astrofiler.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Typed view of a primary FITS header.
 * <p>
 * Values are kept as String, Long, Double or Boolean. Blank strings read as absent.
 * Every {@code set}/{@code remove} that changes a value is recorded so that only
 * the touched cards are written back to disk.
 */
public class FitsHeader {

    private final Map<String, Object> values = new LinkedHashMap<>();
    private final Set<String> modified = new LinkedHashSet<>();

    public FitsHeader() {
    }

    public FitsHeader(Map<String, Object> initial) {
        initial.forEach((k, v) -> values.put(normalizeKey(k), coerce(v)));
    }

    // --- Typed accessors ---

    public boolean has(HeaderKey key) {
        return has(key.key());
    }

    public boolean has(String key) {
        return getString(key).isPresent();
    }

    public Optional<String> getString(HeaderKey key) {
        return getString(key.key());
    }

    public Optional<String> getString(String key) {
        Object v = values.get(normalizeKey(key));
        if (v == null) return Optional.empty();
        String s = format(v).trim();
        return s.isEmpty() ? Optional.empty() : Optional.of(s);
    }

    public Optional<Double> getDouble(HeaderKey key) {
        return getDouble(key.key());
    }

    public Optional<Double> getDouble(String key) {
        Object v = values.get(normalizeKey(key));
        if (v instanceof Number) return Optional.of(((Number) v).doubleValue());
        if (v instanceof String) {
            try {
                return Optional.of(Double.parseDouble(((String) v).trim().replace('D', 'E')));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public Optional<Integer> getInt(HeaderKey key) {
        return getDouble(key).map(d -> (int) Math.round(d));
    }

    public Object getRaw(String key) {
        return values.get(normalizeKey(key));
    }

    // --- Mutators ---

    public void set(HeaderKey key, Object value) {
        set(key.key(), value);
    }

    public void set(String key, Object value) {
        String k = normalizeKey(key);
        Object v = coerce(value);
        if (Objects.equals(values.get(k), v)) return;
        values.put(k, v);
        modified.add(k);
    }

    /** Sets the card only when it is absent or blank. */
    public void setIfAbsent(HeaderKey key, Object value) {
        if (!has(key)) set(key, value);
    }

    public void remove(String key) {
        String k = normalizeKey(key);
        if (values.containsKey(k)) {
            values.remove(k);
            modified.add(k);
        }
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public Set<String> modifiedKeys() {
        return Collections.unmodifiableSet(modified);
    }

    public boolean isModified() {
        return !modified.isEmpty();
    }

    public void markClean() {
        modified.clear();
    }

    /**
     * Renders a header value the way it appears in file names: whole numbers without
     * a decimal part, other doubles without trailing zeros.
     */
    public static String format(Object value) {
        if (value == null) return "";
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) return String.valueOf(d);
            return new BigDecimal(Double.toString(d)).stripTrailingZeros().toPlainString();
        }
        if (value instanceof Boolean) return ((Boolean) value) ? "T" : "F";
        return value.toString();
    }

    private static Object coerce(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) return ((Float) value).doubleValue();
        return value;
    }

    private static String normalizeKey(String key) {
        return key.trim().toUpperCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "FitsHeader" + values;
    }
}
