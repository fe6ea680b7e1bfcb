package com.example.rental.dto;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed view over the conversation scratch map. Values are kept in JSON friendly form
 * (numbers, strings, booleans, lists); dates are ISO strings.
 */
public class ScratchData {

    private final Map<String, Object> values;

    public ScratchData() {
        this(new LinkedHashMap<>());
    }

    public ScratchData(Map<String, Object> values) {
        this.values = values == null ? new LinkedHashMap<>() : new LinkedHashMap<>(values);
    }

    public ScratchData copy() {
        return new ScratchData(values);
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public boolean has(String key) {
        return values.get(key) != null;
    }

    public boolean hasAll(Collection<String> keys) {
        return keys.stream().allMatch(this::has);
    }

    public ScratchData put(String key, Object value) {
        if (value == null) {
            values.remove(key);
        } else if (value instanceof LocalDate date) {
            values.put(key, date.toString());
        } else if (value instanceof Collection<?> list) {
            List<Object> converted = new ArrayList<>();
            for (Object o : list) {
                converted.add(o instanceof LocalDate d ? d.toString() : o);
            }
            values.put(key, converted);
        } else {
            values.put(key, value);
        }
        return this;
    }

    public ScratchData remove(String key) {
        values.remove(key);
        return this;
    }

    public Long getLong(String key) {
        Object v = values.get(key);
        if (v instanceof Number n) return n.longValue();
        if (v instanceof String s && !s.isBlank()) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public int getInt(String key, int fallback) {
        Long v = getLong(key);
        return v == null ? fallback : v.intValue();
    }

    public String getString(String key) {
        Object v = values.get(key);
        return v == null ? null : String.valueOf(v);
    }

    public boolean getBoolean(String key) {
        Object v = values.get(key);
        if (v instanceof Boolean b) return b;
        return v != null && Boolean.parseBoolean(String.valueOf(v));
    }

    public LocalDate getDate(String key) {
        return toDate(values.get(key));
    }

    public List<LocalDate> getDates(String key) {
        Object v = values.get(key);
        if (!(v instanceof Collection<?> list)) return List.of();
        List<LocalDate> result = new ArrayList<>();
        for (Object o : list) {
            LocalDate d = toDate(o);
            if (d != null) result.add(d);
        }
        return result;
    }

    private static LocalDate toDate(Object v) {
        if (v instanceof LocalDate d) return d;
        if (v instanceof String s && !s.isBlank()) {
            try {
                // tolerate timestamps written as full date-time
                return LocalDate.parse(s.length() > 10 ? s.substring(0, 10) : s);
            } catch (Exception e) {
                return null;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
