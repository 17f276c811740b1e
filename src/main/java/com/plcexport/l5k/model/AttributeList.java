package com.plcexport.l5k.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.EqualsAndHashCode;

/**
 * Ordered {@code Name := value} pairs from a parenthesised attribute list.
 * Values are kept as raw dialect text; names are matched case-insensitively.
 */
@EqualsAndHashCode
public class AttributeList {

    private final LinkedHashMap<String, String> values = new LinkedHashMap<>();

    public static AttributeList empty() {
        return new AttributeList();
    }

    public AttributeList put(String name, String rawValue) {
        String existing = findName(name);
        if (existing != null) {
            values.put(existing, rawValue);
        } else {
            values.put(name, rawValue);
        }
        return this;
    }

    public Optional<String> get(String name) {
        String existing = findName(name);
        return existing == null ? Optional.empty() : Optional.of(values.get(existing));
    }

    public boolean contains(String name) {
        return findName(name) != null;
    }

    public boolean remove(String name) {
        String existing = findName(name);
        if (existing == null) {
            return false;
        }
        values.remove(existing);
        return true;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    public List<Map.Entry<String, String>> entries() {
        return new ArrayList<>(values.entrySet());
    }

    public AttributeList copy() {
        AttributeList copy = new AttributeList();
        copy.values.putAll(values);
        return copy;
    }

    /**
     * Renders the inside of the parentheses, e.g. {@code Radix := Decimal, Usage := Input}.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> e : values.entrySet()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(e.getKey()).append(" := ").append(e.getValue());
        }
        return sb.toString();
    }

    private String findName(String name) {
        for (String key : values.keySet()) {
            if (key.equalsIgnoreCase(name)) {
                return key;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "(" + render() + ")";
    }
}
