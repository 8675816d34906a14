package me.christianrobert.substation.dsl.builder;

import me.christianrobert.substation.dsl.ir.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Attribute map helpers shared by every statement handler.
 */
public final class Attributes {

    private Attributes() {
    }

    /**
     * Merges the free-form extension block into the mandatory attributes.
     *
     * <p>Mandatory keys keep their position and always win on collision; extension keys
     * not already present are appended in extension order. Neither input is modified.</p>
     *
     * @param mandatory attributes read from named grammar slots
     * @param extension attributes from the trailing {@code {key=value, ...}} block, or null
     * @return new ordered map
     */
    public static Map<String, Value> mergeExtension(Map<String, Value> mandatory, Map<String, Value> extension) {
        Map<String, Value> merged = new LinkedHashMap<>(mandatory);
        if (extension != null) {
            extension.forEach(merged::putIfAbsent);
        }
        return merged;
    }

    /**
     * Merges later statement pairs over earlier ones (STYLE, SET_LAYOUT). Later keys win.
     */
    public static void overlay(Map<String, Value> target, Map<String, Value> pairs) {
        target.putAll(pairs);
    }
}
