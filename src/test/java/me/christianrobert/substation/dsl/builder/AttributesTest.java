package me.christianrobert.substation.dsl.builder;

import me.christianrobert.substation.dsl.ir.Value;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AttributesTest {

    @Test
    void mergeWithoutExtensionCopiesMandatory() {
        Map<String, Value> mandatory = new LinkedHashMap<>();
        mandatory.put("id", Value.identifier("b1"));
        mandatory.put("kv", Value.number(138));

        Map<String, Value> merged = Attributes.mergeExtension(mandatory, null);

        assertEquals(mandatory, merged);
        assertNotSame(mandatory, merged);
    }

    @Test
    void mergeAppendsNewKeysAndKeepsMandatoryValues() {
        Map<String, Value> mandatory = new LinkedHashMap<>();
        mandatory.put("id", Value.identifier("b1"));
        mandatory.put("kv", Value.number(138));
        Map<String, Value> extension = new LinkedHashMap<>();
        extension.put("section", Value.identifier("A"));
        extension.put("kv", Value.number(69));

        Map<String, Value> merged = Attributes.mergeExtension(mandatory, extension);

        assertEquals(List.of("id", "kv", "section"), List.copyOf(merged.keySet()));
        assertEquals(Value.number(138), merged.get("kv"));
        assertEquals(2, mandatory.size(), "Inputs must not be modified");
    }

    @Test
    void overlayLaterKeysWin() {
        Map<String, Value> target = new LinkedHashMap<>();
        target.put("theme", Value.identifier("light"));
        target.put("font_size", Value.number(10));

        Attributes.overlay(target, Map.of("theme", Value.identifier("dark")));

        assertEquals(Value.identifier("dark"), target.get("theme"));
        assertEquals(List.of("theme", "font_size"), List.copyOf(target.keySet()));
    }
}
