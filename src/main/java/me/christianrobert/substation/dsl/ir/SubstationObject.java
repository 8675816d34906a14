package me.christianrobert.substation.dsl.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One piece of equipment declared by an {@code ADD_<KIND>} statement.
 *
 * <p>Attributes keep declaration order: mandatory attributes first (in grammar order),
 * then optional composites, then keys contributed by the extension block.</p>
 */
public class SubstationObject {

    private final String id;
    private final ObjectKind kind;
    private final Map<String, Value> attributes;
    private final SourceLocation location;

    public SubstationObject(String id, ObjectKind kind, Map<String, Value> attributes, SourceLocation location) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.location = location;
    }

    public String getId() {
        return id;
    }

    public ObjectKind getKind() {
        return kind;
    }

    public Map<String, Value> getAttributes() {
        return attributes;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /**
     * @return the attribute value, or null if absent
     */
    public Value getAttribute(String name) {
        return attributes.get(name);
    }

    public boolean hasAttribute(String name) {
        return attributes.containsKey(name);
    }

    /**
     * Gets a numeric attribute.
     *
     * @return the number, or null if the attribute is absent or not a number
     */
    public Double getNumber(String name) {
        Value value = attributes.get(name);
        if (value == null || !value.isNumber()) {
            return null;
        }
        return value.asNumber();
    }

    /**
     * Gets the attribute as plain text, for identifier and text values.
     *
     * @return the text, or null if absent or of another kind
     */
    public String getString(String name) {
        Value value = attributes.get(name);
        if (value == null) {
            return null;
        }
        return switch (value.getKind()) {
            case IDENTIFIER -> value.asIdentifier();
            case TEXT -> value.asText();
            default -> null;
        };
    }

    /**
     * Nominal voltage in kV, if the object carries a numeric {@code kv} attribute.
     */
    public Double getKv() {
        return getNumber("kv");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SubstationObject)) return false;
        SubstationObject that = (SubstationObject) o;
        return id.equals(that.id)
                && kind == that.kind
                && attributes.equals(that.attributes)
                && Objects.equals(location, that.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind, attributes, location);
    }

    @Override
    public String toString() {
        return kind + "{" + id + ", " + attributes + "}";
    }
}
