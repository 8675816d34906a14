package me.christianrobert.substation.dsl.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Diagram page declared by a {@code PAGE} statement. Retained for downstream renderers only.
 */
public class Page {

    private final String id;
    private final Map<String, Value> attributes;
    private final SourceLocation location;

    public Page(String id, Map<String, Value> attributes, SourceLocation location) {
        this.id = Objects.requireNonNull(id, "id");
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.location = location;
    }

    public String getId() {
        return id;
    }

    public Map<String, Value> getAttributes() {
        return attributes;
    }

    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Page)) return false;
        Page that = (Page) o;
        return id.equals(that.id) && attributes.equals(that.attributes) && Objects.equals(location, that.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, attributes, location);
    }

    @Override
    public String toString() {
        return "Page{" + id + ", " + attributes + "}";
    }
}
