package me.christianrobert.substation.dsl.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Free-form diagram annotation from a {@code LABEL} statement. Not interpreted here.
 */
public class Label {

    private final Map<String, Value> attributes;
    private final SourceLocation location;

    public Label(Map<String, Value> attributes, SourceLocation location) {
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.location = location;
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
        if (!(o instanceof Label)) return false;
        Label that = (Label) o;
        return attributes.equals(that.attributes) && Objects.equals(location, that.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attributes, location);
    }

    @Override
    public String toString() {
        return "Label" + attributes;
    }
}
