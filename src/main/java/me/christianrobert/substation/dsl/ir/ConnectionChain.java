package me.christianrobert.substation.dsl.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Ordered series connection declared by one {@code CONNECT} statement.
 *
 * <p>Elements are kept exactly as written: no sorting, no de-duplication, and terminal
 * placement is not checked here (the validator owns that rule).</p>
 */
public class ConnectionChain {

    private final List<ChainElement> elements;
    private final Map<String, Value> attributes;
    private final SourceLocation location;

    public ConnectionChain(List<ChainElement> elements, SourceLocation location) {
        this(elements, Map.of(), location);
    }

    public ConnectionChain(List<ChainElement> elements, Map<String, Value> attributes, SourceLocation location) {
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.location = location;
    }

    public List<ChainElement> getElements() {
        return elements;
    }

    /**
     * Attributes from the optional extension block of the CONNECT statement.
     */
    public Map<String, Value> getAttributes() {
        return attributes;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    /**
     * Ids of the plain object references in chain order (terminals skipped).
     */
    public List<String> getObjectIds() {
        return elements.stream()
                .filter(element -> !element.isTerminal())
                .map(element -> ((ObjectRef) element).getId())
                .collect(Collectors.toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConnectionChain)) return false;
        ConnectionChain that = (ConnectionChain) o;
        return elements.equals(that.elements)
                && attributes.equals(that.attributes)
                && Objects.equals(location, that.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elements, attributes, location);
    }

    @Override
    public String toString() {
        return elements.stream().map(Object::toString).collect(Collectors.joining(" -> ", "[", "]"));
    }
}
