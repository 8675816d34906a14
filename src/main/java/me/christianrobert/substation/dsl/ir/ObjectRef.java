package me.christianrobert.substation.dsl.ir;

import java.util.Objects;

/**
 * Reference to an object by id inside a connection chain.
 * Not resolved at build time; the id may name an object declared later or nowhere at all.
 */
public class ObjectRef implements ChainElement {

    private final String id;

    public ObjectRef(String id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    public String getId() {
        return id;
    }

    @Override
    public boolean isTerminal() {
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ObjectRef)) return false;
        return id.equals(((ObjectRef) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return id;
    }
}
