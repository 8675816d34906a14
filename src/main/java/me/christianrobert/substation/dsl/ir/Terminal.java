package me.christianrobert.substation.dsl.ir;

import java.util.Objects;

/**
 * Non-object placeholder at the edge of a chain.
 *
 * <ul>
 *   <li>{@code OPEN_END}: connection point intentionally left unterminated</li>
 *   <li>{@code STUB("label")}: named reference to something outside this document</li>
 * </ul>
 */
public class Terminal implements ChainElement {

    public enum Type {
        OPEN_END,
        STUB
    }

    private static final Terminal OPEN_END = new Terminal(Type.OPEN_END, null);

    private final Type type;
    private final String label;

    private Terminal(Type type, String label) {
        this.type = type;
        this.label = label;
    }

    public static Terminal openEnd() {
        return OPEN_END;
    }

    public static Terminal stub(String label) {
        return new Terminal(Type.STUB, Objects.requireNonNull(label, "label"));
    }

    public Type getType() {
        return type;
    }

    /**
     * @return the stub label, or null for {@code OPEN_END}
     */
    public String getLabel() {
        return label;
    }

    public boolean isOpenEnd() {
        return type == Type.OPEN_END;
    }

    @Override
    public boolean isTerminal() {
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Terminal)) return false;
        Terminal that = (Terminal) o;
        return type == that.type && Objects.equals(label, that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, label);
    }

    @Override
    public String toString() {
        return type == Type.OPEN_END ? "OPEN_END" : "STUB(\"" + label + "\")";
    }
}
