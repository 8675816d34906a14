package me.christianrobert.substation.dsl.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Typed attribute value produced from a DSL literal.
 *
 * <p>Tagged union over {@link Kind}. Consumers switch on {@link #getKind()} and use the
 * matching accessor; calling an accessor for another kind throws {@link IllegalStateException}.</p>
 *
 * <pre>
 * kv=138              → NUMBER(138.0)
 * vector_group="Dy11" → TEXT("Dy11")
 * type=SF6            → IDENTIFIER("SF6")
 * switchable=true     → BOOLEAN(true)
 * functions=[PDIF, PTOC] → LIST(IDENTIFIER, ...)
 * tap={side=HV, ...}  → COMPOSITE({side=IDENTIFIER("HV"), ...})
 * </pre>
 */
public final class Value {

    public enum Kind {
        IDENTIFIER,
        NUMBER,
        TEXT,
        BOOLEAN,
        LIST,
        COMPOSITE,
        TERMINAL
    }

    private final Kind kind;
    private final Object payload;

    private Value(Kind kind, Object payload) {
        this.kind = kind;
        this.payload = Objects.requireNonNull(payload, "payload");
    }

    public static Value identifier(String name) {
        return new Value(Kind.IDENTIFIER, name);
    }

    public static Value number(double number) {
        return new Value(Kind.NUMBER, number);
    }

    public static Value text(String text) {
        return new Value(Kind.TEXT, text);
    }

    public static Value bool(boolean flag) {
        return new Value(Kind.BOOLEAN, flag);
    }

    public static Value list(List<Value> items) {
        return new Value(Kind.LIST, Collections.unmodifiableList(new ArrayList<>(items)));
    }

    public static Value composite(Map<String, Value> entries) {
        return new Value(Kind.COMPOSITE, Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
    }

    public static Value terminal(Terminal terminal) {
        return new Value(Kind.TERMINAL, terminal);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isNumber() {
        return kind == Kind.NUMBER;
    }

    public String asIdentifier() {
        return (String) expect(Kind.IDENTIFIER);
    }

    public double asNumber() {
        return (Double) expect(Kind.NUMBER);
    }

    public String asText() {
        return (String) expect(Kind.TEXT);
    }

    public boolean asBoolean() {
        return (Boolean) expect(Kind.BOOLEAN);
    }

    @SuppressWarnings("unchecked")
    public List<Value> asList() {
        return (List<Value>) expect(Kind.LIST);
    }

    @SuppressWarnings("unchecked")
    public Map<String, Value> asComposite() {
        return (Map<String, Value>) expect(Kind.COMPOSITE);
    }

    public Terminal asTerminal() {
        return (Terminal) expect(Kind.TERMINAL);
    }

    /**
     * Converts to plain Java objects (String, Double, Boolean, List, Map, String for terminals).
     * Used for JSON output and debugging.
     */
    public Object toPlain() {
        return switch (kind) {
            case IDENTIFIER, NUMBER, TEXT, BOOLEAN -> payload;
            case LIST -> {
                List<Object> out = new ArrayList<>();
                for (Value item : asList()) {
                    out.add(item.toPlain());
                }
                yield out;
            }
            case COMPOSITE -> {
                Map<String, Object> out = new LinkedHashMap<>();
                asComposite().forEach((key, value) -> out.put(key, value.toPlain()));
                yield out;
            }
            case TERMINAL -> payload.toString();
        };
    }

    private Object expect(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Expected " + expected + " value but was " + kind + ": " + this);
        }
        return payload;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value that = (Value) o;
        return kind == that.kind && payload.equals(that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, payload);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case TEXT -> "\"" + payload + "\"";
            case NUMBER -> formatNumber((Double) payload);
            default -> String.valueOf(payload);
        };
    }

    private static String formatNumber(double number) {
        if (number == Math.rint(number) && !Double.isInfinite(number) && Math.abs(number) < 1e15) {
            return String.valueOf((long) number);
        }
        return String.valueOf(number);
    }
}
