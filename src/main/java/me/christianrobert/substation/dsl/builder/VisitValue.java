package me.christianrobert.substation.dsl.builder;

import me.christianrobert.substation.antlr.SubstationDslParser;
import me.christianrobert.substation.dsl.ir.Value;
import org.antlr.v4.runtime.ParserRuleContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static helper for converting literal subtrees into typed {@link Value}s.
 *
 * <p>Coercion rules:</p>
 * <ul>
 *   <li>NUMBER → {@code double}</li>
 *   <li>STRING → text without its delimiters</li>
 *   <li>identifiers and enum words → IDENTIFIER</li>
 *   <li>{@code true}/{@code false} → BOOLEAN</li>
 *   <li>{@code [..]} → LIST, {@code {k=v, ..}} → COMPOSITE</li>
 * </ul>
 */
public class VisitValue {

    public static Value v(SubstationDslParser.ValueContext ctx) {
        if (ctx instanceof SubstationDslParser.NumberValueContext) {
            return number(((SubstationDslParser.NumberValueContext) ctx).number());
        }
        if (ctx instanceof SubstationDslParser.TextValueContext) {
            return text(((SubstationDslParser.TextValueContext) ctx).text());
        }
        if (ctx instanceof SubstationDslParser.BooleanValueContext) {
            return bool(((SubstationDslParser.BooleanValueContext) ctx).bool());
        }
        if (ctx instanceof SubstationDslParser.ListValueContext) {
            List<Value> items = new ArrayList<>();
            for (SubstationDslParser.ValueContext item : ((SubstationDslParser.ListValueContext) ctx).value()) {
                items.add(v(item));
            }
            return Value.list(items);
        }
        if (ctx instanceof SubstationDslParser.CompositeValueContext) {
            return Value.composite(block(((SubstationDslParser.CompositeValueContext) ctx).block()));
        }
        if (ctx instanceof SubstationDslParser.IdentifierValueContext) {
            return identifier(((SubstationDslParser.IdentifierValueContext) ctx).ident());
        }
        throw new IllegalStateException("Unknown value alternative: " + ctx.getClass().getSimpleName());
    }

    public static Value number(SubstationDslParser.NumberContext ctx) {
        return Value.number(Double.parseDouble(ctx.getText()));
    }

    public static Value text(SubstationDslParser.TextContext ctx) {
        return Value.text(unquote(ctx.getText()));
    }

    public static Value bool(SubstationDslParser.BoolContext ctx) {
        return Value.bool("true".equals(ctx.getText()));
    }

    public static Value identifier(SubstationDslParser.IdentContext ctx) {
        return Value.identifier(ctx.getText());
    }

    /**
     * Enum keyword slots (bay kind, breaker type, ...) are kept as identifiers.
     */
    public static Value keyword(ParserRuleContext ctx) {
        return Value.identifier(ctx.getText());
    }

    public static Value identList(SubstationDslParser.IdentListContext ctx) {
        List<Value> items = new ArrayList<>();
        for (SubstationDslParser.IdentContext ident : ctx.ident()) {
            items.add(identifier(ident));
        }
        return Value.list(items);
    }

    public static Value numberList(SubstationDslParser.NumberListContext ctx) {
        List<Value> items = new ArrayList<>();
        for (SubstationDslParser.NumberContext number : ctx.number()) {
            items.add(number(number));
        }
        return Value.list(items);
    }

    /**
     * {@code [min, max]} becomes a two-element number list.
     */
    public static Value numberRange(SubstationDslParser.NumberRangeContext ctx) {
        return Value.list(List.of(number(ctx.low), number(ctx.high)));
    }

    /**
     * Converts {@code {k=v, ...}}; a repeated key keeps its first position and takes the last value.
     */
    public static Map<String, Value> block(SubstationDslParser.BlockContext ctx) {
        return pairs(ctx.pair());
    }

    public static Map<String, Value> pairList(SubstationDslParser.PairListContext ctx) {
        return pairs(ctx.pair());
    }

    private static Map<String, Value> pairs(List<SubstationDslParser.PairContext> pairs) {
        Map<String, Value> out = new LinkedHashMap<>();
        for (SubstationDslParser.PairContext pair : pairs) {
            out.put(pair.key.getText(), v(pair.val));
        }
        return out;
    }

    /**
     * Strips the surrounding quotes and resolves backslash escapes.
     */
    static String unquote(String literal) {
        String body = literal.substring(1, literal.length() - 1);
        if (body.indexOf('\\') < 0) {
            return body;
        }
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                char next = body.charAt(++i);
                switch (next) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    default -> sb.append(next);
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
