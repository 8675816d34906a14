package me.christianrobert.substation.dsl.builder;

import me.christianrobert.substation.antlr.SubstationDslParser;
import me.christianrobert.substation.dsl.context.SemanticErrorCode;
import me.christianrobert.substation.dsl.context.TransformationException;
import me.christianrobert.substation.dsl.ir.ObjectKind;
import me.christianrobert.substation.dsl.ir.SourceLocation;
import me.christianrobert.substation.dsl.ir.SubstationObject;
import me.christianrobert.substation.dsl.ir.Value;
import org.antlr.v4.runtime.ParserRuleContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Collects the attributes of one {@code ADD_<KIND>} statement from its named grammar slots.
 *
 * <pre>
 * b.object(ObjectKind.BUS, ctx)
 *     .id(ctx.id)
 *     .number("kv", ctx.kv)
 *     .extension(ctx.extension())
 *     .register();
 * </pre>
 *
 * Required slots that are null (only possible for trees built by error recovery) are reported
 * on {@link #register()} as {@code E.ATTR.MISSING}; optional slots that are null are skipped.
 */
public class ObjectDraft {

    private final IrAssembly assembly;
    private final ObjectKind kind;
    private final SourceLocation location;
    private final Map<String, Value> attributes = new LinkedHashMap<>();
    private final List<String> missing = new ArrayList<>();
    private Map<String, Value> extension;
    private String id;

    public ObjectDraft(IrAssembly assembly, ObjectKind kind, SourceLocation location) {
        this.assembly = assembly;
        this.kind = kind;
        this.location = location;
    }

    public ObjectDraft id(SubstationDslParser.IdentContext ctx) {
        if (ctx != null) {
            id = ctx.getText();
            attributes.put("id", Value.identifier(id));
        }
        return this;
    }

    public ObjectDraft number(String name, SubstationDslParser.NumberContext ctx) {
        return required(name, ctx, VisitValue::number);
    }

    public ObjectDraft optionalNumber(String name, SubstationDslParser.NumberContext ctx) {
        return optional(name, ctx, VisitValue::number);
    }

    public ObjectDraft identifier(String name, SubstationDslParser.IdentContext ctx) {
        return required(name, ctx, VisitValue::identifier);
    }

    /**
     * Enum keyword slot such as {@code type=SF6} or {@code kind=LINE}.
     */
    public ObjectDraft keyword(String name, ParserRuleContext ctx) {
        return required(name, ctx, VisitValue::keyword);
    }

    public ObjectDraft text(String name, SubstationDslParser.TextContext ctx) {
        return required(name, ctx, VisitValue::text);
    }

    public ObjectDraft bool(String name, SubstationDslParser.BoolContext ctx) {
        return required(name, ctx, VisitValue::bool);
    }

    public ObjectDraft value(String name, SubstationDslParser.ValueContext ctx) {
        return required(name, ctx, VisitValue::v);
    }

    public ObjectDraft identList(String name, SubstationDslParser.IdentListContext ctx) {
        return required(name, ctx, VisitValue::identList);
    }

    public ObjectDraft optionalIdentList(String name, SubstationDslParser.IdentListContext ctx) {
        return optional(name, ctx, VisitValue::identList);
    }

    public ObjectDraft numberRange(String name, SubstationDslParser.NumberRangeContext ctx) {
        return required(name, ctx, VisitValue::numberRange);
    }

    /**
     * Optional nested group (tap, tuning, seq_params); skipped when null.
     */
    public ObjectDraft composite(String name, Map<String, Value> entries) {
        if (entries != null) {
            attributes.put(name, Value.composite(entries));
        }
        return this;
    }

    public ObjectDraft extension(SubstationDslParser.ExtensionContext ctx) {
        if (ctx != null) {
            extension = VisitValue.block(ctx.block());
        }
        return this;
    }

    /**
     * Merges the extension block and registers the object.
     *
     * @throws TransformationException with {@code E.ATTR.MISSING} if a required slot was null
     */
    public SubstationObject register() {
        if (!missing.isEmpty()) {
            throw new TransformationException(SemanticErrorCode.ATTR_MISSING,
                    "Missing attribute(s) " + missing + " in " + kind.statementKeyword()
                            + (id != null ? " '" + id + "'" : ""),
                    location);
        }
        return assembly.registerObject(kind, id, Attributes.mergeExtension(attributes, extension), location);
    }

    private <C extends ParserRuleContext> ObjectDraft required(String name, C ctx, Function<C, Value> convert) {
        if (ctx == null) {
            missing.add(name);
        } else {
            attributes.put(name, convert.apply(ctx));
        }
        return this;
    }

    private <C extends ParserRuleContext> ObjectDraft optional(String name, C ctx, Function<C, Value> convert) {
        if (ctx != null) {
            attributes.put(name, convert.apply(ctx));
        }
        return this;
    }
}
