package me.christianrobert.substation.dsl.builder;

import me.christianrobert.substation.antlr.SubstationDslParser;
import me.christianrobert.substation.dsl.ir.Label;
import me.christianrobert.substation.dsl.ir.Page;
import me.christianrobert.substation.dsl.ir.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Static helpers for PAGE, STYLE, LABEL and SET_LAYOUT.
 * The content is retained for renderers and not interpreted.
 */
public class VisitPresentation {

    public static Void v(SubstationDslParser.PageStmtContext ctx, SubstationIrBuilder b) {
        Map<String, Value> attributes = new LinkedHashMap<>();
        attributes.put("id", VisitValue.identifier(ctx.id));
        attributes.put("title", VisitValue.text(ctx.title));
        attributes.put("voltage_scope", VisitValue.numberList(ctx.voltageScope));
        attributes.put("buses", VisitValue.identList(ctx.buses));
        attributes.put("bays", VisitValue.identList(ctx.bays));
        if (ctx.routing != null) {
            attributes.put("routing", Value.composite(VisitValue.block(ctx.routing)));
        }

        Map<String, Value> extension = ctx.extension() != null ? VisitValue.block(ctx.extension().block()) : null;
        b.getAssembly().addPage(new Page(
                ctx.id.getText(),
                Attributes.mergeExtension(attributes, extension),
                SubstationIrBuilder.location(ctx)));
        return null;
    }

    public static Void v(SubstationDslParser.StyleStmtContext ctx, SubstationIrBuilder b) {
        b.getAssembly().mergeStyle(VisitValue.pairList(ctx.pairList()));
        return null;
    }

    public static Void v(SubstationDslParser.LabelStmtContext ctx, SubstationIrBuilder b) {
        b.getAssembly().addLabel(new Label(VisitValue.pairList(ctx.pairList()), SubstationIrBuilder.location(ctx)));
        return null;
    }

    public static Void v(SubstationDslParser.LayoutStmtContext ctx, SubstationIrBuilder b) {
        b.getAssembly().mergeLayout(VisitValue.pairList(ctx.pairList()));
        return null;
    }
}
