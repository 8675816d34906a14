package me.christianrobert.substation.dsl.builder;

import me.christianrobert.substation.antlr.SubstationDslParser;
import me.christianrobert.substation.dsl.ir.BayAssignment;
import me.christianrobert.substation.dsl.ir.ChainElement;
import me.christianrobert.substation.dsl.ir.ConnectionChain;
import me.christianrobert.substation.dsl.ir.ObjectRef;
import me.christianrobert.substation.dsl.ir.Terminal;
import me.christianrobert.substation.dsl.ir.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Static helpers for CONNECT and APPEND_TO_BAY.
 *
 * Chains are recorded exactly as written. References stay unresolved and terminal
 * placement is left to the validator.
 */
public class VisitTopology {

    // CONNECT series=[item, ...]
    public static Void v(SubstationDslParser.ConnectStmtContext ctx, SubstationIrBuilder b) {
        List<ChainElement> elements = new ArrayList<>();
        for (SubstationDslParser.SeriesItemContext item : ctx.seriesItem()) {
            elements.add(element(item));
        }

        Map<String, Value> attributes = ctx.extension() != null
                ? VisitValue.block(ctx.extension().block())
                : Map.of();

        b.getAssembly().addChain(new ConnectionChain(elements, attributes, SubstationIrBuilder.location(ctx)));
        return null;
    }

    // APPEND_TO_BAY bay_id=<id>, object_id=<id>
    public static Void v(SubstationDslParser.AppendToBayStmtContext ctx, SubstationIrBuilder b) {
        b.getAssembly().addBayAssignment(new BayAssignment(
                ctx.bayId.getText(),
                ctx.objectId.getText(),
                SubstationIrBuilder.location(ctx)));
        return null;
    }

    private static ChainElement element(SubstationDslParser.SeriesItemContext item) {
        if (item instanceof SubstationDslParser.OpenEndItemContext) {
            return Terminal.openEnd();
        }
        if (item instanceof SubstationDslParser.StubItemContext) {
            SubstationDslParser.StubItemContext stub = (SubstationDslParser.StubItemContext) item;
            return Terminal.stub(VisitValue.text(stub.stubLabel).asText());
        }
        return new ObjectRef(((SubstationDslParser.ObjectRefItemContext) item).ident().getText());
    }
}
