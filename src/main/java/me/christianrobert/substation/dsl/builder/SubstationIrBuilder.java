package me.christianrobert.substation.dsl.builder;

import me.christianrobert.substation.antlr.SubstationDslBaseVisitor;
import me.christianrobert.substation.antlr.SubstationDslParser;
import me.christianrobert.substation.dsl.ir.ObjectKind;
import me.christianrobert.substation.dsl.ir.SourceLocation;
import me.christianrobert.substation.dsl.ir.SubstationIr;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;

/**
 * Walks a script syntax tree and assembles the {@link SubstationIr}.
 *
 * Each statement rule is delegated to a static {@code Visit*} helper. The builder owns
 * a fresh {@link IrAssembly} and is single-use: create one per parse.
 */
public class SubstationIrBuilder extends SubstationDslBaseVisitor<Void> {

    // no logging here, the service logs per script

    private final IrAssembly assembly = new IrAssembly();
    private boolean used;

    /**
     * Builds the IR for a whole script.
     *
     * @throws me.christianrobert.substation.dsl.context.SemanticException on the first transform-time error
     * @throws IllegalStateException if this builder was already used
     */
    public SubstationIr build(SubstationDslParser.ScriptContext tree) {
        if (used) {
            throw new IllegalStateException("SubstationIrBuilder is single-use; create a new instance per parse");
        }
        used = true;
        visit(tree);
        return assembly.toIr();
    }

    public IrAssembly getAssembly() {
        return assembly;
    }

    /**
     * Starts collecting an object declared by the given statement.
     */
    public ObjectDraft object(ObjectKind kind, ParserRuleContext ctx) {
        return new ObjectDraft(assembly, kind, location(ctx));
    }

    /**
     * 1-based location of the first token of a statement.
     */
    public static SourceLocation location(ParserRuleContext ctx) {
        Token start = ctx.getStart();
        return new SourceLocation(start.getLine(), start.getCharPositionInLine() + 1);
    }

    @Override
    public Void visitStatement(SubstationDslParser.StatementContext ctx) {
        assembly.countStatement();
        return visitChildren(ctx);
    }

    // ========== SWITCHGEAR ==========

    @Override
    public Void visitAddBus(SubstationDslParser.AddBusContext ctx) {
        return VisitSwitchgear.v(ctx, this);
    }

    @Override
    public Void visitAddBay(SubstationDslParser.AddBayContext ctx) {
        return VisitSwitchgear.v(ctx, this);
    }

    @Override
    public Void visitAddCoupler(SubstationDslParser.AddCouplerContext ctx) {
        return VisitSwitchgear.v(ctx, this);
    }

    @Override
    public Void visitAddBreaker(SubstationDslParser.AddBreakerContext ctx) {
        return VisitSwitchgear.v(ctx, this);
    }

    @Override
    public Void visitAddDisconnector(SubstationDslParser.AddDisconnectorContext ctx) {
        return VisitSwitchgear.v(ctx, this);
    }

    @Override
    public Void visitAddEarthingSwitch(SubstationDslParser.AddEarthingSwitchContext ctx) {
        return VisitSwitchgear.v(ctx, this);
    }

    // ========== MEASUREMENT AND PROTECTION ==========

    @Override
    public Void visitAddCt(SubstationDslParser.AddCtContext ctx) {
        return VisitMeasurementAndProtection.v(ctx, this);
    }

    @Override
    public Void visitAddVt(SubstationDslParser.AddVtContext ctx) {
        return VisitMeasurementAndProtection.v(ctx, this);
    }

    @Override
    public Void visitAddRelayGroup(SubstationDslParser.AddRelayGroupContext ctx) {
        return VisitMeasurementAndProtection.v(ctx, this);
    }

    @Override
    public Void visitAddSurgeArrester(SubstationDslParser.AddSurgeArresterContext ctx) {
        return VisitMeasurementAndProtection.v(ctx, this);
    }

    @Override
    public Void visitAddLineTrap(SubstationDslParser.AddLineTrapContext ctx) {
        return VisitMeasurementAndProtection.v(ctx, this);
    }

    // ========== POWER EQUIPMENT ==========

    @Override
    public Void visitAddTransformer(SubstationDslParser.AddTransformerContext ctx) {
        return VisitPowerEquipment.v(ctx, this);
    }

    @Override
    public Void visitAddLine(SubstationDslParser.AddLineContext ctx) {
        return VisitPowerEquipment.v(ctx, this);
    }

    @Override
    public Void visitAddCable(SubstationDslParser.AddCableContext ctx) {
        return VisitPowerEquipment.v(ctx, this);
    }

    @Override
    public Void visitAddStationServiceTransformer(SubstationDslParser.AddStationServiceTransformerContext ctx) {
        return VisitPowerEquipment.v(ctx, this);
    }

    @Override
    public Void visitAddDcSystem(SubstationDslParser.AddDcSystemContext ctx) {
        return VisitPowerEquipment.v(ctx, this);
    }

    // ========== COMPENSATION ==========

    @Override
    public Void visitAddShuntCapBank(SubstationDslParser.AddShuntCapBankContext ctx) {
        return VisitCompensation.v(ctx, this);
    }

    @Override
    public Void visitAddShuntReactor(SubstationDslParser.AddShuntReactorContext ctx) {
        return VisitCompensation.v(ctx, this);
    }

    @Override
    public Void visitAddSeriesCap(SubstationDslParser.AddSeriesCapContext ctx) {
        return VisitCompensation.v(ctx, this);
    }

    @Override
    public Void visitAddSvc(SubstationDslParser.AddSvcContext ctx) {
        return VisitCompensation.v(ctx, this);
    }

    @Override
    public Void visitAddStatcom(SubstationDslParser.AddStatcomContext ctx) {
        return VisitCompensation.v(ctx, this);
    }

    // ========== TOPOLOGY ==========

    @Override
    public Void visitConnectStmt(SubstationDslParser.ConnectStmtContext ctx) {
        return VisitTopology.v(ctx, this);
    }

    @Override
    public Void visitAppendToBayStmt(SubstationDslParser.AppendToBayStmtContext ctx) {
        return VisitTopology.v(ctx, this);
    }

    // ========== PRESENTATION AND DIRECTIVES ==========

    @Override
    public Void visitPageStmt(SubstationDslParser.PageStmtContext ctx) {
        return VisitPresentation.v(ctx, this);
    }

    @Override
    public Void visitStyleStmt(SubstationDslParser.StyleStmtContext ctx) {
        return VisitPresentation.v(ctx, this);
    }

    @Override
    public Void visitLabelStmt(SubstationDslParser.LabelStmtContext ctx) {
        return VisitPresentation.v(ctx, this);
    }

    @Override
    public Void visitLayoutStmt(SubstationDslParser.LayoutStmtContext ctx) {
        return VisitPresentation.v(ctx, this);
    }

    @Override
    public Void visitValidateStmt(SubstationDslParser.ValidateStmtContext ctx) {
        assembly.requestValidation();
        return null;
    }

    @Override
    public Void visitEmitSpecStmt(SubstationDslParser.EmitSpecStmtContext ctx) {
        assembly.requestEmit();
        return null;
    }
}
