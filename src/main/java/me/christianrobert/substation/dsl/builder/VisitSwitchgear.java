package me.christianrobert.substation.dsl.builder;

import me.christianrobert.substation.antlr.SubstationDslParser;
import me.christianrobert.substation.dsl.ir.ObjectKind;

/**
 * Static helpers for bus, bay, coupler, breaker, disconnector and earthing switch statements.
 */
public class VisitSwitchgear {

    // ADD_BUS id=<id>, kv=<num>
    public static Void v(SubstationDslParser.AddBusContext ctx, SubstationIrBuilder b) {
        b.object(ObjectKind.BUS, ctx)
                .id(ctx.id)
                .number("kv", ctx.kv)
                .extension(ctx.extension())
                .register();
        return null;
    }

    // ADD_BAY id=<id>, kind=<bayKind>, kv=<num>, bus=<id>
    public static Void v(SubstationDslParser.AddBayContext ctx, SubstationIrBuilder b) {
        b.object(ObjectKind.BAY, ctx)
                .id(ctx.id)
                .keyword("kind", ctx.kind)
                .number("kv", ctx.kv)
                .identifier("bus", ctx.bus)
                .extension(ctx.extension())
                .register();
        return null;
    }

    // ADD_COUPLER id=<id>, kv=<num>, from_bus=<id>, to_bus=<id>
    public static Void v(SubstationDslParser.AddCouplerContext ctx, SubstationIrBuilder b) {
        b.object(ObjectKind.COUPLER, ctx)
                .id(ctx.id)
                .number("kv", ctx.kv)
                .identifier("from_bus", ctx.fromBus)
                .identifier("to_bus", ctx.toBus)
                .extension(ctx.extension())
                .register();
        return null;
    }

    public static Void v(SubstationDslParser.AddBreakerContext ctx, SubstationIrBuilder b) {
        b.object(ObjectKind.BREAKER, ctx)
                .id(ctx.id)
                .number("kv", ctx.kv)
                .number("interrupting_kA", ctx.interruptingKa)
                .keyword("type", ctx.type)
                .number("continuous_A", ctx.continuousA)
                .extension(ctx.extension())
                .register();
        return null;
    }

    public static Void v(SubstationDslParser.AddDisconnectorContext ctx, SubstationIrBuilder b) {
        b.object(ObjectKind.DISCONNECTOR, ctx)
                .id(ctx.id)
                .number("kv", ctx.kv)
                .keyword("type", ctx.type)
                .number("continuous_A", ctx.continuousA)
                .extension(ctx.extension())
                .register();
        return null;
    }

    public static Void v(SubstationDslParser.AddEarthingSwitchContext ctx, SubstationIrBuilder b) {
        b.object(ObjectKind.EARTHING_SWITCH, ctx)
                .id(ctx.id)
                .number("kv", ctx.kv)
                .number("make_kA", ctx.makeKa)
                .extension(ctx.extension())
                .register();
        return null;
    }
}
