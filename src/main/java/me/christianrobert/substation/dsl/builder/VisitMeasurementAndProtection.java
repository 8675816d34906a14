package me.christianrobert.substation.dsl.builder;

import me.christianrobert.substation.antlr.SubstationDslParser;
import me.christianrobert.substation.dsl.ir.ObjectKind;

/**
 * Static helpers for instrument transformers, relay groups, surge arresters and line traps.
 */
public class VisitMeasurementAndProtection {

    // ratio and class accept any value: 2000/5 style ratios are written as text or identifiers
    public static Void v(SubstationDslParser.AddCtContext ctx, SubstationIrBuilder b) {
        b.object(ObjectKind.CT, ctx)
                .id(ctx.id)
                .number("kv", ctx.kv)
                .value("ratio", ctx.ratio)
                .value("class", ctx.accuracyClass)
                .optionalNumber("burden_VA", ctx.burdenVa)
                .extension(ctx.extension())
                .register();
        return null;
    }

    public static Void v(SubstationDslParser.AddVtContext ctx, SubstationIrBuilder b) {
        b.object(ObjectKind.VT, ctx)
                .id(ctx.id)
                .number("kv", ctx.kv)
                .identifier("type", ctx.type)
                .value("ratio", ctx.ratio)
                .value("class", ctx.accuracyClass)
                .extension(ctx.extension())
                .register();
        return null;
    }

    // no kv: relay groups sit on the DC side
    public static Void v(SubstationDslParser.AddRelayGroupContext ctx, SubstationIrBuilder b) {
        b.object(ObjectKind.RELAY_GROUP, ctx)
                .id(ctx.id)
                .identList("functions", ctx.functions)
                .identifier("dc_supply", ctx.dcSupply)
                .optionalIdentList("trip_objects", ctx.tripObjects)
                .extension(ctx.extension())
                .register();
        return null;
    }

    public static Void v(SubstationDslParser.AddSurgeArresterContext ctx, SubstationIrBuilder b) {
        b.object(ObjectKind.SURGE_ARRESTER, ctx)
                .id(ctx.id)
                .number("kv", ctx.kv)
                .number("mcov_kV", ctx.mcovKv)
                .value("class", ctx.arresterClass)
                .extension(ctx.extension())
                .register();
        return null;
    }

    public static Void v(SubstationDslParser.AddLineTrapContext ctx, SubstationIrBuilder b) {
        b.object(ObjectKind.LINE_TRAP, ctx)
                .id(ctx.id)
                .number("kv", ctx.kv)
                .number("carrier_kHz", ctx.carrierKhz)
                .extension(ctx.extension())
                .register();
        return null;
    }
}
