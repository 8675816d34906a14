package me.christianrobert.substation.dsl.builder;

import me.christianrobert.substation.antlr.SubstationDslParser;
import me.christianrobert.substation.dsl.ir.ObjectKind;
import me.christianrobert.substation.dsl.ir.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Static helpers for reactive compensation equipment.
 */
public class VisitCompensation {

    public static Void v(SubstationDslParser.AddShuntCapBankContext ctx, SubstationIrBuilder b) {
        b.object(ObjectKind.SHUNT_CAP_BANK, ctx)
                .id(ctx.id)
                .number("kv", ctx.kv)
                .number("mvar_total", ctx.mvarTotal)
                .number("steps", ctx.steps)
                .identifier("connection", ctx.connection)
                .composite("tuning", tuning(ctx.tuning))
                .extension(ctx.extension())
                .register();
        return null;
    }

    public static Void v(SubstationDslParser.AddShuntReactorContext ctx, SubstationIrBuilder b) {
        b.object(ObjectKind.SHUNT_REACTOR, ctx)
                .id(ctx.id)
                .number("kv", ctx.kv)
                .number("mvar", ctx.mvar)
                .bool("switchable", ctx.switchable)
                .extension(ctx.extension())
                .register();
        return null;
    }

    public static Void v(SubstationDslParser.AddSeriesCapContext ctx, SubstationIrBuilder b) {
        b.object(ObjectKind.SERIES_CAP, ctx)
                .id(ctx.id)
                .number("kv", ctx.kv)
                .number("compensation_pct", ctx.compensationPct)
                .identifier("protection", ctx.protection)
                .extension(ctx.extension())
                .register();
        return null;
    }

    public static Void v(SubstationDslParser.AddSvcContext ctx, SubstationIrBuilder b) {
        b.object(ObjectKind.SVC, ctx)
                .id(ctx.id)
                .number("kv", ctx.kv)
                .numberRange("mvar_range", ctx.mvarRange)
                .identifier("control_mode", ctx.controlMode)
                .optionalNumber("response_ms", ctx.responseMs)
                .extension(ctx.extension())
                .register();
        return null;
    }

    // Same shape as SVC, distinct kind.
    public static Void v(SubstationDslParser.AddStatcomContext ctx, SubstationIrBuilder b) {
        b.object(ObjectKind.STATCOM, ctx)
                .id(ctx.id)
                .number("kv", ctx.kv)
                .numberRange("mvar_range", ctx.mvarRange)
                .identifier("control_mode", ctx.controlMode)
                .optionalNumber("response_ms", ctx.responseMs)
                .extension(ctx.extension())
                .register();
        return null;
    }

    static Map<String, Value> tuning(SubstationDslParser.TuningSettingsContext ctx) {
        if (ctx == null) {
            return null;
        }
        Map<String, Value> tuning = new LinkedHashMap<>();
        tuning.put("tuned_Hz", VisitValue.number(ctx.tunedHz));
        tuning.put("Q_factor", VisitValue.number(ctx.qFactor));
        return tuning;
    }
}
