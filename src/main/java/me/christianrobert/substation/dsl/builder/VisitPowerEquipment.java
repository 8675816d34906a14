package me.christianrobert.substation.dsl.builder;

import me.christianrobert.substation.antlr.SubstationDslParser;
import me.christianrobert.substation.dsl.ir.ObjectKind;
import me.christianrobert.substation.dsl.ir.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Static helpers for transformers, lines, cables, station service transformers and DC systems.
 */
public class VisitPowerEquipment {

    // Transformers carry no kv of their own; they bridge two voltage levels.
    public static Void v(SubstationDslParser.AddTransformerContext ctx, SubstationIrBuilder b) {
        b.object(ObjectKind.TRANSFORMER, ctx)
                .id(ctx.id)
                .keyword("type", ctx.type)
                .number("rated_MVA", ctx.ratedMva)
                .text("vector_group", ctx.vectorGroup)
                .number("percentZ", ctx.percentZ)
                .composite("tap", tap(ctx.tap))
                .extension(ctx.extension())
                .register();
        return null;
    }

    public static Void v(SubstationDslParser.AddLineContext ctx, SubstationIrBuilder b) {
        b.object(ObjectKind.LINE, ctx)
                .id(ctx.id)
                .number("kv", ctx.kv)
                .keyword("type", ctx.type)
                .number("length_km", ctx.lengthKm)
                .number("thermal_A", ctx.thermalA)
                .composite("seq_params", seqParams(ctx.seq))
                .extension(ctx.extension())
                .register();
        return null;
    }

    public static Void v(SubstationDslParser.AddCableContext ctx, SubstationIrBuilder b) {
        b.object(ObjectKind.CABLE, ctx)
                .id(ctx.id)
                .number("kv", ctx.kv)
                .number("length_km", ctx.lengthKm)
                .number("thermal_A", ctx.thermalA)
                .identifier("insulation", ctx.insulation)
                .composite("seq_params", seqParams(ctx.seq))
                .extension(ctx.extension())
                .register();
        return null;
    }

    public static Void v(SubstationDslParser.AddStationServiceTransformerContext ctx, SubstationIrBuilder b) {
        b.object(ObjectKind.STATION_SERVICE_TRANSFORMER, ctx)
                .id(ctx.id)
                .number("primary_kv", ctx.primaryKv)
                .number("secondary_kV", ctx.secondaryKv)
                .number("kVA", ctx.kva)
                .extension(ctx.extension())
                .register();
        return null;
    }

    public static Void v(SubstationDslParser.AddDcSystemContext ctx, SubstationIrBuilder b) {
        b.object(ObjectKind.DC_SYSTEM, ctx)
                .id(ctx.id)
                .number("nominal_V", ctx.nominalV)
                .number("capacity_Ah", ctx.capacityAh)
                .identifier("redundancy", ctx.redundancy)
                .extension(ctx.extension())
                .register();
        return null;
    }

    static Map<String, Value> tap(SubstationDslParser.TapSettingsContext ctx) {
        if (ctx == null) {
            return null;
        }
        Map<String, Value> tap = new LinkedHashMap<>();
        tap.put("side", VisitValue.identifier(ctx.side));
        tap.put("range_pct", VisitValue.number(ctx.rangePct));
        tap.put("steps", VisitValue.number(ctx.steps));
        if (ctx.regulationMode != null) {
            tap.put("regulation_mode", VisitValue.identifier(ctx.regulationMode));
        }
        return tap;
    }

    static Map<String, Value> seqParams(SubstationDslParser.SeqParamsContext ctx) {
        if (ctx == null) {
            return null;
        }
        Map<String, Value> seq = new LinkedHashMap<>();
        seq.put("R1_ohm_per_km", VisitValue.number(ctx.r1));
        seq.put("X1_ohm_per_km", VisitValue.number(ctx.x1));
        putIfPresent(seq, "B1_uS_per_km", ctx.b1);
        putIfPresent(seq, "R0_ohm_per_km", ctx.r0);
        putIfPresent(seq, "X0_ohm_per_km", ctx.x0);
        putIfPresent(seq, "B0_uS_per_km", ctx.b0);
        return seq;
    }

    private static void putIfPresent(Map<String, Value> target, String key, SubstationDslParser.NumberContext ctx) {
        if (ctx != null) {
            target.put(key, VisitValue.number(ctx));
        }
    }
}
