package me.christianrobert.substation.dsl.builder;

import me.christianrobert.substation.dsl.context.DuplicateIdException;
import me.christianrobert.substation.dsl.context.SemanticErrorCode;
import me.christianrobert.substation.dsl.context.SemanticException;
import me.christianrobert.substation.dsl.context.TransformationException;
import me.christianrobert.substation.dsl.ir.BayAssignment;
import me.christianrobert.substation.dsl.ir.ConnectionChain;
import me.christianrobert.substation.dsl.ir.ObjectKind;
import me.christianrobert.substation.dsl.ir.ObjectRef;
import me.christianrobert.substation.dsl.ir.Page;
import me.christianrobert.substation.dsl.ir.SourceLocation;
import me.christianrobert.substation.dsl.ir.SubstationIr;
import me.christianrobert.substation.dsl.ir.SubstationObject;
import me.christianrobert.substation.dsl.ir.Terminal;
import me.christianrobert.substation.dsl.ir.Value;
import me.christianrobert.substation.dsl.parser.AntlrParser;
import me.christianrobert.substation.dsl.parser.ParseResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the tree-to-IR transformation: token coercion, attribute order, extension merge,
 * id registration, chains and the passively retained presentation statements.
 */
class SubstationIrBuilderTest {

    private AntlrParser parser;

    @BeforeEach
    void setUp() {
        parser = new AntlrParser();
    }

    private SubstationIr build(String dsl) {
        ParseResult parseResult = parser.parseScript(dsl);
        return new SubstationIrBuilder().build(parseResult.getTree());
    }

    // ==================== Objects ====================

    @Test
    void busWithNumericKv() {
        SubstationIr ir = build("ADD_BUS id=b1, kv=138");

        SubstationObject bus = ir.getObject("b1");
        assertNotNull(bus);
        assertEquals(ObjectKind.BUS, bus.getKind());
        assertEquals(Value.identifier("b1"), bus.getAttribute("id"));
        assertEquals(Value.number(138.0), bus.getAttribute("kv"));
        assertEquals(138.0, bus.getKv());
        assertEquals(new SourceLocation(1, 1), bus.getLocation());
    }

    @Test
    void breakerAttributesKeepGrammarOrder() {
        SubstationIr ir = build("ADD_BREAKER id=brk1, kv=138, interrupting_kA=40, type=SF6, continuous_A=2000");

        SubstationObject breaker = ir.getObject("brk1");
        assertEquals(List.of("id", "kv", "interrupting_kA", "type", "continuous_A"),
                List.copyOf(breaker.getAttributes().keySet()));
        assertEquals(Value.identifier("SF6"), breaker.getAttribute("type"));
        assertEquals(2000.0, breaker.getNumber("continuous_A"));
    }

    @Test
    void transformerTextAndTapComposite() {
        SubstationIr ir = build("ADD_TRANSFORMER id=main-tx-1, type=TWO_WINDING, rated_MVA=50, "
                + "vector_group=\"Dy11\", percentZ=8.5, tap={side=HV, range_pct=10, steps=17, regulation_mode=OLTC}");

        SubstationObject tx = ir.getObject("main-tx-1");
        assertEquals(Value.text("Dy11"), tx.getAttribute("vector_group"), "Quotes should be stripped");
        assertEquals(8.5, tx.getNumber("percentZ"));
        assertNull(tx.getKv(), "Transformers carry no kv");

        Map<String, Value> tap = tx.getAttribute("tap").asComposite();
        assertEquals(List.of("side", "range_pct", "steps", "regulation_mode"), List.copyOf(tap.keySet()));
        assertEquals(Value.identifier("HV"), tap.get("side"));
        assertEquals(17.0, tap.get("steps").asNumber());
    }

    @Test
    void lineWithPartialSequenceParameters() {
        SubstationIr ir = build("ADD_LINE id=l1, kv=230, type=OHL, length_km=80, thermal_A=2800, "
                + "seq_params={R1_ohm_per_km=0.05, X1_ohm_per_km=0.4, X0_ohm_per_km=1.2}");

        Map<String, Value> seq = ir.getObject("l1").getAttribute("seq_params").asComposite();
        assertEquals(List.of("R1_ohm_per_km", "X1_ohm_per_km", "X0_ohm_per_km"), List.copyOf(seq.keySet()));
        assertEquals(1.2, seq.get("X0_ohm_per_km").asNumber());
    }

    @Test
    void compensationEquipment() {
        SubstationIr ir = build("""
                ADD_SHUNT_CAP_BANK id=cap1, kv=34.5, mvar_total=30, steps=3, connection=WYE_UNGROUNDED, tuning={tuned_Hz=240, Q_factor=50}
                ADD_SHUNT_REACTOR id=r1, kv=500, mvar=150, switchable=true
                ADD_SERIES_CAP id=sc1, kv=500, compensation_pct=40, protection=MOV
                ADD_SVC id=svc1, kv=230, mvar_range=[-100, 200], control_mode=VOLTAGE, response_ms=30
                ADD_STATCOM id=st1, kv=138, mvar_range=[-50, 50], control_mode=VAR
                """);

        assertEquals(5, ir.objectCount());
        assertEquals(240.0, ir.getObject("cap1").getAttribute("tuning").asComposite().get("tuned_Hz").asNumber());
        assertEquals(Value.bool(true), ir.getObject("r1").getAttribute("switchable"));
        assertEquals(Value.list(List.of(Value.number(-100), Value.number(200))),
                ir.getObject("svc1").getAttribute("mvar_range"));
        assertEquals(30.0, ir.getObject("svc1").getNumber("response_ms"));
        assertFalse(ir.getObject("st1").hasAttribute("response_ms"));
        assertEquals(ObjectKind.STATCOM, ir.getObject("st1").getKind());
    }

    @Test
    void measurementAndProtectionEquipment() {
        SubstationIr ir = build("""
                ADD_CT id=ct1, kv=138, ratio="2000/5", class=C800, burden_VA=15
                ADD_VT id=vt1, kv=138, type=CCVT, ratio="138000/115", class="0.3"
                ADD_RELAY_GROUP id=rg1, functions=[PDIS, PTOC, RBRF], dc_supply=dc1, trip_objects=[brk1, brk2]
                ADD_SURGE_ARRESTER id=sa1, kv=138, mcov_kV=84, class=STATION
                ADD_LINE_TRAP id=lt1, kv=138, carrier_kHz=150
                ADD_EARTHING_SWITCH id=es1, kv=138, make_kA=40
                """);

        assertEquals(Value.text("2000/5"), ir.getObject("ct1").getAttribute("ratio"));
        assertEquals(Value.identifier("C800"), ir.getObject("ct1").getAttribute("class"));
        assertEquals(15.0, ir.getObject("ct1").getNumber("burden_VA"));
        assertEquals("CCVT", ir.getObject("vt1").getString("type"));

        SubstationObject relays = ir.getObject("rg1");
        assertEquals(3, relays.getAttribute("functions").asList().size());
        assertEquals(Value.list(List.of(Value.identifier("brk1"), Value.identifier("brk2"))),
                relays.getAttribute("trip_objects"));
        assertNull(relays.getKv());

        assertEquals(ObjectKind.EARTHING_SWITCH, ir.getObject("es1").getKind());
        assertEquals(150.0, ir.getObject("lt1").getNumber("carrier_kHz"));
    }

    @Test
    void auxiliarySystems() {
        SubstationIr ir = build("""
                ADD_STATION_SERVICE_TRANSFORMER id=sst1, primary_kv=13.8, secondary_kV=0.48, kVA=500
                ADD_DC_SYSTEM id=dc1, nominal_V=125, capacity_Ah=400, redundancy=DUAL
                ADD_CABLE id=c1, kv=13.8, length_km=0.4, thermal_A=600, insulation=XLPE
                """);

        assertEquals(0.48, ir.getObject("sst1").getNumber("secondary_kV"));
        assertNull(ir.getObject("sst1").getKv(), "Only primary_kv, no kv attribute");
        assertEquals("DUAL", ir.getObject("dc1").getString("redundancy"));
        assertEquals("XLPE", ir.getObject("c1").getString("insulation"));
    }

    // ==================== Extension blocks ====================

    @Test
    void extensionAddsKeysAfterMandatoryOnes() {
        SubstationIr ir = build("ADD_BUS id=b1, kv=138, {section=A, rated_A=3150, gis=true, tags=[north, \"old yard\"]}");

        SubstationObject bus = ir.getObject("b1");
        assertEquals(List.of("id", "kv", "section", "rated_A", "gis", "tags"), List.copyOf(bus.getAttributes().keySet()));
        assertEquals(Value.bool(true), bus.getAttribute("gis"));
        assertEquals(Value.list(List.of(Value.identifier("north"), Value.text("old yard"))), bus.getAttribute("tags"));
    }

    @Test
    void mandatoryAttributesWinOverExtension() {
        SubstationIr ir = build("ADD_BUS id=b1, kv=138, {kv=13.8, id=other, note=\"kept\"}");

        SubstationObject bus = ir.getObject("b1");
        assertEquals(138.0, bus.getKv());
        assertEquals(Value.identifier("b1"), bus.getAttribute("id"));
        assertEquals(Value.text("kept"), bus.getAttribute("note"));
        assertEquals(3, bus.getAttributes().size());
    }

    // ==================== Registration ====================

    @Test
    void duplicateIdFailsAtTransformTime() {
        DuplicateIdException e = assertThrows(DuplicateIdException.class, () -> build("""
                ADD_BUS id=b1, kv=138
                ADD_BUS id=b1, kv=138
                """));

        assertEquals(SemanticErrorCode.ID_DUP, e.getErrorCode());
        assertEquals("b1", e.getObjectId());
        assertEquals(2, e.getLocation().getLine());
        assertTrue(e.getMessage().startsWith("E.ID.DUP: "));
    }

    @Test
    void duplicateIdAcrossKinds() {
        SemanticException e = assertThrows(SemanticException.class, () -> build("""
                ADD_BUS id=x1, kv=138
                ADD_BREAKER id=x1, kv=138, interrupting_kA=40, type=SF6, continuous_A=2000
                """));

        assertEquals("E.ID.DUP", e.getCode());
    }

    @Test
    void objectsKeepDeclarationOrder() {
        SubstationIr ir = build("""
                ADD_LINE id=z-line, kv=69, type=OHL, length_km=10, thermal_A=1000
                ADD_BUS id=a-bus, kv=69
                ADD_BREAKER id=m-brk, kv=69, interrupting_kA=25, type=VACUUM, continuous_A=1200
                """);

        assertEquals(List.of("z-line", "a-bus", "m-brk"), List.copyOf(ir.getObjects().keySet()));
    }

    // ==================== Chains ====================

    @Test
    void chainKeepsElementsAsWritten() {
        SubstationIr ir = build("CONNECT series=[OPEN_END, brk1, brk1, undeclared, STUB(\"to feeder 7\")]");

        ConnectionChain chain = ir.getChains().get(0);
        assertEquals(List.of(
                Terminal.openEnd(),
                new ObjectRef("brk1"),
                new ObjectRef("brk1"),
                new ObjectRef("undeclared"),
                Terminal.stub("to feeder 7")), chain.getElements());
        assertEquals(List.of("brk1", "brk1", "undeclared"), chain.getObjectIds());
    }

    @Test
    void misplacedTerminalIsNotRepairedByBuilder() {
        SubstationIr ir = build("CONNECT series=[a, OPEN_END, b]");

        assertTrue(ir.getChains().get(0).getElements().get(1).isTerminal());
    }

    @Test
    void emptyChainIsRecorded() {
        SubstationIr ir = build("CONNECT series=[]");

        assertEquals(1, ir.chainCount());
        assertTrue(ir.getChains().get(0).isEmpty());
    }

    @Test
    void chainExtensionBecomesChainAttributes() {
        SubstationIr ir = build("CONNECT series=[b1, l1], {phase=ABC, note=\"tie\"}");

        ConnectionChain chain = ir.getChains().get(0);
        assertEquals(Value.identifier("ABC"), chain.getAttributes().get("phase"));
        assertEquals(new SourceLocation(1, 1), chain.getLocation());
    }

    @Test
    void chainsKeepSourceOrder() {
        SubstationIr ir = build("CONNECT series=[a, b]\nCONNECT series=[c]\nCONNECT series=[d, e]");

        assertEquals(3, ir.chainCount());
        assertEquals("[c]", ir.getChains().get(1).toString());
        assertEquals(3, ir.getChains().get(2).getLocation().getLine());
    }

    // ==================== Bays, pages, presentation ====================

    @Test
    void bayAssignmentsAreRecorded() {
        SubstationIr ir = build("APPEND_TO_BAY bay_id=line-bay-1, object_id=line-brk-1");

        assertEquals(List.of(new BayAssignment("line-bay-1", "line-brk-1", new SourceLocation(1, 1))),
                ir.getBayAssignments());
    }

    @Test
    void pageWithRoutingAndExtension() {
        SubstationIr ir = build("PAGE id=p1, title=\"138kV yard\", voltage_scope=[138, 69], buses=[b1, b2], "
                + "bays=[bay1], routing={pref=ORTHOGONAL, avoid_crossing=true}, {paper=A3}");

        Page page = ir.getPages().get("p1");
        assertNotNull(page);
        assertEquals(Value.text("138kV yard"), page.getAttributes().get("title"));
        assertEquals(Value.list(List.of(Value.number(138), Value.number(69))), page.getAttributes().get("voltage_scope"));
        assertEquals(Value.bool(true), page.getAttributes().get("routing").asComposite().get("avoid_crossing"));
        assertEquals(Value.identifier("A3"), page.getAttributes().get("paper"));
    }

    @Test
    void duplicatePageIdFails() {
        TransformationException e = assertThrows(TransformationException.class, () -> build("""
                PAGE id=p1, title="a", voltage_scope=[138], buses=[], bays=[]
                PAGE id=p1, title="b", voltage_scope=[69], buses=[], bays=[]
                """));

        assertEquals(SemanticErrorCode.PAGE_DUP, e.getErrorCode());
    }

    @Test
    void styleAndLayoutMergeLaterKeysWin() {
        SubstationIr ir = build("""
                STYLE theme=dark, font_size=10
                SET_LAYOUT direction=LEFT_RIGHT
                STYLE font_size=12
                LABEL target=b1, text="Main bus"
                LABEL target=b2, text="Reserve bus"
                """);

        assertEquals(Value.number(12), ir.getStyle().get("font_size"));
        assertEquals(Value.identifier("dark"), ir.getStyle().get("theme"));
        assertEquals(Value.identifier("LEFT_RIGHT"), ir.getLayout().get("direction"));
        assertEquals(2, ir.getLabels().size());
        assertEquals(Value.text("Reserve bus"), ir.getLabels().get(1).getAttributes().get("text"));
    }

    @Test
    void directivesAreRecordedInMeta() {
        SubstationIr ir = build("ADD_BUS id=b1, kv=138\nVALIDATE\nEMIT_SPEC");

        assertTrue(ir.isValidateRequested());
        assertTrue(ir.isEmitRequested());
        assertEquals(Value.number(3), ir.getMeta().get(SubstationIr.META_STATEMENT_COUNT));
        assertEquals(1, ir.objectCount(), "Directives add no objects");
    }

    @Test
    void noDirectivesMeansNothingRequested() {
        SubstationIr ir = build("ADD_BUS id=b1, kv=138");

        assertFalse(ir.isValidateRequested());
        assertFalse(ir.isEmitRequested());
    }

    // ==================== Determinism ====================

    @Test
    void sameTextBuildsEqualIr() {
        String dsl = """
                ADD_BUS id=b1, kv=138, {section=A}
                ADD_LINE id=l1, kv=138, type=OHL, length_km=10, thermal_A=1000
                CONNECT series=[b1, l1, OPEN_END]
                STYLE theme=dark
                VALIDATE
                """;

        SubstationIr first = build(dsl);
        SubstationIr second = build(dsl);

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void builderIsSingleUse() {
        ParseResult parseResult = parser.parseScript("ADD_BUS id=b1, kv=138");
        SubstationIrBuilder builder = new SubstationIrBuilder();
        builder.build(parseResult.getTree());

        assertThrows(IllegalStateException.class, () -> builder.build(parseResult.getTree()));
    }

    @Test
    void irCollectionsAreUnmodifiable() {
        SubstationIr ir = build("ADD_BUS id=b1, kv=138\nCONNECT series=[b1]");

        assertThrows(UnsupportedOperationException.class, () -> ir.getObjects().clear());
        assertThrows(UnsupportedOperationException.class, () -> ir.getChains().clear());
        assertThrows(UnsupportedOperationException.class,
                () -> ir.getObject("b1").getAttributes().put("kv", Value.number(1)));
    }
}
