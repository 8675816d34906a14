package me.christianrobert.substation.dsl.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.christianrobert.substation.dsl.builder.SubstationIrBuilder;
import me.christianrobert.substation.dsl.ir.SubstationIr;
import me.christianrobert.substation.dsl.parser.AntlrParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IrJsonWriterTest {

    private IrJsonWriter writer;
    private SubstationIr ir;

    @BeforeEach
    void setUp() {
        writer = new IrJsonWriter(new ObjectMapper());
        ir = new SubstationIrBuilder().build(new AntlrParser().parseScript("""
                ADD_BUS id=b1, kv=138, {section=A}
                ADD_TRANSFORMER id=tx1, type=AUTO, rated_MVA=200, vector_group="YNa0", percentZ=9, tap={side=HV, range_pct=10, steps=33}
                CONNECT series=[OPEN_END, b1, tx1, STUB("to 69kV yard")], {phase=ABC}
                PAGE id=p1, title="Overview", voltage_scope=[138], buses=[b1], bays=[]
                STYLE theme=dark
                LABEL target=b1, text="Main"
                APPEND_TO_BAY bay_id=bay1, object_id=b1
                VALIDATE
                """).getTree());
    }

    @Test
    void writesObjectsInDeclarationOrder() {
        JsonNode json = writer.write(ir);

        List<String> ids = new ArrayList<>();
        json.get("objects").fieldNames().forEachRemaining(ids::add);
        assertEquals(List.of("b1", "tx1"), ids);

        JsonNode bus = json.get("objects").get("b1");
        assertEquals("BUS", bus.get("kind").asText());
        assertEquals(1, bus.get("line").asInt());
        assertEquals(1, bus.get("column").asInt());
        assertEquals("A", bus.get("attributes").get("section").asText());

        JsonNode tap = json.get("objects").get("tx1").get("attributes").get("tap");
        assertEquals("HV", tap.get("side").asText());
        assertEquals(33, tap.get("steps").asInt());
    }

    @Test
    void writesChainElementsAndAttributes() {
        JsonNode chain = writer.write(ir).get("chains").get(0);

        assertEquals(3, chain.get("line").asInt());
        JsonNode elements = chain.get("elements");
        assertEquals("OPEN_END", elements.get(0).asText());
        assertEquals("b1", elements.get(1).asText());
        assertEquals("STUB:to 69kV yard", elements.get(3).asText());
        assertEquals("ABC", chain.get("attributes").get("phase").asText());
    }

    @Test
    void writesPresentationAndMeta() {
        JsonNode json = writer.write(ir);

        assertEquals("Overview", json.get("pages").get("p1").get("attributes").get("title").asText());
        assertEquals("dark", json.get("style").get("theme").asText());
        assertTrue(json.get("layout").isEmpty());
        assertEquals("Main", json.get("labels").get(0).get("text").asText());
        assertEquals("bay1", json.get("bayAssignments").get(0).get("bay").asText());
        assertTrue(json.get("meta").get("validate_requested").asBoolean());
        assertFalse(json.get("meta").get("emit_requested").asBoolean());
        assertEquals(8, json.get("meta").get("statement_count").asInt());
    }

    @Test
    void emptyIr() {
        JsonNode json = new IrJsonWriter().write(SubstationIr.empty());

        assertTrue(json.get("objects").isEmpty());
        assertTrue(json.get("chains").isEmpty());
        assertTrue(json.get("meta").isEmpty());
    }
}
