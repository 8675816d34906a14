package me.christianrobert.substation.dsl.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.christianrobert.substation.dsl.ir.BayAssignment;
import me.christianrobert.substation.dsl.ir.ChainElement;
import me.christianrobert.substation.dsl.ir.ConnectionChain;
import me.christianrobert.substation.dsl.ir.Label;
import me.christianrobert.substation.dsl.ir.Page;
import me.christianrobert.substation.dsl.ir.SourceLocation;
import me.christianrobert.substation.dsl.ir.SubstationIr;
import me.christianrobert.substation.dsl.ir.SubstationObject;
import me.christianrobert.substation.dsl.ir.Terminal;
import me.christianrobert.substation.dsl.ir.Value;

import java.util.Map;

/**
 * Renders a {@link SubstationIr} as a JSON tree for the REST surface and debugging.
 *
 * Format:
 * {
 *   "objects": { "b1": { "kind": "BUS", "line": 1, "column": 1, "attributes": { "id": "b1", "kv": 138.0 } } },
 *   "chains": [ { "line": 3, "column": 1, "elements": ["OPEN_END", "b1", "STUB:feeder"], "attributes": {} } ],
 *   "pages": { ... }, "style": { ... }, "layout": { ... }, "labels": [ ... ],
 *   "bayAssignments": [ { "bay": "bay1", "object": "brk1" } ],
 *   "meta": { "validate_requested": true, ... }
 * }
 *
 * Not an export format: the downstream EMIT_SPEC emitter owns that.
 */
public class IrJsonWriter {

    private final ObjectMapper objectMapper;

    public IrJsonWriter() {
        this(new ObjectMapper());
    }

    public IrJsonWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode write(SubstationIr ir) {
        ObjectNode root = objectMapper.createObjectNode();

        ObjectNode objects = root.putObject("objects");
        for (SubstationObject object : ir.objects()) {
            ObjectNode node = objects.putObject(object.getId());
            node.put("kind", object.getKind().name());
            putLocation(node, object.getLocation());
            node.set("attributes", attributes(object.getAttributes()));
        }

        ArrayNode chains = root.putArray("chains");
        for (ConnectionChain chain : ir.getChains()) {
            ObjectNode node = chains.addObject();
            putLocation(node, chain.getLocation());
            ArrayNode elements = node.putArray("elements");
            for (ChainElement element : chain.getElements()) {
                elements.add(element(element));
            }
            node.set("attributes", attributes(chain.getAttributes()));
        }

        ObjectNode pages = root.putObject("pages");
        for (Page page : ir.getPages().values()) {
            ObjectNode node = pages.putObject(page.getId());
            putLocation(node, page.getLocation());
            node.set("attributes", attributes(page.getAttributes()));
        }

        root.set("style", attributes(ir.getStyle()));
        root.set("layout", attributes(ir.getLayout()));

        ArrayNode labels = root.putArray("labels");
        for (Label label : ir.getLabels()) {
            labels.add(attributes(label.getAttributes()));
        }

        ArrayNode assignments = root.putArray("bayAssignments");
        for (BayAssignment assignment : ir.getBayAssignments()) {
            ObjectNode node = assignments.addObject();
            node.put("bay", assignment.getBayId());
            node.put("object", assignment.getObjectId());
        }

        root.set("meta", attributes(ir.getMeta()));
        return root;
    }

    private ObjectNode attributes(Map<String, Value> attributes) {
        ObjectNode node = objectMapper.createObjectNode();
        attributes.forEach((key, value) -> node.set(key, objectMapper.valueToTree(value.toPlain())));
        return node;
    }

    private static String element(ChainElement element) {
        if (!element.isTerminal()) {
            return element.toString();
        }
        Terminal terminal = (Terminal) element;
        return terminal.isOpenEnd() ? "OPEN_END" : "STUB:" + terminal.getLabel();
    }

    private static void putLocation(ObjectNode node, SourceLocation location) {
        if (location != null) {
            node.put("line", location.getLine());
            node.put("column", location.getColumn());
        }
    }
}
