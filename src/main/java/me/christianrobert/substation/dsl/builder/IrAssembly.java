package me.christianrobert.substation.dsl.builder;

import me.christianrobert.substation.dsl.context.DuplicateIdException;
import me.christianrobert.substation.dsl.context.MissingIdException;
import me.christianrobert.substation.dsl.context.SemanticErrorCode;
import me.christianrobert.substation.dsl.context.TransformationException;
import me.christianrobert.substation.dsl.ir.BayAssignment;
import me.christianrobert.substation.dsl.ir.ConnectionChain;
import me.christianrobert.substation.dsl.ir.Label;
import me.christianrobert.substation.dsl.ir.ObjectKind;
import me.christianrobert.substation.dsl.ir.Page;
import me.christianrobert.substation.dsl.ir.SourceLocation;
import me.christianrobert.substation.dsl.ir.SubstationIr;
import me.christianrobert.substation.dsl.ir.SubstationObject;
import me.christianrobert.substation.dsl.ir.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable IR under construction. Owned by exactly one {@link SubstationIrBuilder} and never
 * exposed; {@link #toIr()} hands out an immutable snapshot.
 */
public class IrAssembly {

    private final Map<String, SubstationObject> objects = new LinkedHashMap<>();
    private final List<ConnectionChain> chains = new ArrayList<>();
    private final Map<String, Page> pages = new LinkedHashMap<>();
    private final Map<String, Value> style = new LinkedHashMap<>();
    private final Map<String, Value> layout = new LinkedHashMap<>();
    private final List<Label> labels = new ArrayList<>();
    private final List<BayAssignment> bayAssignments = new ArrayList<>();

    private boolean validateRequested;
    private boolean emitRequested;
    private int statementCount;

    /**
     * Registers an object under its id.
     *
     * @throws MissingIdException if the id is null or empty
     * @throws DuplicateIdException if any object (of any kind) already uses the id
     */
    public SubstationObject registerObject(ObjectKind kind, String id, Map<String, Value> attributes,
                                           SourceLocation location) {
        if (id == null || id.isEmpty()) {
            throw new MissingIdException(kind, location);
        }
        if (objects.containsKey(id)) {
            throw new DuplicateIdException(id, location);
        }
        SubstationObject object = new SubstationObject(id, kind, attributes, location);
        objects.put(id, object);
        return object;
    }

    public void addChain(ConnectionChain chain) {
        chains.add(chain);
    }

    /**
     * @throws TransformationException with {@code E.PAGE.DUP} if the page id is already used
     */
    public void addPage(Page page) {
        if (pages.containsKey(page.getId())) {
            throw new TransformationException(SemanticErrorCode.PAGE_DUP,
                    "Duplicate page id '" + page.getId() + "'", page.getLocation());
        }
        pages.put(page.getId(), page);
    }

    public void mergeStyle(Map<String, Value> pairs) {
        Attributes.overlay(style, pairs);
    }

    public void mergeLayout(Map<String, Value> pairs) {
        Attributes.overlay(layout, pairs);
    }

    public void addLabel(Label label) {
        labels.add(label);
    }

    public void addBayAssignment(BayAssignment assignment) {
        bayAssignments.add(assignment);
    }

    public void requestValidation() {
        validateRequested = true;
    }

    public void requestEmit() {
        emitRequested = true;
    }

    public void countStatement() {
        statementCount++;
    }

    public boolean containsObject(String id) {
        return objects.containsKey(id);
    }

    public SubstationIr toIr() {
        Map<String, Value> meta = new LinkedHashMap<>();
        meta.put(SubstationIr.META_VALIDATE_REQUESTED, Value.bool(validateRequested));
        meta.put(SubstationIr.META_EMIT_REQUESTED, Value.bool(emitRequested));
        meta.put(SubstationIr.META_STATEMENT_COUNT, Value.number(statementCount));
        return new SubstationIr(objects, chains, pages, style, layout, labels, bayAssignments, meta);
    }
}
