package me.christianrobert.substation.dsl.ir;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Intermediate representation of one DSL script.
 *
 * <p>Contains:
 * <ul>
 *   <li>Object table keyed by id, in declaration order</li>
 *   <li>Connection chains, in source order</li>
 *   <li>Page table, style / layout maps, labels and bay assignments (passively retained)</li>
 *   <li>Meta map with the directives the script requested ({@code VALIDATE}, {@code EMIT_SPEC})</li>
 * </ul>
 *
 * <p>Immutable: every collection is copied and wrapped on construction. The validator only reads it.
 */
public class SubstationIr {

    public static final String META_VALIDATE_REQUESTED = "validate_requested";
    public static final String META_EMIT_REQUESTED = "emit_requested";
    public static final String META_STATEMENT_COUNT = "statement_count";

    private final Map<String, SubstationObject> objects;
    private final List<ConnectionChain> chains;
    private final Map<String, Page> pages;
    private final Map<String, Value> style;
    private final Map<String, Value> layout;
    private final List<Label> labels;
    private final List<BayAssignment> bayAssignments;
    private final Map<String, Value> meta;

    public SubstationIr(Map<String, SubstationObject> objects,
                        List<ConnectionChain> chains,
                        Map<String, Page> pages,
                        Map<String, Value> style,
                        Map<String, Value> layout,
                        List<Label> labels,
                        List<BayAssignment> bayAssignments,
                        Map<String, Value> meta) {
        this.objects = Collections.unmodifiableMap(new LinkedHashMap<>(objects));
        this.chains = Collections.unmodifiableList(new ArrayList<>(chains));
        this.pages = Collections.unmodifiableMap(new LinkedHashMap<>(pages));
        this.style = Collections.unmodifiableMap(new LinkedHashMap<>(style));
        this.layout = Collections.unmodifiableMap(new LinkedHashMap<>(layout));
        this.labels = Collections.unmodifiableList(new ArrayList<>(labels));
        this.bayAssignments = Collections.unmodifiableList(new ArrayList<>(bayAssignments));
        this.meta = Collections.unmodifiableMap(new LinkedHashMap<>(meta));
    }

    /**
     * IR of an empty script.
     */
    public static SubstationIr empty() {
        return new SubstationIr(Map.of(), List.of(), Map.of(), Map.of(), Map.of(), List.of(), List.of(), Map.of());
    }

    public Map<String, SubstationObject> getObjects() {
        return objects;
    }

    /**
     * @return the object, or null if no object with this id was declared
     */
    public SubstationObject getObject(String id) {
        return objects.get(id);
    }

    public boolean containsObject(String id) {
        return objects.containsKey(id);
    }

    /**
     * All objects of one kind, in declaration order.
     */
    public List<SubstationObject> getObjectsOfKind(ObjectKind kind) {
        return objects.values().stream()
                .filter(object -> object.getKind() == kind)
                .collect(Collectors.toList());
    }

    public List<ConnectionChain> getChains() {
        return chains;
    }

    public Map<String, Page> getPages() {
        return pages;
    }

    public Map<String, Value> getStyle() {
        return style;
    }

    public Map<String, Value> getLayout() {
        return layout;
    }

    public List<Label> getLabels() {
        return labels;
    }

    public List<BayAssignment> getBayAssignments() {
        return bayAssignments;
    }

    public Map<String, Value> getMeta() {
        return meta;
    }

    public boolean isValidateRequested() {
        return flag(META_VALIDATE_REQUESTED);
    }

    public boolean isEmitRequested() {
        return flag(META_EMIT_REQUESTED);
    }

    public int objectCount() {
        return objects.size();
    }

    public int chainCount() {
        return chains.size();
    }

    /**
     * Objects in declaration order, convenient for iteration.
     */
    public Collection<SubstationObject> objects() {
        return objects.values();
    }

    private boolean flag(String key) {
        Value value = meta.get(key);
        return value != null && value.getKind() == Value.Kind.BOOLEAN && value.asBoolean();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SubstationIr)) return false;
        SubstationIr that = (SubstationIr) o;
        // LinkedHashMap equality ignores order; compare key order explicitly
        return new ArrayList<>(objects.keySet()).equals(new ArrayList<>(that.objects.keySet()))
                && objects.equals(that.objects)
                && chains.equals(that.chains)
                && pages.equals(that.pages)
                && style.equals(that.style)
                && layout.equals(that.layout)
                && labels.equals(that.labels)
                && bayAssignments.equals(that.bayAssignments)
                && meta.equals(that.meta);
    }

    @Override
    public int hashCode() {
        return Objects.hash(objects, chains, pages, style, layout, labels, bayAssignments, meta);
    }

    @Override
    public String toString() {
        return "SubstationIr{objects=" + objects.size()
                + ", chains=" + chains.size()
                + ", pages=" + pages.size()
                + ", bayAssignments=" + bayAssignments.size() + "}";
    }
}
