package me.christianrobert.substation.dsl.validation;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.substation.dsl.context.SemanticErrorCode;
import me.christianrobert.substation.dsl.context.ValidationException;
import me.christianrobert.substation.dsl.ir.BayAssignment;
import me.christianrobert.substation.dsl.ir.ChainElement;
import me.christianrobert.substation.dsl.ir.ConnectionChain;
import me.christianrobert.substation.dsl.ir.ObjectKind;
import me.christianrobert.substation.dsl.ir.ObjectRef;
import me.christianrobert.substation.dsl.ir.SubstationIr;
import me.christianrobert.substation.dsl.ir.SubstationObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Semantic checks over a built {@link SubstationIr}.
 *
 * Rules run in a fixed order and the first violation is thrown:
 * <ol>
 *   <li>E.ID.DUP: object ids are unique</li>
 *   <li>per chain, in source order: E.CONNECT.EMPTY, E.CONNECT.ENDPOINT, E.VOLT.MISMATCH</li>
 *   <li>E.PROT.BRK_UNUSED: every breaker appears in some chain</li>
 * </ol>
 * With strict references enabled, three more rules follow:
 * E.CONNECT.UNRESOLVED, E.COUPLER.SAME_BUS and E.BAY.UNKNOWN.
 *
 * The IR is never modified.
 */
@ApplicationScoped
public class SubstationValidator {

    private static final Logger log = LoggerFactory.getLogger(SubstationValidator.class);

    /** Maximum relative kv difference between adjacent chain elements (inclusive). */
    public static final double VOLTAGE_TOLERANCE = 0.15;

    /**
     * Runs the default rule battery (no strict reference rules).
     *
     * @throws ValidationException on the first violated rule
     */
    public void validate(SubstationIr ir) {
        validate(ir, false);
    }

    /**
     * Runs the rule battery.
     *
     * @param strictReferences also check chain references, coupler buses and bay assignments
     * @throws ValidationException on the first violated rule
     */
    public void validate(SubstationIr ir, boolean strictReferences) {
        log.debug("Validating IR: {} objects, {} chains (strict={})",
                ir.objectCount(), ir.chainCount(), strictReferences);

        checkUniqueIds(ir);
        for (ConnectionChain chain : ir.getChains()) {
            checkChain(ir, chain);
        }
        checkBreakersConnected(ir);

        if (strictReferences) {
            checkChainReferences(ir);
            checkCouplerBuses(ir);
            checkBayAssignments(ir);
        }

        log.debug("Validation passed");
    }

    // Recomputed from the objects themselves; the table key alone cannot show a duplicate.
    private void checkUniqueIds(SubstationIr ir) {
        Set<String> ids = new HashSet<>();
        for (SubstationObject object : ir.objects()) {
            if (!ids.add(object.getId())) {
                throw new ValidationException(SemanticErrorCode.ID_DUP,
                        "Duplicate object ids found.", object.getLocation());
            }
        }
    }

    private void checkChain(SubstationIr ir, ConnectionChain chain) {
        List<ChainElement> elements = chain.getElements();
        if (elements.isEmpty()) {
            throw new ValidationException(SemanticErrorCode.CONNECT_EMPTY,
                    "Empty CONNECT series.", chain.getLocation());
        }

        for (int i = 1; i < elements.size() - 1; i++) {
            if (elements.get(i).isTerminal()) {
                throw new ValidationException(SemanticErrorCode.CONNECT_ENDPOINT,
                        "OPEN_END/STUB allowed only at start or end of series.", chain.getLocation());
            }
        }

        for (int i = 0; i + 1 < elements.size(); i++) {
            ChainElement left = elements.get(i);
            ChainElement right = elements.get(i + 1);
            if (left.isTerminal() || right.isTerminal()) {
                continue;
            }
            checkVoltage(ir, chain, ((ObjectRef) left).getId(), ((ObjectRef) right).getId());
        }
    }

    private void checkVoltage(SubstationIr ir, ConnectionChain chain, String leftId, String rightId) {
        SubstationObject left = ir.getObject(leftId);
        SubstationObject right = ir.getObject(rightId);
        if (left == null || right == null) {
            return;  // unresolved references are not a voltage problem
        }
        if (left.getKind().isVoltageBoundary() || right.getKind().isVoltageBoundary()) {
            return;
        }

        Double leftKv = left.getKv();
        Double rightKv = right.getKv();
        if (leftKv == null || rightKv == null) {
            return;
        }

        if (Math.abs(leftKv - rightKv) > VOLTAGE_TOLERANCE * Math.max(leftKv, rightKv)) {
            throw new ValidationException(SemanticErrorCode.VOLT_MISMATCH,
                    "Voltage mismatch between " + leftId + "(" + formatKv(leftKv) + ") and "
                            + rightId + "(" + formatKv(rightKv) + ").",
                    chain.getLocation());
        }
    }

    private void checkBreakersConnected(SubstationIr ir) {
        Set<String> connected = connectedIds(ir);
        for (SubstationObject breaker : ir.getObjectsOfKind(ObjectKind.BREAKER)) {
            if (!connected.contains(breaker.getId())) {
                throw new ValidationException(SemanticErrorCode.PROT_BRK_UNUSED,
                        "Breaker " + breaker.getId() + " is not connected.", breaker.getLocation());
            }
        }
    }

    // ========== STRICT REFERENCE RULES ==========

    private void checkChainReferences(SubstationIr ir) {
        for (ConnectionChain chain : ir.getChains()) {
            for (String id : chain.getObjectIds()) {
                if (!ir.containsObject(id)) {
                    throw new ValidationException(SemanticErrorCode.CONNECT_UNRESOLVED,
                            "CONNECT references undeclared object '" + id + "'.", chain.getLocation());
                }
            }
        }
    }

    private void checkCouplerBuses(SubstationIr ir) {
        for (SubstationObject coupler : ir.getObjectsOfKind(ObjectKind.COUPLER)) {
            String fromBus = coupler.getString("from_bus");
            if (fromBus != null && Objects.equals(fromBus, coupler.getString("to_bus"))) {
                throw new ValidationException(SemanticErrorCode.COUPLER_SAME_BUS,
                        "Coupler " + coupler.getId() + " connects bus " + fromBus + " to itself.",
                        coupler.getLocation());
            }
        }
    }

    private void checkBayAssignments(SubstationIr ir) {
        for (BayAssignment assignment : ir.getBayAssignments()) {
            SubstationObject bay = ir.getObject(assignment.getBayId());
            if (bay == null || bay.getKind() != ObjectKind.BAY) {
                throw new ValidationException(SemanticErrorCode.BAY_UNKNOWN,
                        "APPEND_TO_BAY names unknown bay '" + assignment.getBayId() + "'.",
                        assignment.getLocation());
            }
            if (!ir.containsObject(assignment.getObjectId())) {
                throw new ValidationException(SemanticErrorCode.BAY_UNKNOWN,
                        "APPEND_TO_BAY names unknown object '" + assignment.getObjectId()
                                + "' for bay '" + assignment.getBayId() + "'.",
                        assignment.getLocation());
            }
        }
    }

    private static Set<String> connectedIds(SubstationIr ir) {
        Set<String> connected = new HashSet<>();
        for (ConnectionChain chain : ir.getChains()) {
            connected.addAll(chain.getObjectIds());
        }
        return connected;
    }

    private static String formatKv(double kv) {
        return kv == Math.rint(kv) ? String.valueOf((long) kv) : String.valueOf(kv);
    }
}
