package me.christianrobert.substation.dsl.ir;

import java.util.Objects;

/**
 * Membership of an object in a bay, from {@code APPEND_TO_BAY bay_id=..., object_id=...}.
 * Organisational only; it does not affect electrical topology.
 */
public class BayAssignment {

    private final String bayId;
    private final String objectId;
    private final SourceLocation location;

    public BayAssignment(String bayId, String objectId, SourceLocation location) {
        this.bayId = Objects.requireNonNull(bayId, "bayId");
        this.objectId = Objects.requireNonNull(objectId, "objectId");
        this.location = location;
    }

    public String getBayId() {
        return bayId;
    }

    public String getObjectId() {
        return objectId;
    }

    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BayAssignment)) return false;
        BayAssignment that = (BayAssignment) o;
        return bayId.equals(that.bayId) && objectId.equals(that.objectId) && Objects.equals(location, that.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bayId, objectId, location);
    }

    @Override
    public String toString() {
        return bayId + " <- " + objectId;
    }
}
