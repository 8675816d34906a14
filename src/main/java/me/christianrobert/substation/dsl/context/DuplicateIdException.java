package me.christianrobert.substation.dsl.context;

import me.christianrobert.substation.dsl.ir.SourceLocation;

/**
 * An {@code ADD_*} statement reused an id that is already taken by any object kind.
 */
public class DuplicateIdException extends TransformationException {

    private final String objectId;

    public DuplicateIdException(String objectId, SourceLocation location) {
        super(SemanticErrorCode.ID_DUP,
                "Duplicate id '" + objectId + "'" + (location != null ? " at line " + location.getLine() : ""),
                location);
        this.objectId = objectId;
    }

    public String getObjectId() {
        return objectId;
    }
}
