package me.christianrobert.substation.dsl.context;

import me.christianrobert.substation.dsl.ir.ObjectKind;
import me.christianrobert.substation.dsl.ir.SourceLocation;

public class MissingIdException extends TransformationException {

    public MissingIdException(ObjectKind kind, SourceLocation location) {
        super(SemanticErrorCode.ID_MISSING,
                "Missing id in " + kind + (location != null ? " at line " + location.getLine() : ""),
                location);
    }
}
