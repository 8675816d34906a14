package me.christianrobert.substation.dsl.context;

import me.christianrobert.substation.dsl.ir.SourceLocation;

/**
 * First rule violation found by the semantic validator.
 */
public class ValidationException extends SemanticException {

    public ValidationException(SemanticErrorCode errorCode, String detail) {
        super(errorCode, detail, null);
    }

    public ValidationException(SemanticErrorCode errorCode, String detail, SourceLocation location) {
        super(errorCode, detail, location);
    }
}
