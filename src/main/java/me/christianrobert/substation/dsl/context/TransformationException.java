package me.christianrobert.substation.dsl.context;

import me.christianrobert.substation.dsl.ir.SourceLocation;

/**
 * Semantic failure while building the IR from a syntax tree.
 * Raised directly for {@code E.ATTR.MISSING} and {@code E.PAGE.DUP}.
 */
public class TransformationException extends SemanticException {

    public TransformationException(SemanticErrorCode errorCode, String detail, SourceLocation location) {
        super(errorCode, detail, location);
    }
}
