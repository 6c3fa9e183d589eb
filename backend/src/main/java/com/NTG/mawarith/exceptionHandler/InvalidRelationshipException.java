package com.NTG.mawarith.exceptionHandler;

/**
 * A tree edit that would break a structural invariant. The edit is rejected and the tree
 * is left unchanged.
 */
public class InvalidRelationshipException extends InheritanceException {

    public InvalidRelationshipException(String message) {
        super(message);
    }
}
