package com.NTG.mawarith.exceptionHandler;

public class InvalidFamilyTreeException extends InheritanceException {

    public InvalidFamilyTreeException(String message) {
        super(message);
    }

    public InvalidFamilyTreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
