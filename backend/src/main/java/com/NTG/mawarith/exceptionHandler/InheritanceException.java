package com.NTG.mawarith.exceptionHandler;

public class InheritanceException extends RuntimeException {

    public InheritanceException(String message) {
        super(message);
    }

    public InheritanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
