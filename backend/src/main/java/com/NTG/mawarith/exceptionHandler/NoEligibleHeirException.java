package com.NTG.mawarith.exceptionHandler;

public class NoEligibleHeirException extends InheritanceException {

    public NoEligibleHeirException(String message) {
        super(message);
    }
}
