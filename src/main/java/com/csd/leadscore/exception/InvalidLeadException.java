package com.csd.leadscore.exception;

public class InvalidLeadException extends RuntimeException {

    public InvalidLeadException(String message) {
        super(message);
    }
}
