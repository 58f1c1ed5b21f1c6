package com.example.kbassist.service;

public class InteractionLogException extends RuntimeException {

    public InteractionLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
