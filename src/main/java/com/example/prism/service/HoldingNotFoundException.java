package com.example.prism.service;

public class HoldingNotFoundException extends RuntimeException {

    public HoldingNotFoundException(long id) {
        super("Holding not found: " + id);
    }
}
