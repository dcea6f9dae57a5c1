package com.example.prism.service;

import com.example.prism.model.AssetType;

public class HoldingAlreadyExistsException extends RuntimeException {

    public HoldingAlreadyExistsException(AssetType type, String symbol) {
        super("Holding already exists for " + type.getValue() + " " + symbol);
    }
}
