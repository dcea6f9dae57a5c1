package com.example.prism.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Asset class of a holding. Serialized as "fund" / "crypto".
 */
public enum AssetType {
    FUND("fund"),
    CRYPTO("crypto");

    private final String value;

    AssetType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AssetType fromValue(String value) {
        if (value != null) {
            for (AssetType type : values()) {
                if (type.value.equalsIgnoreCase(value.trim())) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Type must be 'fund' or 'crypto'");
    }
}
