package com.ai.catalogqa.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ContextType {
    DOCUMENT,
    PRODUCT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
