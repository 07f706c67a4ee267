package com.kura.search.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.kura.search.error.ValidationException;

import java.util.Locale;

public enum ContentType {
    TEXT("text"),
    IMAGE("image"),
    PDF("pdf"),
    AUDIO("audio");

    private final String label;

    ContentType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static ContentType fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Content type must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ContentType type : values()) {
            if (type.label.equals(normalized)) {
                return type;
            }
        }
        throw new ValidationException("Unknown content type: " + value.trim());
    }
}
