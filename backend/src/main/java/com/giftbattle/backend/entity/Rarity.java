package com.giftbattle.backend.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Rarity tier of an item. Stored and serialized as the lowercase label the catalog pipeline
 * and the Mini App use ({@code common}, {@code rare}, ...).
 */
public enum Rarity {
    COMMON("common"),
    RARE("rare"),
    EPIC("epic"),
    LEGENDARY("legendary");

    private final String label;

    Rarity(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static Rarity fromLabel(String label) {
        if (label == null) {
            return null;
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (Rarity rarity : values()) {
            if (rarity.label.equals(normalized)) {
                return rarity;
            }
        }
        throw new IllegalArgumentException("Unknown rarity: " + label);
    }
}
