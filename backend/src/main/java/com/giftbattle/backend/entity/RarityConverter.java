package com.giftbattle.backend.entity;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class RarityConverter implements AttributeConverter<Rarity, String> {

    @Override
    public String convertToDatabaseColumn(Rarity rarity) {
        return rarity != null ? rarity.getLabel() : null;
    }

    @Override
    public Rarity convertToEntityAttribute(String label) {
        return Rarity.fromLabel(label);
    }
}
