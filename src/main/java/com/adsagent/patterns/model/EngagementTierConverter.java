package com.adsagent.patterns.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link EngagementTier} by its wire value so the column reads "top-5" rather than "TOP_5".
 */
@Converter
public class EngagementTierConverter implements AttributeConverter<EngagementTier, String> {

    @Override
    public String convertToDatabaseColumn(EngagementTier tier) {
        return tier == null ? null : tier.getValue();
    }

    @Override
    public EngagementTier convertToEntityAttribute(String value) {
        return EngagementTier.fromValue(value);
    }
}
