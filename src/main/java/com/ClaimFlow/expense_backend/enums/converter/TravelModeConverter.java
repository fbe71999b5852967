package com.ClaimFlow.expense_backend.enums.converter;

import com.ClaimFlow.expense_backend.enums.TravelMode;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class TravelModeConverter implements AttributeConverter<TravelMode, String> {

    @Override
    public String convertToDatabaseColumn(TravelMode travelMode) {
        if (travelMode == null) {
            return null;
        }
        return travelMode.getValue(); // stored lowercase, e.g. flight_economy
    }

    @Override
    public TravelMode convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.trim().isEmpty()) {
            return null;
        }
        return TravelMode.fromString(dbData);
    }
}
