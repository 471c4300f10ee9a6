package com.jdc.ledger_service.domain.entity.converter;

import com.jdc.ledger_service.domain.type.RecurrenceUnit;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class RecurrenceUnitConverter implements AttributeConverter<RecurrenceUnit, String> {

    @Override
    public String convertToDatabaseColumn(RecurrenceUnit attribute) {
        return attribute == null ? null : attribute.getKey();
    }

    @Override
    public RecurrenceUnit convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isEmpty()) return null;
        return RecurrenceUnit.fromKey(dbData);
    }
}
