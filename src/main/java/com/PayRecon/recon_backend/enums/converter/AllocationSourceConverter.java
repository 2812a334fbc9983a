package com.PayRecon.recon_backend.enums.converter;

import com.PayRecon.recon_backend.enums.AllocationSource;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class AllocationSourceConverter implements AttributeConverter<AllocationSource, String> {

    @Override
    public String convertToDatabaseColumn(AllocationSource source) {
        if (source == null) {
            return null;
        }
        return source.getTag(); // Stored as the lowercase tag
    }

    @Override
    public AllocationSource convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.trim().isEmpty()) {
            return null;
        }
        return AllocationSource.fromString(dbData);
    }
}
