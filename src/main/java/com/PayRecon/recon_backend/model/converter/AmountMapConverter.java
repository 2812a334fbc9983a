package com.PayRecon.recon_backend.model.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.math.BigDecimal;
import java.util.Map;
import java.util.TreeMap;

@Converter
public class AmountMapConverter extends JsonColumnConverter<Map<String, BigDecimal>> {

    public AmountMapConverter() {
        super(new TypeReference<Map<String, BigDecimal>>() {
        });
    }

    @Override
    protected Map<String, BigDecimal> emptyValue() {
        return new TreeMap<>();
    }
}
