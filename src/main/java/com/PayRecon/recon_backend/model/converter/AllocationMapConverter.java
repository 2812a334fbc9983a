package com.PayRecon.recon_backend.model.converter;

import com.PayRecon.recon_backend.model.AllocationEntry;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.Map;
import java.util.TreeMap;

@Converter
public class AllocationMapConverter extends JsonColumnConverter<Map<String, AllocationEntry>> {

    public AllocationMapConverter() {
        super(new TypeReference<Map<String, AllocationEntry>>() {
        });
    }

    @Override
    protected Map<String, AllocationEntry> emptyValue() {
        return new TreeMap<>();
    }
}
