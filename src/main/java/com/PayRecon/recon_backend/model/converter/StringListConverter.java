package com.PayRecon.recon_backend.model.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class StringListConverter extends JsonColumnConverter<List<String>> {

    public StringListConverter() {
        super(new TypeReference<List<String>>() {
        });
    }

    @Override
    protected List<String> emptyValue() {
        return new ArrayList<>();
    }
}
