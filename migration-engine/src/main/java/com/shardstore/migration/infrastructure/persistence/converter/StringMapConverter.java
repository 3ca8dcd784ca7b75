package com.shardstore.migration.infrastructure.persistence.converter;

import com.fasterxml.jackson.core.type.TypeReference;

import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.persistence.Converter;

@Converter
public class StringMapConverter extends JsonAttributeConverter<Map<String, String>> {

    public StringMapConverter() {
        super(new TypeReference<Map<String, String>>() { });
    }

    @Override
    protected Map<String, String> emptyValue() {
        return new LinkedHashMap<>();
    }
}
