package com.shardstore.migration.infrastructure.persistence.converter;

import com.fasterxml.jackson.core.type.TypeReference;

import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.persistence.Converter;

@Converter
public class ValueMapConverter extends JsonAttributeConverter<Map<String, Object>> {

    public ValueMapConverter() {
        super(new TypeReference<Map<String, Object>>() { });
    }

    @Override
    protected Map<String, Object> emptyValue() {
        return new LinkedHashMap<>();
    }
}
