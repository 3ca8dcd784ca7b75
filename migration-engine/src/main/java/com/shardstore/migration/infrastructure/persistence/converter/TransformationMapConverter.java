package com.shardstore.migration.infrastructure.persistence.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.shardstore.migration.transform.BuiltInTransformation;

import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.persistence.Converter;

@Converter
public class TransformationMapConverter extends JsonAttributeConverter<Map<String, BuiltInTransformation>> {

    public TransformationMapConverter() {
        super(new TypeReference<Map<String, BuiltInTransformation>>() { });
    }

    @Override
    protected Map<String, BuiltInTransformation> emptyValue() {
        return new LinkedHashMap<>();
    }
}
