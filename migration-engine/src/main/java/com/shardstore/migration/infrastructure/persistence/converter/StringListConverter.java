package com.shardstore.migration.infrastructure.persistence.converter;

import com.fasterxml.jackson.core.type.TypeReference;

import java.util.ArrayList;
import java.util.List;

import jakarta.persistence.Converter;

@Converter
public class StringListConverter extends JsonAttributeConverter<List<String>> {

    public StringListConverter() {
        super(new TypeReference<List<String>>() { });
    }

    @Override
    protected List<String> emptyValue() {
        return new ArrayList<>();
    }
}
