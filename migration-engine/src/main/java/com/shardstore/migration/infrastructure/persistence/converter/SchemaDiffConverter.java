package com.shardstore.migration.infrastructure.persistence.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.shardstore.migration.schema.SchemaDiff;
import jakarta.persistence.Converter;

@Converter
public class SchemaDiffConverter extends JsonAttributeConverter<SchemaDiff> {

    public SchemaDiffConverter() {
        super(new TypeReference<SchemaDiff>() { });
    }

    @Override
    protected SchemaDiff emptyValue() {
        return SchemaDiff.empty();
    }
}
