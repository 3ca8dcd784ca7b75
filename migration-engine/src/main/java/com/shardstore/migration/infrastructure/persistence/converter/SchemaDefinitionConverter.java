package com.shardstore.migration.infrastructure.persistence.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.shardstore.migration.schema.SchemaDefinition;
import jakarta.persistence.Converter;

@Converter
public class SchemaDefinitionConverter extends JsonAttributeConverter<SchemaDefinition> {

    public SchemaDefinitionConverter() {
        super(new TypeReference<SchemaDefinition>() { });
    }

    @Override
    protected SchemaDefinition emptyValue() {
        return SchemaDefinition.empty();
    }
}
