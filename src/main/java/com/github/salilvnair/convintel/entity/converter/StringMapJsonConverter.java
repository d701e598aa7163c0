package com.github.salilvnair.convintel.entity.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.github.salilvnair.convintel.engine.exception.ConvIntelErrorCode;
import com.github.salilvnair.convintel.engine.exception.ConvIntelException;
import com.github.salilvnair.convintel.util.JsonUtil;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Converter
public class StringMapJsonConverter implements AttributeConverter<Map<String, String>, String> {

    private static final TypeReference<LinkedHashMap<String, String>> TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(Map<String, String> attribute) {
        if (attribute == null || attribute.isEmpty()) {
            return null;
        }
        try {
            return JsonUtil.toJson(attribute);
        } catch (Exception e) {
            log.warn("Failed to serialize string map to JSON", e);
            return null;
        }
    }

    @Override
    public Map<String, String> convertToEntityAttribute(String dbData) {
        if (JsonUtil.isEmpty(dbData)) {
            return new LinkedHashMap<>();
        }
        try {
            return JsonUtil.fromJson(dbData, TYPE);
        } catch (Exception e) {
            log.error("Unreadable string map JSON, refusing to load the row", e);
            throw new ConvIntelException(ConvIntelErrorCode.PROFILE_DATA_UNREADABLE, "Unreadable string map JSON column", e);
        }
    }
}
