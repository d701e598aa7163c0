package com.github.salilvnair.convintel.entity.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.github.salilvnair.convintel.engine.exception.ConvIntelErrorCode;
import com.github.salilvnair.convintel.engine.exception.ConvIntelException;
import com.github.salilvnair.convintel.profile.SessionSummary;
import com.github.salilvnair.convintel.util.JsonUtil;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Converter
public class SessionSummaryListJsonConverter implements AttributeConverter<List<SessionSummary>, String> {

    private static final TypeReference<List<SessionSummary>> TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(List<SessionSummary> attribute) {
        if (attribute == null || attribute.isEmpty()) {
            return null;
        }
        try {
            return JsonUtil.toJson(attribute);
        } catch (Exception e) {
            log.warn("Failed to serialize session summaries to JSON", e);
            return null;
        }
    }

    @Override
    public List<SessionSummary> convertToEntityAttribute(String dbData) {
        if (JsonUtil.isEmpty(dbData)) {
            return new ArrayList<>();
        }
        try {
            return JsonUtil.fromJson(dbData, TYPE);
        } catch (Exception e) {
            log.error("Unreadable session summaries JSON, refusing to load the row", e);
            throw new ConvIntelException(ConvIntelErrorCode.PROFILE_DATA_UNREADABLE, "Unreadable session summaries JSON column", e);
        }
    }
}
