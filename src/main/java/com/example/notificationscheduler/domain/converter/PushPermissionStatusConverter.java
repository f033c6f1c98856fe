package com.example.notificationscheduler.domain.converter;

import com.example.notificationscheduler.domain.enums.PushPermissionStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class PushPermissionStatusConverter implements AttributeConverter<PushPermissionStatus, String> {

    @Override
    public String convertToDatabaseColumn(PushPermissionStatus attribute) {
        return attribute == null ? null : attribute.getDbValue();
    }

    @Override
    public PushPermissionStatus convertToEntityAttribute(String dbData) {
        return PushPermissionStatus.fromDbValue(dbData);
    }
}
