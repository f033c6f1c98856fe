package com.example.notificationscheduler.domain.converter;

import com.example.notificationscheduler.domain.enums.JoinRequestStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Maps join request states to the lowercase values the client app writes.
 */
@Converter
public class JoinRequestStatusConverter implements AttributeConverter<JoinRequestStatus, String> {

    @Override
    public String convertToDatabaseColumn(JoinRequestStatus attribute) {
        return attribute == null ? null : attribute.getDbValue();
    }

    @Override
    public JoinRequestStatus convertToEntityAttribute(String dbData) {
        return dbData == null ? null : JoinRequestStatus.fromDbValue(dbData);
    }
}
