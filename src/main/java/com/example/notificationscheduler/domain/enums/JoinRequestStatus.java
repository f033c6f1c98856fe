package com.example.notificationscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

@Getter
@RequiredArgsConstructor
public enum JoinRequestStatus {
    PENDING("pending"),
    ACCEPTED("accepted"),
    DECLINED("declined");

    private final String dbValue;

    public static JoinRequestStatus fromDbValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.dbValue.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown join request status: " + value));
    }
}
