package com.example.notificationscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

/**
 * Device-level push permission reported by the client app.
 * <p>
 * Stored by the client app in lowercase ({@code granted}, {@code denied}, {@code undetermined}).
 */
@Getter
@RequiredArgsConstructor
public enum PushPermissionStatus {
    GRANTED("granted"),
    DENIED("denied"),
    UNDETERMINED("undetermined");

    private final String dbValue;

    /**
     * Unknown or missing values read as {@link #UNDETERMINED}.
     */
    public static PushPermissionStatus fromDbValue(String value) {
        if (value == null) {
            return UNDETERMINED;
        }
        return Arrays.stream(values())
                .filter(status -> status.dbValue.equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElse(UNDETERMINED);
    }
}
