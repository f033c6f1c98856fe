package com.example.notificationscheduler.service.delivery;

public enum DispatchOutcome {
    /** Another run already recorded this occasion; nothing was written. */
    ALREADY_HANDLED,
    /** Recorded in-app; push disabled by preference or OS permission. */
    IN_APP_ONLY,
    /** Recorded in-app during the recipient's quiet hours, whatever the push settings. */
    QUIET_HOURS,
    /** Recorded in-app; the recipient has no active device token. */
    NO_TOKEN,
    PUSH_SENT,
    PUSH_FAILED;

    public boolean isRecorded() {
        return this != ALREADY_HANDLED;
    }
}
