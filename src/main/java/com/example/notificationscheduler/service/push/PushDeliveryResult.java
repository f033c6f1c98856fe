package com.example.notificationscheduler.service.push;

import lombok.Builder;

/**
 * Counts for one {@link PushGateway#send} call.
 *
 * @param requested   messages passed in
 * @param invalid     dropped for a malformed token
 * @param sent        accepted by the vendor (ticket status ok)
 * @param failed      rejected per item or lost to a transport error
 * @param deactivated tokens deactivated after DeviceNotRegistered
 */
@Builder
public record PushDeliveryResult(int requested, int invalid, int sent, int failed, int deactivated) {

    public static PushDeliveryResult empty() {
        return new PushDeliveryResult(0, 0, 0, 0, 0);
    }

    public boolean anySent() {
        return sent > 0;
    }
}
