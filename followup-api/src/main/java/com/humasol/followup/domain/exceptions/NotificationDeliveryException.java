package com.humasol.followup.domain.exceptions;

public class NotificationDeliveryException extends RuntimeException {

    private NotificationDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }

    public static NotificationDeliveryException of(Long jobId, String recipient, Throwable cause) {
        return new NotificationDeliveryException(
                "Could not notify " + recipient + " about follow-up job " + jobId, cause);
    }
}
