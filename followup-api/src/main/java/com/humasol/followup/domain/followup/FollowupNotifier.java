package com.humasol.followup.domain.followup;

import com.humasol.common.event.FollowupReminder;

public interface FollowupNotifier {

    /**
     * Delivers {@code reminder} to its recipient.
     *
     * @throws com.humasol.followup.domain.exceptions.NotificationDeliveryException if the
     *     reminder could not be handed over for delivery
     */
    void send(FollowupReminder reminder);
}
