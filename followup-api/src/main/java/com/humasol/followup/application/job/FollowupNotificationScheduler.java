package com.humasol.followup.application.job;

import com.humasol.followup.application.service.FollowupJobCommandHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Daily sweep over all follow-up jobs: drops expired periods and reminds every subscriber whose
 * job is due today. Each job is handled in its own transaction.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FollowupNotificationScheduler {

    private final FollowupJobCommandHandler commandHandler;

    @Scheduled(cron = "${followup.notification.cron}", zone = "${followup.notification.timezone}")
    public void sendDueReminders() {
        var jobIds = commandHandler.listJobIds();
        log.info("Follow-up sweep: checking {} job(s)", jobIds.size());
        var sent = 0;
        var failed = 0;
        for (var jobId : jobIds) {
            try {
                if (commandHandler.remindIfDue(jobId)) {
                    sent++;
                }
            } catch (RuntimeException e) {
                failed++;
                log.error("Follow-up sweep failed for job {}", jobId, e);
            }
        }
        log.info("Follow-up sweep complete: {} reminder(s) sent, {} job(s) failed", sent, failed);
    }
}
