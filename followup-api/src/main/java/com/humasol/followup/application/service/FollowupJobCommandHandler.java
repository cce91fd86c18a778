package com.humasol.followup.application.service;

import com.humasol.followup.domain.followup.FollowupJob;
import com.humasol.followup.domain.followup.FollowupJobService;
import com.humasol.followup.domain.followup.FollowupJobUpdate;
import com.humasol.followup.domain.followup.NewFollowupJob;
import com.humasol.followup.domain.followup.PeriodValues;
import java.time.LocalDate;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@RequiredArgsConstructor
public class FollowupJobCommandHandler {

    private final FollowupJobService followupJobService;

    @Transactional
    public FollowupJob createJob(NewFollowupJob description) {
        return followupJobService.createJob(description);
    }

    @Transactional(readOnly = true)
    public FollowupJob getJob(Long jobId) {
        return followupJobService.getJob(jobId);
    }

    @Transactional(readOnly = true)
    public List<FollowupJob> listJobs(Long projectId) {
        return followupJobService.listJobs(projectId);
    }

    @Transactional
    public FollowupJob updateJob(Long jobId, FollowupJobUpdate changes) {
        return followupJobService.updateJob(jobId, changes);
    }

    @Transactional
    public FollowupJob addPeriod(Long jobId, PeriodValues period) {
        return followupJobService.addPeriod(jobId, period);
    }

    @Transactional
    public FollowupJob cleanPeriods(Long jobId) {
        return followupJobService.cleanPeriods(jobId);
    }

    @Transactional
    public void deleteJob(Long jobId) {
        followupJobService.deleteJob(jobId);
    }

    @Transactional
    public FollowupJob removePeriod(Long jobId, LocalDate startDate) {
        return followupJobService.removePeriod(jobId, startDate);
    }

    @Transactional(readOnly = true)
    public List<Long> listJobIds() {
        return followupJobService.listJobIds();
    }

    /**
     * Runs the reminder check for one job in its own transaction, so a failure on one job never
     * rolls back the notification dates already committed for others.
     */
    @Transactional
    public boolean remindIfDue(Long jobId) {
        return followupJobService.remindIfDue(jobId);
    }
}
