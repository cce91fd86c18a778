package com.humasol.followup.domain.followup;

import com.humasol.common.event.FollowupReminder;
import com.humasol.followup.domain.exceptions.FollowupJobNotFoundException;
import com.humasol.followup.domain.exceptions.InvalidFieldException;
import com.humasol.followup.domain.exceptions.NotificationDeliveryException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class FollowupJobService {

    private final FollowupJobRepository followupJobRepository;
    private final FollowupJobFactory followupJobFactory;
    private final FollowupNotifier followupNotifier;
    private final Clock clock;

    public FollowupJob createJob(NewFollowupJob description) {
        var job = followupJobFactory.create(description);
        var saved = followupJobRepository.save(job);
        log.info("Created {} follow-up job {} for project {} (subscriber {})",
                saved.type(), saved.getId(), saved.getProjectId(), saved.getSubscriber().getEmail());
        return saved;
    }

    public FollowupJob getJob(Long jobId) {
        return followupJobRepository.findById(jobId)
                .orElseThrow(() -> FollowupJobNotFoundException.of(jobId));
    }

    public List<FollowupJob> listJobs(Long projectId) {
        if (projectId == null) {
            return followupJobRepository.findAll();
        }
        return followupJobRepository.findByProjectId(projectId);
    }

    public FollowupJob updateJob(Long jobId, FollowupJobUpdate changes) {
        var job = getJob(jobId);
        job.update(changes);
        var saved = followupJobRepository.save(job);
        log.info("Updated follow-up job {}", jobId);
        return saved;
    }

    public FollowupJob addPeriod(Long jobId, PeriodValues values) {
        var job = getJob(jobId);
        job.addPeriod(values.toPeriod());
        var saved = followupJobRepository.save(job);
        log.info("Added period starting {} to follow-up job {}", values.startDate(), jobId);
        return saved;
    }

    public FollowupJob cleanPeriods(Long jobId) {
        var job = getJob(jobId);
        var before = job.getPeriods().size();
        job.cleanPeriods();
        var saved = followupJobRepository.save(job);
        log.info("Removed {} expired period(s) from follow-up job {}", before - saved.getPeriods().size(), jobId);
        return saved;
    }

    public void deleteJob(Long jobId) {
        getJob(jobId);
        followupJobRepository.deleteById(jobId);
        log.info("Deleted follow-up job {}", jobId);
    }

    public FollowupJob removePeriod(Long jobId, LocalDate startDate) {
        var job = getJob(jobId);
        var period = job.getPeriods().stream()
                .filter(p -> p.getStart().equals(startDate))
                .findFirst()
                .orElseThrow(() -> InvalidFieldException.of(
                        "startDate", "no period of job " + jobId + " starts on " + startDate));
        job.removePeriod(period);
        var saved = followupJobRepository.save(job);
        log.info("Removed period starting {} from follow-up job {}", startDate, jobId);
        return saved;
    }

    public List<Long> listJobIds() {
        return followupJobRepository.findAll().stream()
                .map(FollowupJob::getId)
                .toList();
    }

    /**
     * Prunes one job and sends its reminder when it is due today. A job whose reminder cannot be
     * delivered keeps its last notification date and is retried on the next run.
     *
     * @return whether a reminder was sent
     */
    public boolean remindIfDue(Long jobId) {
        var job = getJob(jobId);
        var today = LocalDate.now(clock);
        var before = job.getPeriods().size();
        job.cleanPeriods();
        var changed = job.getPeriods().size() != before;
        var sent = false;

        if (job.shouldNotify()) {
            try {
                followupNotifier.send(toReminder(job, today));
                job.setLastNotification(today);
                changed = true;
                sent = true;
            } catch (NotificationDeliveryException e) {
                log.error("Skipping follow-up job {}: {}", job.getId(), e.getMessage(), e);
            }
        }
        if (changed) {
            followupJobRepository.save(job);
        }
        return sent;
    }

    private static FollowupReminder toReminder(FollowupJob job, LocalDate today) {
        var reminder = FollowupReminder.builder()
                .jobId(job.getId())
                .jobType(job.type())
                .projectId(job.getProjectId())
                .recipientName(job.getSubscriber().getName())
                .recipientEmail(job.getSubscriber().getEmail())
                .previousNotification(job.getLastNotification())
                .dueOn(today);
        if (job instanceof Task task) {
            reminder.taskName(task.getName()).taskFunction(task.getFunction());
        }
        return reminder.build();
    }
}
