package com.humasol.followup.application.controller.followup;

import com.humasol.followup.application.controller.followup.mapper.FollowupJobRequestResponseMapper;
import com.humasol.followup.application.service.FollowupJobCommandHandler;
import jakarta.validation.Valid;
import java.time.LocalDate;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/followup-jobs")
@RequiredArgsConstructor
public class FollowupJobController {

    private final FollowupJobCommandHandler commandHandler;
    private final FollowupJobRequestResponseMapper mapper;

    @PostMapping
    public ResponseEntity<FollowupJobResponse> createJob(@Valid @RequestBody CreateFollowupJobRequest request) {
        var job = commandHandler.createJob(mapper.toNewJob(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(mapper.toResponse(job));
    }

    @GetMapping
    public List<FollowupJobResponse> listJobs(@RequestParam(required = false) Long projectId) {
        return commandHandler.listJobs(projectId).stream()
                .map(mapper::toResponse)
                .toList();
    }

    @GetMapping("/{jobId}")
    public FollowupJobResponse getJob(@PathVariable Long jobId) {
        return mapper.toResponse(commandHandler.getJob(jobId));
    }

    @PatchMapping("/{jobId}")
    public FollowupJobResponse updateJob(
            @PathVariable Long jobId, @Valid @RequestBody UpdateFollowupJobRequest request) {
        return mapper.toResponse(commandHandler.updateJob(jobId, mapper.toUpdate(request)));
    }

    @PostMapping("/{jobId}/periods")
    public FollowupJobResponse addPeriod(@PathVariable Long jobId, @Valid @RequestBody PeriodRequest request) {
        return mapper.toResponse(commandHandler.addPeriod(jobId, mapper.toValues(request)));
    }

    @DeleteMapping("/{jobId}/periods/{startDate}")
    public FollowupJobResponse removePeriod(
            @PathVariable Long jobId, @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate) {
        return mapper.toResponse(commandHandler.removePeriod(jobId, startDate));
    }

    @PostMapping("/{jobId}/clean-periods")
    public FollowupJobResponse cleanPeriods(@PathVariable Long jobId) {
        return mapper.toResponse(commandHandler.cleanPeriods(jobId));
    }

    @DeleteMapping("/{jobId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteJob(@PathVariable Long jobId) {
        commandHandler.deleteJob(jobId);
    }
}
