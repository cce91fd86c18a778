package com.humasol.followup.domain.exceptions;

public class FollowupJobNotFoundException extends RuntimeException {

    private FollowupJobNotFoundException(String message) {
        super(message);
    }

    public static FollowupJobNotFoundException of(Long jobId) {
        return new FollowupJobNotFoundException("Follow-up job not found: " + jobId);
    }
}
