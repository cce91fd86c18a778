package com.humasol.followup.domain.followup;

import java.util.List;
import java.util.Optional;

public interface FollowupJobRepository {

    FollowupJob save(FollowupJob job);

    Optional<FollowupJob> findById(Long id);

    List<FollowupJob> findByProjectId(Long projectId);

    List<FollowupJob> findAll();

    void deleteById(Long id);
}
