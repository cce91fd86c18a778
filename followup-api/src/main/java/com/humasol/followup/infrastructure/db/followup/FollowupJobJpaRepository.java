package com.humasol.followup.infrastructure.db.followup;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface FollowupJobJpaRepository extends JpaRepository<FollowupJobEntity, Long> {

    List<FollowupJobEntity> findByProjectIdOrderById(Long projectId);
}
