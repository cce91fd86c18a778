package com.humasol.followup.infrastructure.db.followup;

import com.humasol.followup.domain.followup.FollowupJob;
import com.humasol.followup.domain.followup.FollowupJobRepository;
import com.humasol.followup.infrastructure.db.followup.mapper.FollowupJobEntityMapper;
import com.humasol.followup.infrastructure.db.person.PersonJpaRepository;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class FollowupJobRepositoryAdapter implements FollowupJobRepository {

    private final FollowupJobJpaRepository jpaRepository;
    private final PersonJpaRepository personJpaRepository;
    private final FollowupJobEntityMapper mapper;
    private final Clock clock;

    @Override
    @Transactional
    public FollowupJob save(FollowupJob job) {
        var entity = mapper.toEntity(job);
        entity.setSubscriber(personJpaRepository.save(entity.getSubscriber()));
        var saved = jpaRepository.save(entity);
        return mapper.toDomain(saved, clock);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<FollowupJob> findById(Long id) {
        return jpaRepository.findById(id).map(entity -> mapper.toDomain(entity, clock));
    }

    @Override
    @Transactional(readOnly = true)
    public List<FollowupJob> findByProjectId(Long projectId) {
        return jpaRepository.findByProjectIdOrderById(projectId).stream()
                .map(entity -> mapper.toDomain(entity, clock))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<FollowupJob> findAll() {
        return jpaRepository.findAll().stream()
                .map(entity -> mapper.toDomain(entity, clock))
                .toList();
    }

    @Override
    @Transactional
    public void deleteById(Long id) {
        jpaRepository.deleteById(id);
    }
}
