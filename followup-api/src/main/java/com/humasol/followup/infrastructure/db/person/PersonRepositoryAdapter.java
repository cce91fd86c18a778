package com.humasol.followup.infrastructure.db.person;

import com.humasol.followup.domain.person.Person;
import com.humasol.followup.domain.person.PersonRepository;
import com.humasol.followup.infrastructure.db.person.mapper.PersonEntityMapper;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class PersonRepositoryAdapter implements PersonRepository {

    private final PersonJpaRepository jpaRepository;
    private final PersonEntityMapper mapper;

    @Override
    @Transactional(readOnly = true)
    public Optional<Person> findByEmail(String email) {
        if (email == null) {
            return Optional.empty();
        }
        return jpaRepository.findByEmail(email).map(mapper::toDomain);
    }
}
