package com.humasol.followup.domain.person;

import java.util.Optional;

public interface PersonRepository {

    Optional<Person> findByEmail(String email);
}
