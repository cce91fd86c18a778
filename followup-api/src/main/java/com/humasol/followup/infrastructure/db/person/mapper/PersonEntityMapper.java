package com.humasol.followup.infrastructure.db.person.mapper;

import com.humasol.followup.domain.person.Person;
import com.humasol.followup.infrastructure.db.person.PersonEntity;
import org.mapstruct.Mapper;

@Mapper(componentModel = "spring")
public interface PersonEntityMapper {

    PersonEntity toEntity(Person person);

    default Person toDomain(PersonEntity entity) {
        if (entity == null) {
            return null;
        }
        return Person.restore(entity.getId(), entity.getName(), entity.getEmail(), entity.getPhone());
    }
}
