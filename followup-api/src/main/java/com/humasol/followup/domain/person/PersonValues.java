package com.humasol.followup.domain.person;

import lombok.Builder;

/**
 * Person fields as supplied by a form. On update the e-mail identifies the person and the
 * other fields are optional.
 */
@Builder(toBuilder = true)
public record PersonValues(String name, String email, String phone) {

    public Person toPerson() {
        return new Person(name, email, phone);
    }
}
