package com.humasol.followup.domain.person;

import com.humasol.followup.domain.exceptions.InvalidFieldException;
import java.util.Locale;
import java.util.regex.Pattern;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Person subscribed to, or responsible for, follow-up work. Persons are owned by the person
 * registry; follow-up jobs only reference them.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Person {

    private static final Pattern ILLEGAL_NAME_CHARACTERS = Pattern.compile("[@_!#$%^&*()<>?/\\\\|}{~:]");
    private static final Pattern EMAIL = Pattern.compile(
            "^(?=[A-Z0-9][A-Z0-9@._%+-]{5,253}$)[A-Z0-9._%+-]{1,64}@"
                    + "(?:(?=[A-Z0-9-]{1,63}\\.)[A-Z0-9]+(?:-[A-Z0-9]+)*\\.){1,8}[A-Z]{2,63}$");
    private static final Pattern PHONE = Pattern.compile("^((\\+|00)[1-9]{1,3})?[0-9]{9,12}$");
    private static final Pattern LEADING_ZEROES = Pattern.compile("^0{1,2}");

    private Long id;
    private String name;
    private String email;
    private String phone;

    public Person(String name, String email, String phone) {
        requireLegalName(name);
        if (!isValidEmail(email)) {
            throw InvalidFieldException.of("email", "'" + email + "' is not a valid address, e.g. myname@domain.org");
        }
        requireLegalPhone(phone);
        this.name = name;
        this.email = email;
        this.phone = normalizePhone(phone);
    }

    public static Person restore(Long id, String name, String email, String phone) {
        return new Person(id, name, email, phone);
    }

    public static boolean isValidName(String name) {
        return name != null && !name.isEmpty() && !ILLEGAL_NAME_CHARACTERS.matcher(name).find();
    }

    public static boolean isValidEmail(String email) {
        return email != null && EMAIL.matcher(email.toUpperCase(Locale.ROOT)).matches();
    }

    public static boolean isValidPhone(String phone) {
        return phone == null || PHONE.matcher(phone.replace(" ", "")).matches();
    }

    /**
     * Applies new name and phone values. The update must carry this person's own e-mail,
     * which is how the registry identifies people. Nothing changes when a value is rejected.
     */
    public Person update(PersonValues changes) {
        if (changes.email() == null || !email.equals(changes.email())) {
            throw InvalidFieldException.of("subscriber.email", "update is addressed to " + changes.email()
                    + " but the subscriber is " + email);
        }
        if (changes.name() != null) {
            requireLegalName(changes.name());
        }
        requireLegalPhone(changes.phone());

        if (changes.name() != null) {
            name = changes.name();
        }
        if (changes.phone() != null) {
            phone = normalizePhone(changes.phone());
        }
        return this;
    }

    /**
     * Captures the mutable fields; running the returned action puts them back.
     */
    public Runnable snapshot() {
        var savedName = name;
        var savedPhone = phone;
        return () -> {
            name = savedName;
            phone = savedPhone;
        };
    }

    private static void requireLegalName(String name) {
        if (!isValidName(name)) {
            throw InvalidFieldException.of("name", "must be non-empty and contain no special characters");
        }
    }

    private static void requireLegalPhone(String phone) {
        if (!isValidPhone(phone)) {
            throw InvalidFieldException.of("phone", "'" + phone + "' is not a phone number, e.g. +32470123456");
        }
    }

    private static String normalizePhone(String phone) {
        if (phone == null) {
            return null;
        }
        var compact = phone.replace(" ", "");
        if (compact.startsWith("0")) {
            compact = "+" + LEADING_ZEROES.matcher(compact).replaceFirst("");
        }
        return compact;
    }
}
