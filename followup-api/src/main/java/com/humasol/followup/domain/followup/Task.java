package com.humasol.followup.domain.followup;

import com.humasol.common.event.FollowupJobType;
import com.humasol.followup.domain.exceptions.InvalidFieldException;
import com.humasol.followup.domain.person.Person;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.regex.Pattern;
import lombok.Builder;
import lombok.Getter;

/**
 * Work a person has to carry out periodically for a project, e.g. maintenance.
 */
@Getter
public final class Task extends FollowupJob {

    private static final Pattern NAME = Pattern.compile("[A-Za-z][A-Za-z\\s]*");
    private static final Pattern FUNCTION = Pattern.compile("[A-Za-z][A-Za-z\\s,.]*");

    private String name;
    private String function;

    @Builder
    public Task(
            Person subscriber,
            List<Period> periods,
            String name,
            String function,
            LocalDate lastNotification,
            Long projectId,
            Clock clock) {
        super(subscriber, periods, lastNotification, projectId, clock);
        requireLegalName(name);
        requireLegalFunction(function);
        this.name = name;
        this.function = function;
    }

    private Task(
            Long id,
            Long projectId,
            Person subscriber,
            List<Period> periods,
            LocalDate lastNotification,
            String name,
            String function,
            Clock clock) {
        super(id, projectId, subscriber, periods, lastNotification, clock);
        this.name = name;
        this.function = function;
    }

    public static Task restore(
            Long id,
            Long projectId,
            Person subscriber,
            List<Period> periods,
            LocalDate lastNotification,
            String name,
            String function,
            Clock clock) {
        return new Task(id, projectId, subscriber, periods, lastNotification, name, function, clock);
    }

    public static boolean isValidName(String name) {
        return name != null && NAME.matcher(name).matches();
    }

    public static boolean isValidFunction(String function) {
        return function != null && FUNCTION.matcher(function).matches();
    }

    public void setName(String name) {
        requireLegalName(name);
        this.name = name;
    }

    public void setFunction(String function) {
        requireLegalFunction(function);
        this.function = function;
    }

    @Override
    public FollowupJobType type() {
        return FollowupJobType.TASK;
    }

    @Override
    protected void applyChanges(FollowupJobUpdate changes) {
        super.applyChanges(changes);
        if (changes.name() != null) {
            setName(changes.name());
        }
        if (changes.function() != null) {
            setFunction(changes.function());
        }
    }

    @Override
    protected Runnable snapshot() {
        var restoreJob = super.snapshot();
        var savedName = name;
        var savedFunction = function;
        return () -> {
            restoreJob.run();
            name = savedName;
            function = savedFunction;
        };
    }

    @Override
    public String toString() {
        return "Task(id=" + getId() + ", name=" + name + ", function=" + function
                + ", subscriber=" + getSubscriber().getEmail() + ", periods=" + getPeriods()
                + ", lastNotification=" + getLastNotification() + ")";
    }

    private static void requireLegalName(String name) {
        if (!isValidName(name)) {
            throw InvalidFieldException.of("name", "must start with a letter and contain only letters and spaces");
        }
    }

    private static void requireLegalFunction(String function) {
        if (!isValidFunction(function)) {
            throw InvalidFieldException.of("function",
                    "must start with a letter and contain only letters, spaces, commas and periods");
        }
    }
}
