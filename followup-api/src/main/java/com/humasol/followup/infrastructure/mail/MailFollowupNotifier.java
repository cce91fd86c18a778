package com.humasol.followup.infrastructure.mail;

import com.humasol.common.event.FollowupReminder;
import com.humasol.followup.application.config.FollowupProperties;
import com.humasol.followup.domain.exceptions.NotificationDeliveryException;
import com.humasol.followup.domain.followup.FollowupNotifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class MailFollowupNotifier implements FollowupNotifier {

    private final JavaMailSender mailSender;
    private final FollowupProperties properties;

    @Override
    public void send(FollowupReminder reminder) {
        var message = new SimpleMailMessage();
        message.setFrom(properties.notification().sender());
        message.setTo(reminder.recipientEmail());
        message.setSubject(subject(reminder));
        message.setText(body(reminder));

        try {
            mailSender.send(message);
        } catch (MailException e) {
            throw NotificationDeliveryException.of(reminder.jobId(), reminder.recipientEmail(), e);
        }
        log.info("Sent {} reminder for follow-up job {} to {}",
                reminder.jobType(), reminder.jobId(), reminder.recipientEmail());
    }

    static String subject(FollowupReminder reminder) {
        if (reminder.isTask()) {
            return "Reminder: " + reminder.taskName() + " for project " + reminder.projectId();
        }
        return "Update on project " + reminder.projectId();
    }

    static String body(FollowupReminder reminder) {
        var text = new StringBuilder()
                .append("Dear ").append(reminder.recipientName() != null ? reminder.recipientName() : "subscriber")
                .append(",\n\n");
        if (reminder.isTask()) {
            text.append("It is time to carry out \"").append(reminder.taskName())
                    .append("\" for project ").append(reminder.projectId()).append(".\n")
                    .append("What to do: ").append(reminder.taskFunction()).append("\n");
        } else {
            text.append("A new follow-up update is due for project ").append(reminder.projectId()).append(".\n");
        }
        if (reminder.previousNotification() != null) {
            text.append("You were last notified on ").append(reminder.previousNotification()).append(".\n");
        }
        return text.append("\nThe Humasol team\n").toString();
    }
}
