package abrazar.casework.jobs;

import abrazar.casework.services.NotificationDispatchService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Sends a single email: {@code {to, subject, template?, data?, body?}}.
 */
@ApplicationScoped
public class EmailNotificationJobHandler implements JobHandler {

    @Inject
    NotificationDispatchService notificationDispatchService;

    @Override
    public Set<JobType> handlesTypes() {
        return EnumSet.of(JobType.SEND_EMAIL);
    }

    @Override
    public Object execute(String jobId, Map<String, Object> payload) {
        String to = JobPayloads.requireString(payload, "to");
        notificationDispatchService.sendEmail(to, JobPayloads.optionalString(payload, "subject").orElse(""),
                JobPayloads.optionalString(payload, "template").orElse(null), JobPayloads.optionalMap(payload, "data"),
                JobPayloads.optionalString(payload, "body").orElse(null));
        return "sent to " + to;
    }
}
