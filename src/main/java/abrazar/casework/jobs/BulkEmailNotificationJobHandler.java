package abrazar.casework.jobs;

import abrazar.casework.api.types.BulkNotificationResultType;
import abrazar.casework.exceptions.PermanentJobFailureException;
import abrazar.casework.services.NotificationDispatchService;
import abrazar.casework.services.NotificationDispatchService.Recipient;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Sends one templated email to many recipients.
 *
 * <p>
 * <b>Payload:</b> {@code {recipients, subject, template, templateData}}. Each recipient is either an email string or
 * an object {@code {email, data?}} whose data overrides {@code templateData}. Failed recipients are reported in the
 * result and do not fail the job.
 */
@ApplicationScoped
public class BulkEmailNotificationJobHandler implements JobHandler {

    @Inject
    NotificationDispatchService notificationDispatchService;

    @Override
    public Set<JobType> handlesTypes() {
        return EnumSet.of(JobType.SEND_BULK_EMAIL);
    }

    @Override
    public BulkNotificationResultType execute(String jobId, Map<String, Object> payload) throws InterruptedException {
        List<Recipient> recipients = parseRecipients(JobPayloads.requireList(payload, "recipients"));
        String template = JobPayloads.requireString(payload, "template");

        return notificationDispatchService.sendBulkEmail(recipients,
                JobPayloads.optionalString(payload, "subject").orElse(""), template,
                JobPayloads.optionalMap(payload, "templateData"));
    }

    @SuppressWarnings("unchecked")
    private static List<Recipient> parseRecipients(List<?> raw) {
        List<Recipient> recipients = new ArrayList<>(raw.size());
        for (Object entry : raw) {
            if (entry instanceof String email) {
                recipients.add(new Recipient(email, Map.of()));
            } else if (entry instanceof Map<?, ?> map) {
                Map<String, Object> fields = (Map<String, Object>) map;
                recipients.add(new Recipient(JobPayloads.requireString(fields, "email"),
                        JobPayloads.optionalMap(fields, "data")));
            } else {
                throw new PermanentJobFailureException("Unsupported recipient entry: " + entry);
            }
        }
        return recipients;
    }
}
