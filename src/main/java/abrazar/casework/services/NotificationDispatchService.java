package abrazar.casework.services;

import abrazar.casework.api.types.BulkNotificationResultType;
import abrazar.casework.exceptions.PermanentJobFailureException;
import abrazar.casework.integration.notifications.NotificationChannel;
import abrazar.casework.integration.notifications.NotificationRenderer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Delivers email and push notifications for the send-notification queue.
 *
 * <p>
 * Bulk delivery walks the recipients in chunks ({@code casework.notifications.bulk-chunk-size}, default 10) with a
 * pause between chunks ({@code casework.notifications.bulk-pause-ms}, default 100). A failing recipient is counted and
 * reported; it does not fail the batch.
 */
@ApplicationScoped
public class NotificationDispatchService {

    private static final Logger LOG = Logger.getLogger(NotificationDispatchService.class);

    @Inject
    NotificationChannel notificationChannel;

    @Inject
    NotificationRenderer notificationRenderer;

    @ConfigProperty(
            name = "casework.notifications.bulk-chunk-size",
            defaultValue = "10")
    int bulkChunkSize;

    @ConfigProperty(
            name = "casework.notifications.bulk-pause-ms",
            defaultValue = "100")
    long bulkPauseMs;

    /**
     * One bulk recipient with optional per-recipient template data.
     */
    public record Recipient(String email, Map<String, Object> data) {
    }

    /**
     * Sends one email, rendering {@code template} when given, otherwise using {@code body} as is.
     *
     * @throws PermanentJobFailureException
     *             if there is no recipient or neither a template nor a body
     */
    public void sendEmail(String to, String subject, String template, Map<String, Object> data, String body) {
        if (to == null || to.isBlank()) {
            throw new PermanentJobFailureException("Email has no recipient");
        }

        String content;
        if (template != null && !template.isBlank()) {
            content = notificationRenderer.render(template, data == null ? Map.of() : data);
        } else if (body != null) {
            content = body;
        } else {
            throw new PermanentJobFailureException("Email to " + to + " has neither a template nor a body");
        }

        notificationChannel.sendEmail(to, subject, content);
        LOG.debugf("Email sent to %s (template: %s)", to, template);
    }

    /**
     * Sends the same templated email to every recipient.
     *
     * @return counts of successful and failed deliveries
     * @throws InterruptedException
     *             if interrupted while pausing between chunks
     */
    public BulkNotificationResultType sendBulkEmail(List<Recipient> recipients, String subject, String template,
            Map<String, Object> templateData) throws InterruptedException {
        int successful = 0;
        List<String> failedRecipients = new ArrayList<>();
        int chunkSize = Math.max(1, bulkChunkSize);

        for (int start = 0; start < recipients.size(); start += chunkSize) {
            if (start > 0 && bulkPauseMs > 0) {
                Thread.sleep(bulkPauseMs);
            }

            for (Recipient recipient : recipients.subList(start, Math.min(start + chunkSize, recipients.size()))) {
                Map<String, Object> data = new HashMap<>(templateData == null ? Map.of() : templateData);
                if (recipient.data() != null) {
                    data.putAll(recipient.data());
                }
                try {
                    sendEmail(recipient.email(), subject, template, data, null);
                    successful++;
                } catch (RuntimeException e) {
                    failedRecipients.add(recipient.email());
                    LOG.warnf(e, "Bulk email to %s failed", recipient.email());
                }
            }
        }

        LOG.infof("Bulk email '%s' delivered to %d of %d recipients", subject, successful, recipients.size());
        return new BulkNotificationResultType(recipients.size(), successful, failedRecipients.size(),
                List.copyOf(failedRecipients));
    }

    public void sendPush(String userId, String title, String body, Map<String, Object> data) {
        if (userId == null || userId.isBlank()) {
            throw new PermanentJobFailureException("Push notification has no user id");
        }
        notificationChannel.sendPush(userId, title, body, data == null ? Map.of() : data);
        LOG.debugf("Push notification sent to user %s", userId);
    }
}
