package abrazar.casework.integration.notifications;

import java.util.Map;

/**
 * Outbound email and push transports. Any exception thrown is a transient failure of the calling job.
 */
public interface NotificationChannel {

    void sendEmail(String to, String subject, String htmlBody);

    void sendPush(String userId, String title, String body, Map<String, Object> data);
}
