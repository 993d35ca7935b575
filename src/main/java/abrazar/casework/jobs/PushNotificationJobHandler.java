package abrazar.casework.jobs;

import abrazar.casework.services.NotificationDispatchService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Sends a push notification to one user: {@code {userId, title, body, data?}}.
 */
@ApplicationScoped
public class PushNotificationJobHandler implements JobHandler {

    @Inject
    NotificationDispatchService notificationDispatchService;

    @Override
    public Set<JobType> handlesTypes() {
        return EnumSet.of(JobType.SEND_PUSH);
    }

    @Override
    public Object execute(String jobId, Map<String, Object> payload) {
        String userId = JobPayloads.requireString(payload, "userId");
        notificationDispatchService.sendPush(userId, JobPayloads.optionalString(payload, "title").orElse(""),
                JobPayloads.optionalString(payload, "body").orElse(""), JobPayloads.optionalMap(payload, "data"));
        return "pushed to " + userId;
    }
}
