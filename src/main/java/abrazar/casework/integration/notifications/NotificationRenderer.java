package abrazar.casework.integration.notifications;

import java.util.Map;

/**
 * Renders a named email template ({@code welcome}, {@code case-assigned}, {@code emergency-alert},
 * {@code password-reset}, ...) to HTML. Template rendering belongs to the host application.
 */
public interface NotificationRenderer {

    String render(String template, Map<String, Object> data);
}
