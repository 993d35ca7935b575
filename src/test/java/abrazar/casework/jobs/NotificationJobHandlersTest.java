package abrazar.casework.jobs;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import abrazar.casework.exceptions.PermanentJobFailureException;
import abrazar.casework.services.NotificationDispatchService;
import abrazar.casework.services.NotificationDispatchService.Recipient;

/**
 * Unit tests for the send-notification job handlers.
 */
class NotificationJobHandlersTest {

    private NotificationDispatchService dispatchService;

    @BeforeEach
    void setUp() {
        dispatchService = mock(NotificationDispatchService.class);
    }

    @Test
    void testEmail_passesTemplateAndData() {
        EmailNotificationJobHandler handler = new EmailNotificationJobHandler();
        handler.notificationDispatchService = dispatchService;

        handler.execute("1", Map.of("to", "ana@example.org", "subject", "Caso asignado", "template", "case-assigned",
                "data", Map.of("caseId", "c-1")));

        verify(dispatchService).sendEmail("ana@example.org", "Caso asignado", "case-assigned",
                Map.of("caseId", "c-1"), null);
    }

    @Test
    void testEmail_missingRecipientIsPermanent() {
        EmailNotificationJobHandler handler = new EmailNotificationJobHandler();
        handler.notificationDispatchService = dispatchService;

        assertThrows(PermanentJobFailureException.class, () -> handler.execute("1", Map.of("body", "hi")));
        verify(dispatchService, never()).sendEmail(anyString(), anyString(), any(), any(), any());
    }

    @Test
    void testBulkEmail_acceptsStringAndObjectRecipients() throws InterruptedException {
        BulkEmailNotificationJobHandler handler = new BulkEmailNotificationJobHandler();
        handler.notificationDispatchService = dispatchService;

        handler.execute("1", Map.of("recipients",
                List.of("a@example.org", Map.of("email", "b@example.org", "data", Map.of("name", "Bea"))),
                "subject", "Aviso", "template", "emergency-alert", "templateData", Map.of("zone", "Sur")));

        verify(dispatchService).sendBulkEmail(
                eq(List.of(new Recipient("a@example.org", Map.of()),
                        new Recipient("b@example.org", Map.of("name", "Bea")))),
                eq("Aviso"), eq("emergency-alert"), eq(Map.of("zone", "Sur")));
    }

    @Test
    void testBulkEmail_malformedRecipientsArePermanent() {
        BulkEmailNotificationJobHandler handler = new BulkEmailNotificationJobHandler();
        handler.notificationDispatchService = dispatchService;

        assertThrows(PermanentJobFailureException.class,
                () -> handler.execute("1", Map.of("recipients", "a@example.org", "template", "welcome")));
        assertThrows(PermanentJobFailureException.class,
                () -> handler.execute("1", Map.of("recipients", List.of(42), "template", "welcome")));
    }

    @Test
    void testPush() {
        PushNotificationJobHandler handler = new PushNotificationJobHandler();
        handler.notificationDispatchService = dispatchService;

        handler.execute("1", Map.of("userId", "u-1", "title", "Emergencia", "body", "Zona Norte"));

        verify(dispatchService).sendPush("u-1", "Emergencia", "Zona Norte", Map.of());
    }
}
