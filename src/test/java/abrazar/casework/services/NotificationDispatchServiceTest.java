package abrazar.casework.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import abrazar.casework.api.types.BulkNotificationResultType;
import abrazar.casework.exceptions.PermanentJobFailureException;
import abrazar.casework.integration.notifications.NotificationChannel;
import abrazar.casework.integration.notifications.NotificationRenderer;
import abrazar.casework.services.NotificationDispatchService.Recipient;

/**
 * Unit tests for {@link NotificationDispatchService}.
 */
class NotificationDispatchServiceTest {

    @Mock
    NotificationChannel notificationChannel;

    @Mock
    NotificationRenderer notificationRenderer;

    @InjectMocks
    NotificationDispatchService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        service.bulkChunkSize = 10;
        service.bulkPauseMs = 0;
        when(notificationRenderer.render(anyString(), anyMap())).thenReturn("<p>rendered</p>");
    }

    @Test
    void testSendEmail_rendersTemplate() {
        service.sendEmail("ana@example.org", "Bienvenida", "welcome", Map.of("name", "Ana"), null);

        verify(notificationRenderer).render("welcome", Map.of("name", "Ana"));
        verify(notificationChannel).sendEmail("ana@example.org", "Bienvenida", "<p>rendered</p>");
    }

    @Test
    void testSendEmail_literalBody() {
        service.sendEmail("ana@example.org", "Hola", null, null, "plain body");

        verify(notificationRenderer, never()).render(anyString(), anyMap());
        verify(notificationChannel).sendEmail("ana@example.org", "Hola", "plain body");
    }

    @Test
    void testSendEmail_noContentIsPermanent() {
        assertThrows(PermanentJobFailureException.class,
                () -> service.sendEmail("ana@example.org", "Hola", null, null, null));
    }

    @Test
    void testSendBulkEmail_oneFailureDoesNotFailBatch() throws InterruptedException {
        List<Recipient> recipients = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            recipients.add(new Recipient("user" + i + "@example.org", Map.of("i", i)));
        }
        doThrow(new IllegalStateException("mailbox full")).when(notificationChannel)
                .sendEmail(eq("user7@example.org"), anyString(), anyString());

        BulkNotificationResultType result = service.sendBulkEmail(recipients, "Aviso", "emergency-alert",
                Map.of("zone", "Norte"));

        assertEquals(25, result.total());
        assertEquals(24, result.successful());
        assertEquals(1, result.failed());
        assertEquals(List.of("user7@example.org"), result.failedRecipients());
        verify(notificationChannel, times(25)).sendEmail(anyString(), eq("Aviso"), anyString());
        verify(notificationRenderer).render("emergency-alert", Map.of("zone", "Norte", "i", 3));
    }

    @Test
    void testSendPush_requiresUser() {
        assertThrows(PermanentJobFailureException.class, () -> service.sendPush(" ", "t", "b", Map.of()));

        service.sendPush("u1", "Caso asignado", "Tienes un caso nuevo", null);
        verify(notificationChannel).sendPush("u1", "Caso asignado", "Tienes un caso nuevo", Map.of());
    }
}
