package abrazar.casework.integration.alerts;

import abrazar.casework.api.types.QueueAlertType;

/**
 * Extension point for delivering queue health alerts (chat webhook, pager, email).
 *
 * <p>
 * Every CDI bean implementing this interface receives each alert. Alerts are always logged at ERROR, so no
 * implementation is required.
 */
public interface QueueAlertNotifier {

    void notify(QueueAlertType alert);
}
