package com.pricemonitor.engine.domain.notification;

import com.pricemonitor.common.event.AlertRecord;

/**
 * Outbound delivery of fired alerts. Called once per persisted alert, after its unit of work
 * has been committed.
 */
public interface AlertNotifier {

    void send(AlertRecord alert);
}
