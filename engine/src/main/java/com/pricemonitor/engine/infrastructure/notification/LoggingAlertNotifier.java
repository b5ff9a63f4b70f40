package com.pricemonitor.engine.infrastructure.notification;

import com.pricemonitor.common.event.AlertRecord;
import com.pricemonitor.common.json.JacksonConfig;
import com.pricemonitor.engine.domain.notification.AlertNotifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

/**
 * Console transport: writes each fired alert as a JSON event line.
 */
@Slf4j
@Component
public class LoggingAlertNotifier implements AlertNotifier {

    private final ObjectMapper objectMapper = JacksonConfig.createObjectMapper();

    @Override
    public void send(AlertRecord alert) {
        log.info("alert.fired: recipient={}, message={}, event={}",
                alert.recipient(), alert.message(), objectMapper.writeValueAsString(alert));
    }
}
