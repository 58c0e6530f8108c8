package com.giftsbuyer.infrastructure.notification;

import com.giftsbuyer.application.ports.NotifierPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Used when no notification channel is configured. */
public class ConsoleNotifier implements NotifierPort {

    private static final Logger log = LoggerFactory.getLogger(ConsoleNotifier.class);

    @Override
    public void send(String message) {
        log.info("[NOTIFY] {}", message);
    }
}
