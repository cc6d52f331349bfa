package com.botscript.runtime.instance;

import lombok.extern.slf4j.Slf4j;

/**
 * Receives operator notifications raised by scripts ({@code engine.notify}).
 */
@FunctionalInterface
public interface NotificationSink {

    void notify(String instanceId, String scriptName, String message);

    /** Default sink: writes the notification to the log. */
    NotificationSink LOGGING = new LoggingSink();

    @Slf4j
    final class LoggingSink implements NotificationSink {
        @Override
        public void notify(String instanceId, String scriptName, String message) {
            log.info("Notification from {}/{}: {}", instanceId, scriptName, message);
        }
    }
}
