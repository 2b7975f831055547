package io.cronkeeper.core.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LoggingAlertSender implements AlertSender {
    public static final String METHOD = "log";
    private static final Logger LOG = LoggerFactory.getLogger(LoggingAlertSender.class);

    @Override
    public String method() {
        return METHOD;
    }

    @Override
    public void send(AlertMessage message) {
        LOG.warn("[alert] {}: {} job {} is {} after {} consecutive failure(s): {}",
            message.title(), message.jobType(), message.jobName(), message.status(),
            message.consecutiveFailures(), message.message());
    }
}
