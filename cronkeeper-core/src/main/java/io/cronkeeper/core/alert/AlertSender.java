package io.cronkeeper.core.alert;

import java.io.IOException;

public interface AlertSender {
    String method();

    void send(AlertMessage message) throws IOException;
}
