package io.cronkeeper.core.alert;

import java.io.IOException;
import java.util.List;

public interface AlertStore {
    List<AlertSubscription> load() throws IOException;

    void save(List<AlertSubscription> subscriptions) throws IOException;
}
