package com.deploybot.orchestrator.backend;

import com.deploybot.orchestrator.model.BackendKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Lookup of the BackendClient for a BackendKind.
 *
 * Spring collects every BackendClient bean and passes the list here; adding
 * a backend only requires a new kind and a new {@code @Component}.
 */
@Component
public class BackendRegistry {

    private static final Logger log = LoggerFactory.getLogger(BackendRegistry.class);

    private final Map<BackendKind, BackendClient> clients = new EnumMap<>(BackendKind.class);

    public BackendRegistry(List<BackendClient> allClients) {
        for (BackendClient client : allClients) {
            BackendClient previous = clients.put(client.kind(), client);
            if (previous != null) {
                throw new IllegalStateException("Two backend clients for " + client.kind() + ": "
                        + previous.getClass().getSimpleName() + ", " + client.getClass().getSimpleName());
            }
            log.info("Registered backend client {} [{}]", client.getClass().getSimpleName(), client.kind());
        }
    }

    public BackendClient get(BackendKind kind) {
        BackendClient client = clients.get(kind);
        if (client == null) {
            throw new IllegalStateException("No backend client registered for " + kind);
        }
        return client;
    }
}
