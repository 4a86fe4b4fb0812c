package com.routeops.api.config;

import com.routeops.api.services.RouteRepository;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;

/**
 * Creates the routes table at startup when {@code routes.schema.init} is enabled.
 */
@ApplicationScoped
public class SchemaInitializer {

    private static final Logger LOG = Logger.getLogger(SchemaInitializer.class);

    @ConfigProperty(name = "routes.schema.init", defaultValue = "true")
    boolean schemaInit;

    @ConfigProperty(name = "routes.schema.init-timeout", defaultValue = "30s")
    Duration initTimeout;

    void onStart(@Observes StartupEvent event, RouteRepository repository) {
        if (!schemaInit) {
            LOG.info("Schema initialization disabled");
            return;
        }
        LOG.info("Initializing routes schema");
        repository.createSchema().await().atMost(initTimeout);
        LOG.info("Routes schema ready");
    }
}
