package tech.idplane.platform.idp;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for the authorization server admin API.
 *
 * <p>Configure in application.properties:
 * <pre>
 * idplane.idp.base-url=http://hydra:4445
 * idplane.idp.timeout=30
 * idplane.idp.health-timeout=5
 * </pre>
 */
@ConfigMapping(prefix = "idplane.idp")
public interface IdpConfig {

    /**
     * Base URL of the admin API.
     */
    @WithName("base-url")
    @WithDefault("http://localhost:4445")
    String baseUrl();

    /**
     * Request timeout in seconds for client and challenge calls.
     */
    @WithDefault("30")
    int timeout();

    /**
     * Request timeout in seconds for the readiness probe.
     */
    @WithName("health-timeout")
    @WithDefault("5")
    int healthTimeout();

    /**
     * Page size used when listing every client.
     */
    @WithName("page-size")
    @WithDefault("500")
    int pageSize();

    /**
     * Upper bound on the number of clients fetched by a full listing.
     */
    @WithName("max-clients")
    @WithDefault("10000")
    int maxClients();
}
