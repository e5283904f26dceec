package tech.idplane.platform.sync;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for bulk client reconciliation.
 */
@ConfigMapping(prefix = "idplane.sync")
public interface SyncConfig {

    /**
     * Worker threads used for each phase of a pass.
     */
    @WithDefault("4")
    int parallelism();

    /**
     * Local service accounts read per page. A pass always reads every page.
     */
    @WithName("local-page-size")
    @WithDefault("500")
    int localPageSize();
}
