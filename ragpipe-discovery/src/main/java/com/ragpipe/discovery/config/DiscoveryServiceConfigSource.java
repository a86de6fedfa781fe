package com.ragpipe.discovery.config;

import com.ragpipe.discovery.DiscoveryService;
import com.ragpipe.discovery.ServiceCatalog;
import com.ragpipe.pipeline.ServiceConfig;
import com.ragpipe.pipeline.load.ServiceConfigSource;

import java.util.Objects;

/**
 * {@link ServiceConfigSource} that discovers services at load time and merges the optional declared source
 * (local activities and declared pipelines).
 */
public final class DiscoveryServiceConfigSource implements ServiceConfigSource {

    private final DiscoveryService discovery;
    private final DiscoveredServiceConfigFactory factory;
    private final ServiceConfigSource declared;

    public DiscoveryServiceConfigSource(DiscoveryService discovery, DiscoveredServiceConfigFactory factory,
                                        ServiceConfigSource declared) {
        this.discovery = Objects.requireNonNull(discovery, "discovery");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.declared = declared;
    }

    /** @throws com.ragpipe.discovery.DiscoveryException if the control plane cannot be reached */
    @Override
    public ServiceConfig load() {
        ServiceCatalog catalog = discovery.discoverHybrid();
        ServiceConfig declaredConfig = declared != null ? declared.load() : null;
        return factory.build(catalog, declaredConfig);
    }

    @Override
    public String describe() {
        return "discovery" + (declared != null ? "+" + declared.describe() : "");
    }
}
