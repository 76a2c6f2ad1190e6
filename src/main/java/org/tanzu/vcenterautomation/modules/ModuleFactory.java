package org.tanzu.vcenterautomation.modules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.tanzu.vcenterautomation.config.VCenterConfig;
import org.tanzu.vcenterautomation.config.WebClientConfig;
import org.tanzu.vcenterautomation.vcenter.InventoryLookup;
import org.tanzu.vcenterautomation.vcenter.VapiClient;
import org.tanzu.vcenterautomation.vcenter.VimClient;

/**
 * Builds modules bound to a vCenter connection other than the shared one.
 *
 * A module invocation that names its own host, credentials or certificate setting gets
 * fresh clients with their own sessions, so it never reuses or replaces the sessions of
 * the shared clients.
 */
@Component
public class ModuleFactory {

    private static final Logger logger = LoggerFactory.getLogger(ModuleFactory.class);

    private final VCenterConfig vCenterConfig;

    public ModuleFactory(VCenterConfig vCenterConfig) {
        this.vCenterConfig = vCenterConfig;
    }

    /**
     * Creates the deploy module for one connection.
     *
     * @param connection The connection arguments of the invocation
     * @return A module whose clients talk to the given vCenter
     */
    public ContentDeployOvfTemplate contentDeployOvfTemplate(ConnectionParams connection) {
        VCenterConfig config = configFor(connection);
        WebClient.Builder webClientBuilder = WebClientConfig.createWebClientBuilder(config);
        VapiClient vapiClient = new VapiClient(config, webClientBuilder);
        VimClient vimClient = new VimClient(config, webClientBuilder);
        return new ContentDeployOvfTemplate(vapiClient, new InventoryLookup(vapiClient, vimClient), config);
    }

    /**
     * Creates the permissions module for one connection.
     *
     * @param connection The connection arguments of the invocation
     * @return A module whose client talks to the given vCenter
     */
    public ObjectPermissionsInfo objectPermissionsInfo(ConnectionParams connection) {
        VCenterConfig config = configFor(connection);
        return new ObjectPermissionsInfo(new VimClient(config, WebClientConfig.createWebClientBuilder(config)));
    }

    private VCenterConfig configFor(ConnectionParams connection) {
        VCenterConfig config = connection.applyTo(vCenterConfig);
        logger.info("Using invocation connection settings: {}", config);
        return config;
    }
}
