package org.tanzu.vcenterautomation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Connection and module defaults for the vCenter automation modules.
 *
 * Properties are bound from the "vcenter" prefix (application.properties, system
 * properties, environment variables). Connection settings that are still missing
 * after binding are completed from the VMWARE_* environment variables by
 * {@link VCenterConfigProcessor}.
 */
@Component
@ConfigurationProperties(prefix = "vcenter")
public class VCenterConfig {

    /** vCenter server hostname or IP address */
    private String host;

    /** vCenter server port (default: 443 for HTTPS) */
    private int port = 443;

    /** URL scheme used to reach vCenter */
    private String protocol = "https";

    /** Username for vCenter authentication */
    private String username;

    /** Password for vCenter authentication */
    private String password;

    /** Whether to skip SSL certificate validation */
    private boolean insecure = true;

    /** HTTP proxy host, unset to connect directly */
    private String proxyHost;

    /** HTTP proxy port, used together with proxyHost */
    private Integer proxyPort;

    /** vSphere release used in VI/JSON API paths (/sdk/vim25/{release}) */
    private String vimRelease = "8.0.1.0";

    /** Storage provisioning applied when a deploy request does not name one */
    private String defaultStorageProvisioning = "thin";

    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }

    public int getPort() { return port; }
    public void setPort(int port) { this.port = port; }

    public String getProtocol() { return protocol; }
    public void setProtocol(String protocol) { this.protocol = protocol; }

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }

    public boolean isInsecure() { return insecure; }
    public void setInsecure(boolean insecure) { this.insecure = insecure; }

    public String getProxyHost() { return proxyHost; }
    public void setProxyHost(String proxyHost) { this.proxyHost = proxyHost; }

    public Integer getProxyPort() { return proxyPort; }
    public void setProxyPort(Integer proxyPort) { this.proxyPort = proxyPort; }

    public String getVimRelease() { return vimRelease; }
    public void setVimRelease(String vimRelease) { this.vimRelease = vimRelease; }

    public String getDefaultStorageProvisioning() { return defaultStorageProvisioning; }
    public void setDefaultStorageProvisioning(String defaultStorageProvisioning) {
        this.defaultStorageProvisioning = defaultStorageProvisioning;
    }

    /**
     * Creates an independent copy of this configuration.
     *
     * Used for one-off connections whose host or credentials differ from the shared
     * configuration; changing the copy never affects the clients built from this one.
     *
     * @return A new configuration with the same values
     */
    public VCenterConfig copy() {
        VCenterConfig copy = new VCenterConfig();
        copy.setHost(host);
        copy.setPort(port);
        copy.setProtocol(protocol);
        copy.setUsername(username);
        copy.setPassword(password);
        copy.setInsecure(insecure);
        copy.setProxyHost(proxyHost);
        copy.setProxyPort(proxyPort);
        copy.setVimRelease(vimRelease);
        copy.setDefaultStorageProvisioning(defaultStorageProvisioning);
        return copy;
    }

    /**
     * Returns the base URL of the vCenter endpoint, e.g. https://vc.example.com:443.
     *
     * @return The base URL built from protocol, host and port
     */
    public String getBaseUrl() {
        return protocol + "://" + host + ":" + port;
    }

    /**
     * Returns a string representation of the configuration with the password hidden.
     *
     * @return String representation with password hidden
     */
    @Override
    public String toString() {
        return "VCenterConfig{" +
                "host='" + host + '\'' +
                ", port=" + port +
                ", protocol='" + protocol + '\'' +
                ", username='" + username + '\'' +
                ", password='[HIDDEN]'" +
                ", insecure=" + insecure +
                ", proxyHost='" + proxyHost + '\'' +
                ", proxyPort=" + proxyPort +
                ", vimRelease='" + vimRelease + '\'' +
                ", defaultStorageProvisioning='" + defaultStorageProvisioning + '\'' +
                '}';
    }
}
