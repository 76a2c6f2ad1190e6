package org.tanzu.vcenterautomation.modules;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.util.StringUtils;
import org.tanzu.vcenterautomation.config.VCenterConfig;

import java.util.Set;

/**
 * vCenter connection arguments a module invocation may carry next to its own parameters.
 *
 * Every argument is optional. Arguments that are given replace the matching setting of the
 * shared configuration for this one invocation; everything else, including values filled
 * in from the VMWARE_* variables, is taken from the shared configuration.
 */
public class ConnectionParams {

    /** Argument names and aliases, as they appear in a module argument document */
    static final Set<String> KEYS = Set.of(
            "hostname", "username", "admin", "user", "password", "pass", "pwd",
            "port", "validate_certs", "proxy_host", "proxy_port");

    @JsonProperty("hostname")
    private String hostname;

    @JsonProperty("username")
    @JsonAlias({"admin", "user"})
    private String username;

    @JsonProperty("password")
    @JsonAlias({"pass", "pwd"})
    private String password;

    @JsonProperty("port")
    private Integer port;

    @JsonProperty("validate_certs")
    private Boolean validateCerts;

    @JsonProperty("proxy_host")
    private String proxyHost;

    @JsonProperty("proxy_port")
    private Integer proxyPort;

    public String getHostname() { return hostname; }
    public void setHostname(String hostname) { this.hostname = optional(hostname); }

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = optional(username); }

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = optional(password); }

    public Integer getPort() { return port; }
    public void setPort(Integer port) { this.port = port; }

    public Boolean getValidateCerts() { return validateCerts; }
    public void setValidateCerts(Boolean validateCerts) { this.validateCerts = validateCerts; }

    public String getProxyHost() { return proxyHost; }
    public void setProxyHost(String proxyHost) { this.proxyHost = optional(proxyHost); }

    public Integer getProxyPort() { return proxyPort; }
    public void setProxyPort(Integer proxyPort) { this.proxyPort = proxyPort; }

    /**
     * @return true when no connection argument was given
     */
    public boolean isEmpty() {
        return hostname == null && username == null && password == null && port == null
                && validateCerts == null && proxyHost == null && proxyPort == null;
    }

    /**
     * Builds the configuration of this invocation's connection.
     *
     * @param shared The shared configuration, left unchanged
     * @return A copy of the shared configuration with the given arguments applied
     */
    public VCenterConfig applyTo(VCenterConfig shared) {
        VCenterConfig config = shared.copy();
        if (hostname != null) config.setHost(hostname);
        if (username != null) config.setUsername(username);
        if (password != null) config.setPassword(password);
        if (port != null) config.setPort(port);
        if (validateCerts != null) config.setInsecure(!validateCerts);
        if (proxyHost != null) config.setProxyHost(proxyHost);
        if (proxyPort != null) config.setProxyPort(proxyPort);
        return config;
    }

    private static String optional(String value) {
        return StringUtils.hasText(value) ? value : null;
    }

    @Override
    public String toString() {
        return "ConnectionParams{hostname='" + hostname + "', username='" + username + "', password='"
                + (password != null ? "[HIDDEN]" : null) + "', port=" + port + ", validateCerts=" + validateCerts
                + ", proxyHost='" + proxyHost + "', proxyPort=" + proxyPort + "}";
    }
}
