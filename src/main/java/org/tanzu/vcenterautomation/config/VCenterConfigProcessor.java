package org.tanzu.vcenterautomation.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;

/**
 * Completes the vCenter connection settings from the VMWARE_* environment variables.
 *
 * Playbooks driving the vSphere modules conventionally export the connection through
 * VMWARE_HOST, VMWARE_PORT, VMWARE_USER, VMWARE_PASSWORD, VMWARE_VALIDATE_CERTS,
 * VMWARE_PROXY_HOST and VMWARE_PROXY_PORT. After the "vcenter" properties are bound,
 * this processor fills every connection setting that is still null, blank or an
 * unresolved ${...} placeholder from those variables. Valid values from
 * application.properties or vcenter.* variables are never overridden.
 *
 * Each setting is evaluated on its own: a complete set of credentials does not stop
 * VMWARE_PORT, VMWARE_VALIDATE_CERTS or the proxy variables from being applied.
 *
 * Configuration priority (highest to lowest):
 * 1. vcenter.* properties and environment variables
 * 2. VMWARE_* environment variables
 * 3. Default values
 */
@Component
public class VCenterConfigProcessor {

    private static final Logger logger = LoggerFactory.getLogger(VCenterConfigProcessor.class);

    static final String ENV_HOST = "VMWARE_HOST";
    static final String ENV_PORT = "VMWARE_PORT";
    static final String ENV_USER = "VMWARE_USER";
    static final String ENV_PASSWORD = "VMWARE_PASSWORD";
    static final String ENV_VALIDATE_CERTS = "VMWARE_VALIDATE_CERTS";
    static final String ENV_PROXY_HOST = "VMWARE_PROXY_HOST";
    static final String ENV_PROXY_PORT = "VMWARE_PROXY_PORT";

    /** Explicit certificate setting that takes precedence over VMWARE_VALIDATE_CERTS */
    static final String ENV_INSECURE = "VCENTER_INSECURE";

    private static final int DEFAULT_PORT = 443;

    private final VCenterConfig vCenterConfig;

    private final Environment environment;

    public VCenterConfigProcessor(VCenterConfig vCenterConfig, Environment environment) {
        this.vCenterConfig = vCenterConfig;
        this.environment = environment;
    }

    /**
     * Fills incomplete connection settings from the VMWARE_* variables.
     */
    @PostConstruct
    public void processVmwareEnvironment() {
        logger.info("Processing vCenter configuration...");
        logger.info("Current config - Host: '{}', Username: '{}', Password: '{}'",
                   vCenterConfig.getHost(),
                   vCenterConfig.getUsername(),
                   vCenterConfig.getPassword() != null ? "***" : "null");

        if (isConfigurationComplete()) {
            logger.info("vCenter credentials are complete from vcenter.* properties");
        } else {
            applyCredentials();
            if (isConfigurationComplete()) {
                logger.info("vCenter credentials completed from VMWARE_* environment variables");
            } else {
                logger.warn("vCenter configuration is incomplete: host, username and password are required");
            }
        }

        applyPort();
        applyValidateCerts();
        applyProxy();
    }

    private void applyCredentials() {
        if (!isValid(vCenterConfig.getHost())) {
            String host = environment.getProperty(ENV_HOST);
            if (isValid(host)) {
                vCenterConfig.setHost(host);
                logger.info("Set host from {}: {}", ENV_HOST, host);
            }
        }

        if (!isValid(vCenterConfig.getUsername())) {
            String username = environment.getProperty(ENV_USER);
            if (isValid(username)) {
                vCenterConfig.setUsername(username);
                logger.info("Set username from {}: {}", ENV_USER, username);
            }
        }

        if (!isValid(vCenterConfig.getPassword())) {
            String password = environment.getProperty(ENV_PASSWORD);
            if (isValid(password)) {
                vCenterConfig.setPassword(password);
                logger.info("Set password from {}: ***", ENV_PASSWORD);
            }
        }
    }

    private void applyPort() {
        // Only replace the port while it is still the default
        if (vCenterConfig.getPort() != DEFAULT_PORT) {
            return;
        }
        Integer port = parsePort(ENV_PORT);
        if (port != null) {
            vCenterConfig.setPort(port);
            logger.info("Set port from {}: {}", ENV_PORT, port);
        }
    }

    private void applyValidateCerts() {
        if (isValid(environment.getProperty(ENV_INSECURE))) {
            logger.debug("{} is set, ignoring {}", ENV_INSECURE, ENV_VALIDATE_CERTS);
            return;
        }
        String validateCerts = environment.getProperty(ENV_VALIDATE_CERTS);
        if (isValid(validateCerts)) {
            vCenterConfig.setInsecure(!Boolean.parseBoolean(validateCerts.trim()));
            logger.info("Set insecure from {}: {}", ENV_VALIDATE_CERTS, vCenterConfig.isInsecure());
        }
    }

    private void applyProxy() {
        if (!isValid(vCenterConfig.getProxyHost())) {
            String proxyHost = environment.getProperty(ENV_PROXY_HOST);
            if (isValid(proxyHost)) {
                vCenterConfig.setProxyHost(proxyHost.trim());
                logger.info("Set proxy host from {}: {}", ENV_PROXY_HOST, proxyHost);
            }
        }
        if (vCenterConfig.getProxyPort() == null) {
            Integer proxyPort = parsePort(ENV_PROXY_PORT);
            if (proxyPort != null) {
                vCenterConfig.setProxyPort(proxyPort);
                logger.info("Set proxy port from {}: {}", ENV_PROXY_PORT, proxyPort);
            }
        }
    }

    private Integer parsePort(String variable) {
        String value = environment.getProperty(variable);
        if (!isValid(value)) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric {} value '{}'", variable, value);
            return null;
        }
    }

    /**
     * Checks whether host, username and password are all present and valid.
     *
     * @return true if the configuration is complete, false otherwise
     */
    boolean isConfigurationComplete() {
        boolean hostValid = isValid(vCenterConfig.getHost());
        boolean usernameValid = isValid(vCenterConfig.getUsername());
        boolean passwordValid = isValid(vCenterConfig.getPassword());

        logger.debug("Configuration validation - Host valid: {}, Username valid: {}, Password valid: {}",
                    hostValid, usernameValid, passwordValid);

        return hostValid && usernameValid && passwordValid;
    }

    private static boolean isValid(String value) {
        return value != null && !value.trim().isEmpty() && !value.contains("${");
    }
}
