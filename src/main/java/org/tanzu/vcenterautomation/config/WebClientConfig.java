package org.tanzu.vcenterautomation.config;

import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.transport.ProxyProvider;

import javax.net.ssl.SSLException;
import java.time.Duration;

/**
 * WebClient setup shared by the Automation REST and VI/JSON clients.
 *
 * Both clients talk JSON to the same vCenter endpoint, so they share one builder with
 * JSON headers and a response timeout. Certificate validation and an optional HTTP proxy
 * come from {@link VCenterConfig}. One-off connections with their own settings build
 * their own builder through {@link #createWebClientBuilder(VCenterConfig)}.
 */
@Configuration
public class WebClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(WebClientConfig.class);

    /** Deploying an OVF template is synchronous on the vCenter side and can take minutes */
    static final Duration RESPONSE_TIMEOUT = Duration.ofMinutes(30);

    /** Inventory listings of large vCenters exceed the 256k default buffer */
    static final int MAX_IN_MEMORY_SIZE = 16 * 1024 * 1024;

    /**
     * Creates the shared WebClient.Builder used for vCenter communication.
     *
     * @param vCenterConfig The vCenter configuration containing SSL and proxy settings
     * @return A configured WebClient.Builder
     * @see #createWebClientBuilder(VCenterConfig)
     */
    @Bean
    @DependsOn("VCenterConfigProcessor") // VMWARE_* settings must be applied before host and SSL are read
    public WebClient.Builder webClientBuilder(VCenterConfig vCenterConfig) {
        return createWebClientBuilder(vCenterConfig);
    }

    /**
     * Creates a WebClient.Builder for one vCenter connection.
     *
     * When insecure=true the builder trusts all certificates through Netty's
     * InsecureTrustManagerFactory, which is only appropriate for lab vCenters with
     * self-signed certificates. When both proxyHost and proxyPort are set, requests go
     * through that HTTP proxy.
     *
     * @param vCenterConfig The vCenter configuration containing SSL and proxy settings
     * @return A configured WebClient.Builder
     * @throws IllegalStateException if the insecure SSL context cannot be built
     */
    public static WebClient.Builder createWebClientBuilder(VCenterConfig vCenterConfig) {
        logger.info("Configuring WebClient.Builder for vCenter: {}:{} (insecure={})",
                   vCenterConfig.getHost(), vCenterConfig.getPort(), vCenterConfig.isInsecure());

        HttpClient httpClient = HttpClient.create().responseTimeout(RESPONSE_TIMEOUT);

        String proxyHost = vCenterConfig.getProxyHost();
        Integer proxyPort = vCenterConfig.getProxyPort();
        if (proxyHost != null && !proxyHost.isBlank() && proxyPort != null) {
            logger.info("Connecting to vCenter through HTTP proxy {}:{}", proxyHost, proxyPort);
            httpClient = httpClient.proxy(proxy -> proxy.type(ProxyProvider.Proxy.HTTP)
                .host(proxyHost)
                .port(proxyPort));
        }

        if (vCenterConfig.isInsecure()) {
            logger.warn("SSL validation is DISABLED for vCenter connection (insecure=true). This is not recommended for production!");
            try {
                SslContext sslContext = SslContextBuilder.forClient()
                    .trustManager(InsecureTrustManagerFactory.INSTANCE)
                    .build();
                httpClient = httpClient.secure(spec -> spec.sslContext(sslContext));
                logger.debug("Created HttpClient with insecure SSL context");
            } catch (SSLException e) {
                logger.error("Failed to configure insecure SSL context: {}", e.getMessage(), e);
                throw new IllegalStateException("Failed to configure insecure SSL context", e);
            }
        } else {
            logger.info("Using default SSL validation for vCenter connection");
        }

        return WebClient.builder()
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
    }
}
