package org.tanzu.vcenterautomation.modules;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.ResponseDefinitionBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.tanzu.vcenterautomation.config.VCenterConfig;

import java.util.List;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModuleFactoryTest {

    private static final String BASE = "/sdk/vim25/8.0.1.0";

    private WireMockServer server;
    private VCenterConfig shared;
    private ModuleFactory factory;

    @BeforeEach
    void setUp() {
        server = new WireMockServer(options().dynamicPort());
        server.start();

        shared = new VCenterConfig();
        shared.setProtocol("http");
        shared.setHost("vcsa.shared.invalid");
        shared.setUsername("shared@vsphere.local");
        shared.setPassword("shared");
        factory = new ModuleFactory(shared);
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private static ResponseDefinitionBuilder json(String body) {
        return aResponse().withStatus(200).withHeader("Content-Type", "application/json").withBody(body);
    }

    private ConnectionParams connection() {
        ConnectionParams connection = new ConnectionParams();
        connection.setHostname("localhost");
        connection.setPort(server.port());
        connection.setUsername("administrator@vsphere.local");
        connection.setPassword("secret");
        connection.setValidateCerts(true);
        return connection;
    }

    @Test
    void permissionsModuleTalksToInvocationConnection() {
        server.stubFor(get(urlEqualTo(BASE + "/ServiceInstance/ServiceInstance/content"))
                .willReturn(json("{\"rootFolder\":{\"type\":\"Folder\",\"value\":\"group-d1\"},"
                        + "\"sessionManager\":{\"type\":\"SessionManager\",\"value\":\"SessionManager\"},"
                        + "\"authorizationManager\":{\"type\":\"AuthorizationManager\",\"value\":\"AuthorizationManager\"}}")));
        server.stubFor(post(urlEqualTo(BASE + "/SessionManager/SessionManager/Login"))
                .withRequestBody(equalToJson("{\"userName\":\"administrator@vsphere.local\",\"password\":\"secret\"}"))
                .willReturn(json("{}").withHeader("vmware-api-session-id", "vim-token")));
        server.stubFor(post(urlEqualTo(BASE + "/AuthorizationManager/AuthorizationManager/RetrieveEntityPermissions"))
                .withHeader("vmware-api-session-id", equalTo("vim-token"))
                .willReturn(json("[{\"entity\":{\"type\":\"Folder\",\"value\":\"group-d1\"},\"principal\":\"view_user\","
                        + "\"group\":false,\"roleId\":-2,\"propagate\":true}]")));
        server.stubFor(get(urlEqualTo(BASE + "/AuthorizationManager/AuthorizationManager/roleList"))
                .willReturn(json("[{\"roleId\":-2,\"name\":\"ReadOnly\"}]")));

        ObjectPermissionsParams params = new ObjectPermissionsParams();
        params.setObjectName("rootFolder");
        params.setPrincipal("view_user");
        ModuleResult result = factory.objectPermissionsInfo(connection()).run(params);

        assertFalse(result.isFailed());
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> permissions = (List<Map<String, Object>>) result.get("permissions");
        assertEquals("ReadOnly", permissions.get(0).get("role_name"));
        server.verify(1, postRequestedFor(urlEqualTo(BASE + "/SessionManager/SessionManager/Login")));
    }

    @Test
    void leavesSharedConfigurationUntouched() {
        factory.contentDeployOvfTemplate(connection());

        assertEquals("vcsa.shared.invalid", shared.getHost());
        assertEquals(443, shared.getPort());
        assertEquals("shared@vsphere.local", shared.getUsername());
        assertTrue(shared.isInsecure());
    }

    @Test
    void appliesOnlyGivenConnectionArguments() {
        ConnectionParams connection = new ConnectionParams();
        connection.setPassword("rotated");
        connection.setValidateCerts(false);

        VCenterConfig config = connection.applyTo(shared);

        assertEquals("vcsa.shared.invalid", config.getHost());
        assertEquals("shared@vsphere.local", config.getUsername());
        assertEquals("rotated", config.getPassword());
        assertTrue(config.isInsecure());
        assertFalse(connection.isEmpty());
        assertTrue(new ConnectionParams().isEmpty());
    }
}
