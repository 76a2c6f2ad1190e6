package org.tanzu.vcenterautomation.vcenter;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.ResponseDefinitionBuilder;
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.tanzu.vcenterautomation.config.VCenterConfig;
import org.tanzu.vcenterautomation.config.WebClientConfig;
import org.tanzu.vcenterautomation.vcenter.OvfDeployment.DeploymentResult;
import org.tanzu.vcenterautomation.vcenter.OvfDeployment.DeploymentTarget;
import org.tanzu.vcenterautomation.vcenter.OvfDeployment.ResourcePoolDeploymentSpec;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.absent;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VapiClientTest {

    private static final String USERNAME = "administrator@vsphere.local";
    private static final String PASSWORD = "secret";

    private WireMockServer server;
    private VapiClient client;

    @BeforeEach
    void setUp() {
        server = new WireMockServer(options().dynamicPort());
        server.start();

        VCenterConfig config = new VCenterConfig();
        config.setProtocol("http");
        config.setHost("localhost");
        config.setPort(server.port());
        config.setUsername(USERNAME);
        config.setPassword(PASSWORD);
        config.setInsecure(false);
        client = new VapiClient(config, new WebClientConfig().webClientBuilder(config));
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private void stubSession(String token) {
        server.stubFor(post(urlEqualTo(VapiClient.SESSION_PATH))
                .withBasicAuth(USERNAME, PASSWORD)
                .willReturn(json("\"" + token + "\"")));
    }

    private static ResponseDefinitionBuilder json(String body) {
        return aResponse().withStatus(200).withHeader("Content-Type", "application/json").withBody(body);
    }

    @Test
    void listsDatacentersByNameWithSessionHeader() {
        stubSession("token-1");
        server.stubFor(get(urlPathEqualTo("/api/vcenter/datacenter"))
                .withQueryParam("names", equalTo("DC East"))
                .withHeader(VapiClient.SESSION_HEADER, equalTo("token-1"))
                .willReturn(json("[{\"datacenter\":\"datacenter-3\",\"name\":\"DC East\"}]")));

        JsonNode datacenters = client.datacenters().list("DC East");

        assertEquals(1, datacenters.size());
        assertEquals("datacenter-3", datacenters.get(0).path("datacenter").asText());
    }

    @Test
    void reusesSessionAcrossCalls() {
        stubSession("token-1");
        server.stubFor(get(urlPathEqualTo("/api/vcenter/vm")).willReturn(json("[]")));

        client.vms().list("web-01");
        client.vms().list("web-02");

        server.verify(1, postRequestedFor(urlEqualTo(VapiClient.SESSION_PATH)));
        server.verify(2, getRequestedFor(urlPathEqualTo("/api/vcenter/vm")));
    }

    @Test
    void sendsContainerFiltersAndSkipsMissingOnes() {
        stubSession("token-1");
        server.stubFor(get(urlPathEqualTo("/api/vcenter/resource-pool")).willReturn(json("[]")));

        client.resourcePools().list("Pool A", "datacenter-3", "domain-c8", null);

        server.verify(getRequestedFor(urlPathEqualTo("/api/vcenter/resource-pool"))
                .withQueryParam("names", equalTo("Pool A"))
                .withQueryParam("datacenters", equalTo("datacenter-3"))
                .withQueryParam("clusters", equalTo("domain-c8"))
                .withQueryParam("hosts", absent()));
    }

    @Test
    void fallsBackToLegacySessionEndpoint() {
        server.stubFor(post(urlEqualTo(VapiClient.SESSION_PATH)).willReturn(aResponse().withStatus(404)));
        server.stubFor(post(urlEqualTo(VapiClient.LEGACY_SESSION_PATH))
                .withBasicAuth(USERNAME, PASSWORD)
                .willReturn(json("{\"value\":\"legacy-token\"}")));
        server.stubFor(get(urlPathEqualTo("/api/vcenter/host"))
                .withHeader(VapiClient.SESSION_HEADER, equalTo("legacy-token"))
                .willReturn(json("[{\"host\":\"host-12\",\"name\":\"esx-01\"}]")));

        JsonNode hosts = client.hosts().list("esx-01", "datacenter-3");

        assertEquals("host-12", hosts.get(0).path("host").asText());
    }

    @Test
    void failsAuthenticationWithoutTryingLegacyEndpointOnBadCredentials() {
        server.stubFor(post(urlEqualTo(VapiClient.SESSION_PATH))
                .willReturn(aResponse().withStatus(401).withHeader("Content-Type", "application/json")
                        .withBody("{\"error_type\":\"UNAUTHENTICATED\",\"messages\":[{\"default_message\":\"Authentication required.\"}]}")));

        VapiException error = assertThrows(VapiException.class, () -> client.datacenters().list("DC East"));

        assertTrue(error.getMessage().startsWith("Failed to authenticate with vCenter"));
        server.verify(0, postRequestedFor(urlEqualTo(VapiClient.LEGACY_SESSION_PATH)));
    }

    @Test
    void renewsSessionOnceAfterUnauthorized() {
        stubSession("token-1");
        server.stubFor(get(urlPathEqualTo("/api/vcenter/cluster")).inScenario("expiry")
                .whenScenarioStateIs(Scenario.STARTED)
                .willReturn(aResponse().withStatus(401))
                .willSetStateTo("renewed"));
        server.stubFor(get(urlPathEqualTo("/api/vcenter/cluster")).inScenario("expiry")
                .whenScenarioStateIs("renewed")
                .willReturn(json("[{\"cluster\":\"domain-c8\",\"name\":\"Compute\"}]")));

        JsonNode clusters = client.clusters().list("Compute", "datacenter-3");

        assertEquals("domain-c8", clusters.get(0).path("cluster").asText());
        server.verify(2, postRequestedFor(urlEqualTo(VapiClient.SESSION_PATH)));
    }

    @Test
    void mapsVendorErrorDocument() {
        stubSession("token-1");
        server.stubFor(get(urlPathEqualTo("/api/vcenter/folder"))
                .willReturn(aResponse().withStatus(400).withHeader("Content-Type", "application/json")
                        .withBody("{\"error_type\":\"INVALID_ARGUMENT\",\"messages\":["
                                + "{\"id\":\"vapi.invalid\",\"default_message\":\"Invalid folder filter.\"},"
                                + "{\"id\":\"vapi.detail\",\"default_message\":\"Unknown type.\"}]}")));

        VapiException error = assertThrows(VapiException.class,
                () -> client.folders().list("vm", "datacenter-3", "VIRTUAL_MACHINE"));

        assertEquals(400, error.getStatusCode());
        assertEquals("INVALID_ARGUMENT", error.getErrorType());
        assertEquals("Invalid folder filter., Unknown type.", error.getVendorMessage());
    }

    @Test
    void readsClusterDetails() {
        stubSession("token-1");
        server.stubFor(get(urlEqualTo("/api/vcenter/cluster/domain-c8"))
                .willReturn(json("{\"name\":\"Compute\",\"resource_pool\":\"resgroup-9\"}")));

        JsonNode cluster = client.clusters().get("domain-c8");

        assertEquals("resgroup-9", cluster.path("resource_pool").asText());
    }

    @Test
    void findsLibraryItemInLibrary() {
        stubSession("token-1");
        server.stubFor(post(urlEqualTo("/api/content/library/item?action=find"))
                .withRequestBody(equalToJson("{\"name\":\"ubuntu-22.04\",\"library_id\":\"lib-1\"}"))
                .willReturn(json("[\"item-7\"]")));

        JsonNode items = client.libraryItems().find("ubuntu-22.04", "lib-1");

        assertEquals("item-7", items.get(0).asText());
    }

    @Test
    void deploysWithTargetAndSpec() {
        stubSession("token-1");
        server.stubFor(post(urlEqualTo("/api/vcenter/ovf/library-item/item-7?action=deploy"))
                .withRequestBody(equalToJson("{"
                        + "\"target\":{\"resource_pool_id\":\"resgroup-9\",\"folder_id\":\"group-v4\"},"
                        + "\"deployment_spec\":{\"name\":\"web-01\",\"annotation\":\"Ubuntu\",\"accept_all_EULA\":true,"
                        + "\"storage_provisioning\":\"thin\",\"default_datastore_id\":\"datastore-11\"}}"))
                .willReturn(json("{\"succeeded\":true,\"resource_id\":{\"type\":\"VirtualMachine\",\"id\":\"vm-42\"}}")));

        DeploymentResult result = client.ovf().deploy("item-7",
                new DeploymentTarget("resgroup-9", null, "group-v4"),
                new ResourcePoolDeploymentSpec("web-01", "Ubuntu", true, "thin", "datastore-11"));

        assertTrue(result.isSucceeded());
        assertEquals("vm-42", result.getId());
    }

    @Test
    void reportsUnsuccessfulDeploymentMessages() {
        stubSession("token-1");
        server.stubFor(post(urlEqualTo("/api/vcenter/ovf/library-item/item-7?action=deploy"))
                .willReturn(json("{\"succeeded\":false,\"error\":{\"errors\":["
                        + "{\"category\":\"SERVER\",\"message\":{\"default_message\":\"Disk copy failed.\"}},"
                        + "{\"category\":\"SERVER\",\"error\":{\"messages\":[{\"default_message\":\"Not enough space.\"}]}}]}}")));

        DeploymentResult result = client.ovf().deploy("item-7",
                new DeploymentTarget("resgroup-9", null, "group-v4"),
                new ResourcePoolDeploymentSpec("web-01", "", true, "thin", "datastore-11"));

        assertFalse(result.isSucceeded());
        assertEquals("", result.getId());
        assertEquals("Disk copy failed., Not enough space.", result.getMessage());
    }
}
