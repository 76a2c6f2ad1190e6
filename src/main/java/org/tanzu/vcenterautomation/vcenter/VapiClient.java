package org.tanzu.vcenterautomation.vcenter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriBuilder;
import org.tanzu.vcenterautomation.config.VCenterConfig;
import org.tanzu.vcenterautomation.vcenter.OvfDeployment.DeploymentResult;
import org.tanzu.vcenterautomation.vcenter.OvfDeployment.DeploymentTarget;
import org.tanzu.vcenterautomation.vcenter.OvfDeployment.ResourcePoolDeploymentSpec;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Client for the vCenter Automation REST API (/api).
 *
 * The client is organized into service accessors that follow the vSphere Automation
 * SDK layout:
 * - datacenters(), datastores(), folders(), hosts(), clusters(), resourcePools(), vms():
 *   inventory listings filtered by name and container
 * - libraries(), libraryItems(): content library lookups
 * - ovf(): OVF library item filter and deploy
 *
 * Authentication uses a vmware-api-session-id session obtained with basic credentials.
 * The token is cached for the lifetime of the client; a 401 on a call invalidates it and
 * the call is replayed once with a fresh session.
 *
 * Errors returned by vCenter are raised as {@link VapiException} carrying the vendor
 * messages verbatim.
 */
@Component
public class VapiClient {

    private static final Logger logger = LoggerFactory.getLogger(VapiClient.class);

    static final String SESSION_HEADER = "vmware-api-session-id";
    static final String SESSION_PATH = "/api/session";
    static final String LEGACY_SESSION_PATH = "/rest/com/vmware/cis/session";

    private static final String SESSION_KEY = "session";

    private final VCenterConfig vCenterConfig;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    /** Cached vAPI session token */
    private final ConcurrentHashMap<String, String> sessionTokens = new ConcurrentHashMap<>();

    private final DataCenterService dataCenterService = new DataCenterService();
    private final DatastoreService datastoreService = new DatastoreService();
    private final FolderService folderService = new FolderService();
    private final HostService hostService = new HostService();
    private final ClusterService clusterService = new ClusterService();
    private final ResourcePoolService resourcePoolService = new ResourcePoolService();
    private final VmService vmService = new VmService();
    private final LibraryService libraryService = new LibraryService();
    private final LibraryItemService libraryItemService = new LibraryItemService();
    private final OvfLibraryItemService ovfLibraryItemService = new OvfLibraryItemService();

    /**
     * Constructs a new VapiClient against the configured vCenter.
     *
     * @param vCenterConfig Configuration containing vCenter connection settings
     * @param webClientBuilder Pre-configured WebClient.Builder with SSL settings
     */
    public VapiClient(VCenterConfig vCenterConfig, WebClient.Builder webClientBuilder) {
        this.vCenterConfig = vCenterConfig;
        this.objectMapper = new ObjectMapper();

        String baseUrl = vCenterConfig.getBaseUrl();
        logger.info("Initializing VapiClient for vCenter: {} (insecure={})", baseUrl, vCenterConfig.isInsecure());

        this.webClient = webClientBuilder.clone()
            .baseUrl(baseUrl)
            .build();
    }

    /**
     * Returns the datacenter service interface.
     *
     * The returned service can be used to list datacenters by name.
     *
     * @return DataCenterService instance for datacenter lookups
     */
    public DataCenterService datacenters() {
        return dataCenterService;
    }

    /**
     * Returns the datastore service interface.
     *
     * The returned service can be used to list the datastores of a datacenter by name.
     *
     * @return DatastoreService instance for datastore lookups
     */
    public DatastoreService datastores() {
        return datastoreService;
    }

    /**
     * Returns the folder service interface.
     *
     * The returned service can be used to list folders of a datacenter by name and folder type.
     *
     * @return FolderService instance for folder lookups
     */
    public FolderService folders() {
        return folderService;
    }

    /**
     * Returns the host service interface.
     *
     * The returned service can be used to list the ESXi hosts of a datacenter by name.
     *
     * @return HostService instance for host lookups
     */
    public HostService hosts() {
        return hostService;
    }

    /**
     * Returns the cluster service interface.
     *
     * The returned service can be used to list clusters by name and to read a cluster's root resource pool.
     *
     * @return ClusterService instance for cluster operations
     */
    public ClusterService clusters() {
        return clusterService;
    }

    /**
     * Returns the resource pool service interface.
     *
     * The returned service can be used to list resource pools, optionally narrowed to a cluster or host.
     *
     * @return ResourcePoolService instance for resource pool lookups
     */
    public ResourcePoolService resourcePools() {
        return resourcePoolService;
    }

    /**
     * Returns the virtual machine service interface.
     *
     * The returned service can be used to look up virtual machines by name.
     *
     * @return VmService instance for virtual machine lookups
     */
    public VmService vms() {
        return vmService;
    }

    /**
     * Returns the content library service interface.
     *
     * The returned service can be used to find content libraries by name.
     *
     * @return LibraryService instance for content library lookups
     */
    public LibraryService libraries() {
        return libraryService;
    }

    /**
     * Returns the content library item service interface.
     *
     * The returned service can be used to find library items by name, in one library or in all of them.
     *
     * @return LibraryItemService instance for library item lookups
     */
    public LibraryItemService libraryItems() {
        return libraryItemService;
    }

    /**
     * Returns the OVF library item service interface.
     *
     * The returned service can be used to inspect an OVF template and deploy it as a new virtual machine.
     *
     * @return OvfLibraryItemService instance for OVF deployment
     */
    public OvfLibraryItemService ovf() {
        return ovfLibraryItemService;
    }

    /**
     * Datacenter listings.
     */
    public class DataCenterService {
        /**
         * Lists datacenters, optionally filtered by name.
         *
         * @param name Datacenter name, or null for all
         * @return JsonNode array of datacenter summaries {datacenter, name}
         */
        public JsonNode list(String name) {
            logger.info("=== VAPI DATACENTER SERVICE: list({}) ===", name);
            return get("/api/vcenter/datacenter", filters("names", name));
        }
    }

    /**
     * Datastore listings.
     */
    public class DatastoreService {
        /**
         * Lists datastores of a datacenter by name.
         *
         * @param name Datastore name
         * @param datacenterId Datacenter to search, or null for all
         * @return JsonNode array of datastore summaries {datastore, name, type, free_space, capacity}
         */
        public JsonNode list(String name, String datacenterId) {
            logger.info("=== VAPI DATASTORE SERVICE: list({}, datacenter={}) ===", name, datacenterId);
            return get("/api/vcenter/datastore", filters("names", name, "datacenters", datacenterId));
        }
    }

    /**
     * Folder listings.
     */
    public class FolderService {
        /**
         * Lists folders of a datacenter by name and folder type.
         *
         * @param name Folder name
         * @param datacenterId Datacenter to search, or null for all
         * @param type Folder type such as VIRTUAL_MACHINE, or null for any
         * @return JsonNode array of folder summaries {folder, name, type}
         */
        public JsonNode list(String name, String datacenterId, String type) {
            logger.info("=== VAPI FOLDER SERVICE: list({}, datacenter={}, type={}) ===", name, datacenterId, type);
            return get("/api/vcenter/folder", filters("names", name, "datacenters", datacenterId, "type", type));
        }
    }

    /**
     * Host listings.
     */
    public class HostService {
        /**
         * Lists hosts of a datacenter by name.
         *
         * @param name Host name
         * @param datacenterId Datacenter to search, or null for all
         * @return JsonNode array of host summaries {host, name, connection_state, power_state}
         */
        public JsonNode list(String name, String datacenterId) {
            logger.info("=== VAPI HOST SERVICE: list({}, datacenter={}) ===", name, datacenterId);
            return get("/api/vcenter/host", filters("names", name, "datacenters", datacenterId));
        }
    }

    /**
     * Cluster listings and details.
     */
    public class ClusterService {
        /**
         * Lists clusters of a datacenter by name.
         *
         * @param name Cluster name
         * @param datacenterId Datacenter to search, or null for all
         * @return JsonNode array of cluster summaries {cluster, name, ha_enabled, drs_enabled}
         */
        public JsonNode list(String name, String datacenterId) {
            logger.info("=== VAPI CLUSTER SERVICE: list({}, datacenter={}) ===", name, datacenterId);
            return VapiClient.this.get("/api/vcenter/cluster", filters("names", name, "datacenters", datacenterId));
        }

        /**
         * Gets the details of a cluster, including its root resource pool.
         *
         * @param clusterId The cluster identifier
         * @return JsonNode {name, resource_pool}
         */
        public JsonNode get(String clusterId) {
            logger.info("=== VAPI CLUSTER SERVICE: get({}) ===", clusterId);
            return VapiClient.this.get("/api/vcenter/cluster/" + clusterId, new LinkedMultiValueMap<>());
        }
    }

    /**
     * Resource pool listings.
     */
    public class ResourcePoolService {
        /**
         * Lists resource pools by name, narrowed by datacenter, cluster and host.
         *
         * @param name Resource pool name
         * @param datacenterId Datacenter to search, or null
         * @param clusterId Cluster containing the pool, or null
         * @param hostId Host containing the pool, or null
         * @return JsonNode array of resource pool summaries {resource_pool, name}
         */
        public JsonNode list(String name, String datacenterId, String clusterId, String hostId) {
            logger.info("=== VAPI RESOURCE POOL SERVICE: list({}, datacenter={}, cluster={}, host={}) ===",
                       name, datacenterId, clusterId, hostId);
            return get("/api/vcenter/resource-pool",
                    filters("names", name, "datacenters", datacenterId, "clusters", clusterId, "hosts", hostId));
        }
    }

    /**
     * Virtual machine listings.
     */
    public class VmService {
        /**
         * Lists virtual machines by name.
         *
         * @param name VM name
         * @return JsonNode array of VM summaries {vm, name, power_state}
         */
        public JsonNode list(String name) {
            logger.info("=== VAPI VM SERVICE: list({}) ===", name);
            return get("/api/vcenter/vm", filters("names", name));
        }
    }

    /**
     * Content library lookups.
     */
    public class LibraryService {
        /**
         * Finds content libraries by name.
         *
         * @param name Library name
         * @return JsonNode array of library identifiers
         */
        public JsonNode find(String name) {
            logger.info("=== VAPI LIBRARY SERVICE: find({}) ===", name);
            ObjectNode spec = objectMapper.createObjectNode();
            spec.put("name", name);
            return post("/api/content/library", "find", spec);
        }
    }

    /**
     * Content library item lookups.
     */
    public class LibraryItemService {
        /**
         * Finds library items by name, optionally within one library.
         *
         * @param name Item name
         * @param libraryId Library to search, or null for every library
         * @return JsonNode array of library item identifiers
         */
        public JsonNode find(String name, String libraryId) {
            logger.info("=== VAPI LIBRARY ITEM SERVICE: find({}, library={}) ===", name, libraryId);
            ObjectNode spec = objectMapper.createObjectNode();
            spec.put("name", name);
            if (libraryId != null) {
                spec.put("library_id", libraryId);
            }
            return post("/api/content/library/item", "find", spec);
        }
    }

    /**
     * OVF library item operations.
     */
    public class OvfLibraryItemService {
        /**
         * Queries the OVF package of a library item for deployment against a target.
         *
         * @param libraryItemId The library item holding the OVF package
         * @param target Where the package would be deployed
         * @return JsonNode summary {name, annotation, EULAs, networks, storage_groups, ...}
         */
        public JsonNode filter(String libraryItemId, DeploymentTarget target) {
            logger.info("=== VAPI OVF SERVICE: filter({}, {}) ===", libraryItemId, target);
            ObjectNode request = objectMapper.createObjectNode();
            request.set("target", objectMapper.valueToTree(target));
            return post("/api/vcenter/ovf/library-item/" + libraryItemId, "filter", request);
        }

        /**
         * Deploys the OVF package of a library item.
         *
         * @param libraryItemId The library item holding the OVF package
         * @param target Where to deploy
         * @param spec The deployment spec
         * @return The flattened deployment result
         */
        public DeploymentResult deploy(String libraryItemId, DeploymentTarget target, ResourcePoolDeploymentSpec spec) {
            logger.info("=== VAPI OVF SERVICE: deploy({}, {}, {}) ===", libraryItemId, target, spec);
            ObjectNode request = objectMapper.createObjectNode();
            request.set("target", objectMapper.valueToTree(target));
            request.set("deployment_spec", objectMapper.valueToTree(spec));
            JsonNode response = post("/api/vcenter/ovf/library-item/" + libraryItemId, "deploy", request);
            return DeploymentResult.fromJson(response);
        }
    }

    /**
     * Issues a GET against an /api path.
     *
     * @param path The API path
     * @param query Query filters; entries without values are omitted
     * @return The parsed response
     */
    JsonNode get(String path, MultiValueMap<String, String> query) {
        return exchange(HttpMethod.GET, path, query, null, false);
    }

    /**
     * Issues a POST of an action against an /api path.
     *
     * @param path The API path
     * @param action The action name sent as ?action=...
     * @param body The JSON request body
     * @return The parsed response
     */
    JsonNode post(String path, String action, JsonNode body) {
        MultiValueMap<String, String> query = new LinkedMultiValueMap<>();
        query.add("action", action);
        return exchange(HttpMethod.POST, path, query, body, false);
    }

    private JsonNode exchange(HttpMethod method, String path, MultiValueMap<String, String> query,
                              JsonNode body, boolean retried) {
        String sessionToken = getValidSessionToken();
        try {
            WebClient.RequestBodySpec request = webClient.method(method)
                .uri(builder -> buildUri(builder, path, query))
                .header(SESSION_HEADER, sessionToken);
            String response;
            if (body != null) {
                String requestBody = objectMapper.writeValueAsString(body);
                logger.debug("vAPI {} {} request body: {}", method, path, requestBody);
                response = request.bodyValue(requestBody).retrieve().bodyToMono(String.class).block();
            } else {
                response = request.retrieve().bodyToMono(String.class).block();
            }
            logger.debug("vAPI {} {} raw response: {}", method, path, response);

            if (response == null || response.trim().isEmpty()) {
                logger.warn("Empty response received from vAPI endpoint: {}", path);
                return objectMapper.createObjectNode();
            }
            return objectMapper.readTree(response);
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.UNAUTHORIZED.value() && !retried) {
                logger.warn("Received 401 Unauthorized, clearing cached session token and retrying once");
                sessionTokens.remove(SESSION_KEY);
                return exchange(method, path, query, body, true);
            }
            VapiException error = VapiException.fromResponse(
                    e.getStatusCode().value(), e.getResponseBodyAsString(StandardCharsets.UTF_8), objectMapper, e);
            logger.error("vAPI {} {} failed: {}", method, path, error.getMessage());
            throw error;
        } catch (WebClientRequestException e) {
            logger.error("Connection error calling vAPI {} {}: {}", method, path, e.getMessage(), e);
            throw new VapiException("Connection issue when calling vCenter. Please ensure the vCenter server is accessible: "
                    + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            logger.error("Invalid JSON exchanged with vAPI {} {}: {}", method, path, e.getMessage(), e);
            throw new VapiException("Invalid JSON exchanged with vCenter: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Gets the cached session token, creating a session when there is none.
     *
     * @return A session token
     */
    String getValidSessionToken() {
        String sessionToken = sessionTokens.get(SESSION_KEY);
        if (sessionToken == null) {
            logger.info("No cached session token found, creating new session");
            sessionToken = createSession();
            sessionTokens.put(SESSION_KEY, sessionToken);
        }
        return sessionToken;
    }

    /**
     * Creates a session with basic credentials, first on /api/session and then on the
     * legacy /rest endpoint for vCenters older than 7.0U2.
     *
     * @return The session token
     * @throws VapiException if both endpoints reject the credentials
     */
    private String createSession() {
        RuntimeException lastFailure = null;
        for (String sessionPath : List.of(SESSION_PATH, LEGACY_SESSION_PATH)) {
            try {
                logger.info("Creating vAPI session via {}", sessionPath);
                String sessionResponse = webClient.post()
                    .uri(sessionPath)
                    .headers(headers -> headers.setBasicAuth(
                            vCenterConfig.getUsername(), vCenterConfig.getPassword(), StandardCharsets.UTF_8))
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
                String token = parseSessionToken(sessionResponse);
                logger.info("Successfully obtained vAPI session token via {}", sessionPath);
                return token;
            } catch (WebClientResponseException e) {
                logger.warn("Session creation via {} failed: {}", sessionPath, e.getStatusCode());
                lastFailure = VapiException.fromResponse(
                        e.getStatusCode().value(), e.getResponseBodyAsString(StandardCharsets.UTF_8), objectMapper, e);
                if (e.getStatusCode().value() != HttpStatus.NOT_FOUND.value()) {
                    break;
                }
            } catch (WebClientRequestException e) {
                throw new VapiException("Connection issue when authenticating with vCenter: " + e.getMessage(), e);
            }
        }
        logger.error("All authentication methods failed. Cannot establish vAPI session with vCenter.");
        throw new VapiException("Failed to authenticate with vCenter: "
                + (lastFailure != null ? lastFailure.getMessage() : "no session token returned"), lastFailure);
    }

    /**
     * Reads the token from either a JSON string ("token") or a {"value": "token"} document.
     */
    private String parseSessionToken(String sessionResponse) {
        if (sessionResponse == null || sessionResponse.trim().isEmpty()) {
            throw new VapiException("vCenter returned an empty session token", null);
        }
        String trimmed = sessionResponse.trim();
        try {
            JsonNode node = objectMapper.readTree(trimmed);
            if (node.isTextual()) {
                return node.asText();
            }
            if (node.has("value")) {
                return node.get("value").asText();
            }
        } catch (JsonProcessingException e) {
            logger.debug("Session response is not JSON, using it as plain token");
        }
        return trimmed.replaceAll("^\"|\"$", "");
    }

    private static URI buildUri(UriBuilder builder, String path, MultiValueMap<String, String> query) {
        builder.path(path);
        // Values go through URI variables so that names are encoded as data, not template
        Map<String, Object> variables = new HashMap<>();
        int index = 0;
        for (Map.Entry<String, List<String>> entry : query.entrySet()) {
            for (String value : entry.getValue()) {
                String variable = "q" + index++;
                builder.queryParam(entry.getKey(), "{" + variable + "}");
                variables.put(variable, value);
            }
        }
        return builder.build(variables);
    }

    /**
     * Builds a query map from name/value pairs, skipping null values.
     */
    private static MultiValueMap<String, String> filters(String... namesAndValues) {
        MultiValueMap<String, String> query = new LinkedMultiValueMap<>();
        for (int i = 0; i + 1 < namesAndValues.length; i += 2) {
            if (namesAndValues[i + 1] != null) {
                query.add(namesAndValues[i], namesAndValues[i + 1]);
            }
        }
        return query;
    }
}
