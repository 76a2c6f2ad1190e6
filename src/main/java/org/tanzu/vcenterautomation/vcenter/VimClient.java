package org.tanzu.vcenterautomation.vcenter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriUtils;
import org.tanzu.vcenterautomation.config.VCenterConfig;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Client for the vSphere VI/JSON API (/sdk/vim25/{release}).
 *
 * The Automation REST API does not expose authorization data or storage pods, so the
 * permission lookups and datastore cluster resolution go through the VI/JSON API, which
 * maps every managed object method and property to a URL:
 * - GET  /{moType}/{moId}/{property}
 * - POST /{moType}/{moId}/{method} with the method arguments as a JSON object
 *
 * Sessions are created through SessionManager.Login; the token comes back in the
 * vmware-api-session-id response header and is cached like the vAPI session.
 */
@Component
public class VimClient {

    private static final Logger logger = LoggerFactory.getLogger(VimClient.class);

    static final String SESSION_HEADER = "vmware-api-session-id";

    private static final String SESSION_KEY = "session";

    private final VCenterConfig vCenterConfig;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    /** Cached VI/JSON session token */
    private final ConcurrentHashMap<String, String> sessionTokens = new ConcurrentHashMap<>();

    /**
     * Creates a VI/JSON client for the vCenter named in the configuration.
     *
     * No request is sent until the first call; the session is created on demand and
     * renewed once when vCenter answers 401.
     *
     * @param vCenterConfig Connection settings, including the vSphere release used in paths
     * @param webClientBuilder Builder carrying the SSL, proxy and codec settings; it is cloned
     */
    public VimClient(VCenterConfig vCenterConfig, WebClient.Builder webClientBuilder) {
        this.vCenterConfig = vCenterConfig;
        this.objectMapper = new ObjectMapper();

        String baseUrl = vCenterConfig.getBaseUrl();
        logger.info("Initializing VimClient for vCenter: {} (release={})", baseUrl, vCenterConfig.getVimRelease());

        this.webClient = webClientBuilder.clone()
            .baseUrl(baseUrl)
            .build();
    }

    /**
     * Retrieves the service content of the vCenter (root folder, managers, about info).
     * This call does not require a session.
     *
     * @return JsonNode ServiceContent
     */
    public JsonNode retrieveServiceContent() {
        logger.info("=== VIM SERVICE INSTANCE: content ===");
        return send(HttpMethod.GET, path("ServiceInstance", "ServiceInstance", "content"), null, null);
    }

    /**
     * Reads one property of a managed object.
     *
     * @param ref The managed object
     * @param property Property name, e.g. "name" or "summary"
     * @return The property value
     */
    public JsonNode getProperty(ManagedObjectReference ref, String property) {
        logger.debug("VIM property {}.{}", ref, property);
        return invoke(HttpMethod.GET, path(ref.getType(), ref.getValue(), property), null);
    }

    /**
     * Finds every managed object of a type whose name equals the given name, searching the
     * whole inventory below the root folder.
     *
     * vCenter stores "/", "\" and "%" in inventory names escaped as %2f, %5c and %25, so
     * both the stored and the requested name are unescaped before they are compared. A
     * folder created as "prod/web" is found whether the caller asks for "prod/web" or
     * "prod%2fweb".
     *
     * @param type Managed object type, e.g. "Datacenter" or "StoragePod"
     * @param name Exact, case-sensitive object name
     * @return The matching objects in inventory order, empty if none
     */
    public List<ManagedObjectReference> findByName(String type, String name) {
        logger.info("=== VIM FIND: {} named '{}' ===", type, name);
        JsonNode content = retrieveServiceContent();
        ManagedObjectReference rootFolder = toReference(content.path("rootFolder"));
        ManagedObjectReference viewManager = toReference(content.path("viewManager"));

        ObjectNode request = objectMapper.createObjectNode();
        request.set("container", objectMapper.valueToTree(rootFolder));
        ArrayNode types = request.putArray("type");
        types.add(type);
        request.put("recursive", true);
        ManagedObjectReference view = toReference(
                invoke(HttpMethod.POST, path(viewManager.getType(), viewManager.getValue(), "CreateContainerView"), request));

        String wanted = unescapeName(name);
        List<ManagedObjectReference> matches = new ArrayList<>();
        try {
            for (JsonNode candidate : getProperty(view, "view")) {
                ManagedObjectReference ref = toReference(candidate);
                if (wanted.equals(unescapeName(getProperty(ref, "name").asText()))) {
                    matches.add(ref);
                }
            }
        } finally {
            invoke(HttpMethod.POST, path(view.getType(), view.getValue(), "DestroyView"), null);
        }

        if (matches.size() > 1) {
            logger.warn("WARNING: Found {} objects of type {} with the same name '{}'. Using the first match.",
                       matches.size(), type, name);
        }
        return matches;
    }

    /**
     * Asks Storage DRS where a new virtual machine should be placed inside a datastore
     * cluster.
     *
     * The placement spec is a "create" request naming only the storage pod, which is
     * what vCenter needs to rank the member datastores. Storage DRS must be enabled on
     * the pod, otherwise vCenter answers with a fault.
     *
     * @param storagePod The datastore cluster
     * @return JsonNode StoragePlacementResult; its recommendations are ordered best first
     * @throws VapiException if vCenter rejects the request
     */
    public JsonNode recommendDatastores(ManagedObjectReference storagePod) {
        logger.info("=== VIM STORAGE RESOURCE MANAGER: RecommendDatastores({}) ===", storagePod);
        ManagedObjectReference storageResourceManager =
                toReference(retrieveServiceContent().path("storageResourceManager"));

        ObjectNode podSelectionSpec = objectMapper.createObjectNode();
        podSelectionSpec.put("_typeName", "StorageDrsPodSelectionSpec");
        podSelectionSpec.set("storagePod", objectMapper.valueToTree(storagePod));

        ObjectNode storageSpec = objectMapper.createObjectNode();
        storageSpec.put("_typeName", "StoragePlacementSpec");
        storageSpec.put("type", "create");
        storageSpec.set("podSelectionSpec", podSelectionSpec);

        ObjectNode request = objectMapper.createObjectNode();
        request.set("storageSpec", storageSpec);
        return invoke(HttpMethod.POST,
                path(storageResourceManager.getType(), storageResourceManager.getValue(), "RecommendDatastores"), request);
    }

    /**
     * Retrieves the permissions defined on an entity.
     *
     * @param authorizationManager The authorization manager from the service content
     * @param entity The entity whose permissions are read
     * @param inherited Whether to include permissions inherited from parents
     * @return JsonNode array of Permission objects
     */
    public JsonNode retrieveEntityPermissions(ManagedObjectReference authorizationManager,
                                              ManagedObjectReference entity, boolean inherited) {
        logger.info("=== VIM AUTHORIZATION MANAGER: RetrieveEntityPermissions({}, inherited={}) ===", entity, inherited);
        ObjectNode request = objectMapper.createObjectNode();
        request.set("entity", objectMapper.valueToTree(entity));
        request.put("inherited", inherited);
        return invoke(HttpMethod.POST,
                path(authorizationManager.getType(), authorizationManager.getValue(), "RetrieveEntityPermissions"), request);
    }

    /**
     * Lists the roles known to the authorization manager.
     *
     * @param authorizationManager The authorization manager from the service content
     * @return JsonNode array of AuthorizationRole objects
     */
    public JsonNode retrieveRoleList(ManagedObjectReference authorizationManager) {
        return getProperty(authorizationManager, "roleList");
    }

    /**
     * Reads a managed object reference out of a JSON node.
     *
     * @param node {"type": ..., "value": ...}
     * @return The reference
     * @throws VapiException if the node is not a reference
     */
    public ManagedObjectReference toReference(JsonNode node) {
        if (node == null || !node.hasNonNull("type") || !node.hasNonNull("value")) {
            throw new VapiException("Expected a managed object reference but got: " + node, null);
        }
        return new ManagedObjectReference(node.get("type").asText(), node.get("value").asText());
    }

    /**
     * Undoes the percent escaping vCenter applies to inventory names. Text that is not a
     * valid escape sequence is returned unchanged.
     *
     * @param name Stored or requested object name
     * @return The unescaped name
     */
    static String unescapeName(String name) {
        try {
            return UriUtils.decode(name, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            logger.debug("Name '{}' is not percent-escaped, comparing it as is", name);
            return name;
        }
    }

    private JsonNode invoke(HttpMethod method, String path, JsonNode body) {
        try {
            return send(method, path, body, getValidSessionToken());
        } catch (VapiException e) {
            if (e.getStatusCode() == HttpStatus.UNAUTHORIZED.value()) {
                logger.warn("Received 401 Unauthorized from VI/JSON API, clearing cached session token and retrying once");
                sessionTokens.remove(SESSION_KEY);
                return send(method, path, body, getValidSessionToken());
            }
            throw e;
        }
    }

    private JsonNode send(HttpMethod method, String path, JsonNode body, String sessionToken) {
        try {
            WebClient.RequestBodySpec request = webClient.method(method).uri(path);
            if (sessionToken != null) {
                request = request.header(SESSION_HEADER, sessionToken);
            }
            String response;
            if (body != null) {
                response = request.bodyValue(objectMapper.writeValueAsString(body))
                    .retrieve().bodyToMono(String.class).block();
            } else {
                response = request.retrieve().bodyToMono(String.class).block();
            }
            logger.debug("VIM {} {} raw response: {}", method, path, response);

            if (response == null || response.trim().isEmpty()) {
                return objectMapper.nullNode();
            }
            return objectMapper.readTree(response);
        } catch (WebClientResponseException e) {
            VapiException error = VapiException.fromResponse(
                    e.getStatusCode().value(), e.getResponseBodyAsString(StandardCharsets.UTF_8), objectMapper, e);
            logger.error("VIM {} {} failed: {}", method, path, error.getMessage());
            throw error;
        } catch (WebClientRequestException e) {
            logger.error("Connection error calling VIM {} {}: {}", method, path, e.getMessage(), e);
            throw new VapiException("Connection issue when calling vCenter. Please ensure the vCenter server is accessible: "
                    + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new VapiException("Invalid JSON exchanged with vCenter: " + e.getOriginalMessage(), e);
        }
    }

    private String getValidSessionToken() {
        String sessionToken = sessionTokens.get(SESSION_KEY);
        if (sessionToken == null) {
            logger.info("No cached VI/JSON session token found, logging in");
            sessionToken = login();
            sessionTokens.put(SESSION_KEY, sessionToken);
        }
        return sessionToken;
    }

    /**
     * Logs in through the session manager named in the service content.
     *
     * @return The session token
     * @throws VapiException if the credentials are rejected or no token is returned
     */
    private String login() {
        ManagedObjectReference sessionManager = toReference(retrieveServiceContent().path("sessionManager"));
        ObjectNode credentials = objectMapper.createObjectNode();
        credentials.put("userName", vCenterConfig.getUsername());
        credentials.put("password", vCenterConfig.getPassword());

        try {
            ResponseEntity<String> response = webClient.post()
                .uri(path(sessionManager.getType(), sessionManager.getValue(), "Login"))
                .bodyValue(objectMapper.writeValueAsString(credentials))
                .retrieve()
                .toEntity(String.class)
                .block();
            String token = response == null ? null : response.getHeaders().getFirst(SESSION_HEADER);
            if (token == null || token.isEmpty()) {
                throw new VapiException("vCenter did not return a VI/JSON session token", null);
            }
            logger.info("Successfully logged in to VI/JSON API as {}", vCenterConfig.getUsername());
            return token;
        } catch (WebClientResponseException e) {
            VapiException error = VapiException.fromResponse(
                    e.getStatusCode().value(), e.getResponseBodyAsString(StandardCharsets.UTF_8), objectMapper, e);
            logger.error("VI/JSON login failed: {}", error.getMessage());
            throw new VapiException("Failed to authenticate with vCenter: " + error.getVendorMessage(), error);
        } catch (WebClientRequestException e) {
            throw new VapiException("Connection issue when authenticating with vCenter: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new VapiException("Invalid login request: " + e.getOriginalMessage(), e);
        }
    }

    private String path(String type, String id, String member) {
        return "/sdk/vim25/" + vCenterConfig.getVimRelease() + "/" + type + "/" + id + "/" + member;
    }
}
