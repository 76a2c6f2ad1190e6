package org.tanzu.vcenterautomation.vcenter;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Request and result shapes of the OVF library item service
 * (/api/vcenter/ovf/library-item/{id}?action=filter|deploy).
 */
public final class OvfDeployment {

    private OvfDeployment() {
    }

    /**
     * Where a library item gets deployed: resource pool, optional host, optional folder.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class DeploymentTarget {
        private final String resourcePoolId;
        private final String hostId;
        private final String folderId;

        public DeploymentTarget(String resourcePoolId, String hostId, String folderId) {
            this.resourcePoolId = resourcePoolId;
            this.hostId = hostId;
            this.folderId = folderId;
        }

        @JsonProperty("resource_pool_id")
        public String getResourcePoolId() { return resourcePoolId; }

        @JsonProperty("host_id")
        public String getHostId() { return hostId; }

        @JsonProperty("folder_id")
        public String getFolderId() { return folderId; }

        @Override
        public String toString() {
            return "DeploymentTarget{resourcePoolId='" + resourcePoolId + "', hostId='" + hostId
                    + "', folderId='" + folderId + "'}";
        }
    }

    /**
     * Deployment spec for a resource pool target. Mappings, profiles and flags are left
     * to the OVF descriptor defaults.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ResourcePoolDeploymentSpec {
        private final String name;
        private final String annotation;
        private final boolean acceptAllEula;
        private final String storageProvisioning;
        private final String defaultDatastoreId;

        public ResourcePoolDeploymentSpec(String name, String annotation, boolean acceptAllEula,
                                          String storageProvisioning, String defaultDatastoreId) {
            this.name = name;
            this.annotation = annotation;
            this.acceptAllEula = acceptAllEula;
            this.storageProvisioning = storageProvisioning;
            this.defaultDatastoreId = defaultDatastoreId;
        }

        @JsonProperty("name")
        public String getName() { return name; }

        @JsonProperty("annotation")
        public String getAnnotation() { return annotation; }

        @JsonProperty("accept_all_EULA")
        public boolean isAcceptAllEula() { return acceptAllEula; }

        @JsonProperty("storage_provisioning")
        public String getStorageProvisioning() { return storageProvisioning; }

        @JsonProperty("default_datastore_id")
        public String getDefaultDatastoreId() { return defaultDatastoreId; }

        @Override
        public String toString() {
            return "ResourcePoolDeploymentSpec{name='" + name + "', storageProvisioning='" + storageProvisioning
                    + "', defaultDatastoreId='" + defaultDatastoreId + "'}";
        }
    }

    /**
     * Flattened deploy outcome: whether vCenter reports success, the id of the created
     * resource, and the vendor messages describing errors.
     */
    public static class DeploymentResult {
        private final boolean succeeded;
        private final String id;
        private final String message;

        public DeploymentResult(boolean succeeded, String id, String message) {
            this.succeeded = succeeded;
            this.id = id;
            this.message = message;
        }

        /**
         * Reads an OVF deployment result document.
         *
         * @param node {"succeeded": ..., "resource_id": {"type", "id"}, "error": {"errors": [...]}}
         * @return The flattened result
         */
        public static DeploymentResult fromJson(JsonNode node) {
            boolean succeeded = node.path("succeeded").asBoolean(false);
            String id = node.path("resource_id").path("id").asText("");

            List<String> messages = new ArrayList<>();
            for (JsonNode error : node.path("error").path("errors")) {
                String text = error.path("message").path("default_message").asText("");
                if (!text.isEmpty()) {
                    messages.add(text);
                }
                for (JsonNode nested : error.path("error").path("messages")) {
                    String nestedText = nested.path("default_message").asText("");
                    if (!nestedText.isEmpty()) {
                        messages.add(nestedText);
                    }
                }
            }
            return new DeploymentResult(succeeded, id, String.join(", ", messages));
        }

        public boolean isSucceeded() { return succeeded; }
        public String getId() { return id; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return "DeploymentResult{succeeded=" + succeeded + ", id='" + id + "', message='" + message + "'}";
        }
    }
}
