package org.tanzu.vcenterautomation.vcenter;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Name-to-identifier resolution for vCenter inventory objects.
 *
 * Every lookup returns the identifier of the first object whose name matches exactly,
 * or null when nothing matches. Duplicate names are logged as warnings and the first
 * match is used. Vendor errors propagate as {@link VapiException}.
 */
@Component
public class InventoryLookup {

    private static final Logger logger = LoggerFactory.getLogger(InventoryLookup.class);

    static final String VM_FOLDER_TYPE = "VIRTUAL_MACHINE";
    static final String NORMAL_MAINTENANCE_MODE = "normal";

    private final VapiClient vapiClient;
    private final VimClient vimClient;

    /**
     * @param vapiClient Client for the Automation REST API, used for every named lookup
     * @param vimClient Client for the VI/JSON API, used for datastore clusters
     */
    public InventoryLookup(VapiClient vapiClient, VimClient vimClient) {
        this.vapiClient = vapiClient;
        this.vimClient = vimClient;
    }

    /**
     * Resolves a datacenter by name.
     *
     * Datacenter names are unique per vCenter in practice, but the Automation API allows
     * duplicates in different folders; the first one listed wins.
     *
     * @param datacenterName The datacenter name
     * @return The datacenter identifier (e.g. "datacenter-3"), or null if none matches
     */
    public String getDatacenterByName(String datacenterName) {
        return firstId(vapiClient.datacenters().list(datacenterName), "datacenter", "datacenters", datacenterName);
    }

    /**
     * Resolves a datastore of a datacenter by name.
     *
     * @param datacenterId The datacenter identifier the search is limited to
     * @param datastoreName The datastore name
     * @return The datastore identifier, or null if none matches
     */
    public String getDatastoreByName(String datacenterId, String datastoreName) {
        return firstId(vapiClient.datastores().list(datastoreName, datacenterId), "datastore", "datastores", datastoreName);
    }

    /**
     * Resolves a VM folder of a datacenter.
     *
     * Only folders of type VIRTUAL_MACHINE are considered, so a host or network folder
     * with the same name is never picked as a deploy target.
     *
     * @param datacenterId The datacenter identifier the search is limited to
     * @param folderName The folder name, "vm" for the datacenter's root VM folder
     * @return The folder identifier, or null if none matches
     */
    public String getFolderByName(String datacenterId, String folderName) {
        return firstId(vapiClient.folders().list(folderName, datacenterId, VM_FOLDER_TYPE), "folder", "folders", folderName);
    }

    /**
     * Resolves an ESXi host of a datacenter by name.
     *
     * @param datacenterId The datacenter identifier the search is limited to
     * @param hostName The host name as registered in vCenter
     * @return The host identifier, or null if none matches
     */
    public String getHostByName(String datacenterId, String hostName) {
        return firstId(vapiClient.hosts().list(hostName, datacenterId), "host", "hosts", hostName);
    }

    /**
     * Resolves a cluster of a datacenter by name.
     *
     * @param datacenterId The datacenter identifier the search is limited to
     * @param clusterName The cluster name
     * @return The cluster identifier, or null if none matches
     */
    public String getClusterByName(String datacenterId, String clusterName) {
        return firstId(vapiClient.clusters().list(clusterName, datacenterId), "cluster", "clusters", clusterName);
    }

    /**
     * Resolves a resource pool of a datacenter, narrowed to a cluster and/or host when
     * their identifiers are given.
     *
     * @param datacenterId The datacenter identifier the search is limited to
     * @param resourcePoolName The resource pool name
     * @param clusterId Optional cluster identifier, null to search every cluster
     * @param hostId Optional host identifier, null to search every host
     * @return The resource pool identifier, or null if none matches
     */
    public String getResourcePoolByName(String datacenterId, String resourcePoolName, String clusterId, String hostId) {
        return firstId(vapiClient.resourcePools().list(resourcePoolName, datacenterId, clusterId, hostId),
                "resource_pool", "resource pools", resourcePoolName);
    }

    /**
     * Gets the root resource pool of a cluster.
     *
     * @param clusterId The cluster identifier
     * @return The resource pool identifier, or null if the cluster reports none
     */
    public String getClusterResourcePool(String clusterId) {
        JsonNode cluster = vapiClient.clusters().get(clusterId);
        String resourcePool = cluster.path("resource_pool").asText("");
        return resourcePool.isEmpty() ? null : resourcePool;
    }

    /**
     * Looks up a virtual machine by name anywhere in the inventory.
     *
     * @param vmName The VM name
     * @return The VM identifier, or null if no VM has that name
     */
    public String getVmByName(String vmName) {
        return firstId(vapiClient.vms().list(vmName), "vm", "VMs", vmName);
    }

    /**
     * Finds a library item by name in any content library.
     *
     * @param itemName The library item name
     * @return The library item identifier, or null if no library holds such an item
     */
    public String getLibraryItemByName(String itemName) {
        return firstValue(vapiClient.libraryItems().find(itemName, null), "library items", itemName);
    }

    /**
     * Finds a library item by name inside the named content library.
     *
     * @return The library item identifier, or null if the library or the item is missing
     */
    public String getLibraryItemFromContentLibraryName(String itemName, String libraryName) {
        String libraryId = firstValue(vapiClient.libraries().find(libraryName), "content libraries", libraryName);
        if (libraryId == null) {
            logger.info("Content library '{}' not found", libraryName);
            return null;
        }
        return firstValue(vapiClient.libraryItems().find(itemName, libraryId), "library items", itemName);
    }

    /**
     * Finds a datastore cluster (storage pod) by name.
     *
     * @return The storage pod reference, or null if none matches
     */
    public ManagedObjectReference findDatastoreClusterByName(String datastoreClusterName) {
        List<ManagedObjectReference> pods = vimClient.findByName("StoragePod", datastoreClusterName);
        return pods.isEmpty() ? null : pods.get(0);
    }

    /**
     * Picks the datastore of a datastore cluster a new VM should be placed on.
     *
     * When Storage DRS is enabled on the cluster, the first datastore of the first Storage
     * DRS recommendation is used. Otherwise, or when Storage DRS cannot make a
     * recommendation, the member datastore with the most free space is used, skipping
     * inaccessible datastores and datastores in maintenance.
     *
     * @param datastoreCluster The storage pod
     * @return The datastore identifier, or null if no member datastore qualifies
     */
    public String getRecommendedDatastore(ManagedObjectReference datastoreCluster) {
        if (isStorageDrsEnabled(datastoreCluster)) {
            String recommended = storageDrsRecommendation(datastoreCluster);
            if (recommended != null) {
                logger.info("Storage DRS recommends datastore {} in {}", recommended, datastoreCluster);
                return recommended;
            }
        }
        return datastoreWithMostFreeSpace(datastoreCluster);
    }

    private boolean isStorageDrsEnabled(ManagedObjectReference datastoreCluster) {
        JsonNode entry = vimClient.getProperty(datastoreCluster, "podStorageDrsEntry");
        boolean enabled = entry != null
                && entry.path("storageDrsConfig").path("podConfig").path("enabled").asBoolean(false);
        logger.debug("Storage DRS enabled on {}: {}", datastoreCluster, enabled);
        return enabled;
    }

    private String storageDrsRecommendation(ManagedObjectReference datastoreCluster) {
        try {
            JsonNode result = vimClient.recommendDatastores(datastoreCluster);
            JsonNode destination = result.path("recommendations").path(0).path("action").path(0).path("destination");
            String datastoreId = destination.path("value").asText("");
            if (datastoreId.isEmpty()) {
                logger.warn("Storage DRS returned no recommendation for {}, falling back to free space", datastoreCluster);
                return null;
            }
            return datastoreId;
        } catch (VapiException e) {
            logger.warn("Storage DRS recommendation for {} failed, falling back to free space: {}",
                       datastoreCluster, e.getMessage());
            return null;
        }
    }

    private String datastoreWithMostFreeSpace(ManagedObjectReference datastoreCluster) {
        String recommended = null;
        long mostFreeSpace = 0;
        for (JsonNode child : vimClient.getProperty(datastoreCluster, "childEntity")) {
            ManagedObjectReference ref = vimClient.toReference(child);
            if (!"Datastore".equals(ref.getType())) {
                continue;
            }
            JsonNode summary = vimClient.getProperty(ref, "summary");
            boolean accessible = summary.path("accessible").asBoolean(false);
            String maintenanceMode = summary.path("maintenanceMode").asText(NORMAL_MAINTENANCE_MODE);
            long freeSpace = summary.path("freeSpace").asLong(0);
            logger.debug("Datastore {} in {}: accessible={}, maintenanceMode={}, freeSpace={}",
                        ref.getValue(), datastoreCluster, accessible, maintenanceMode, freeSpace);
            if (accessible && NORMAL_MAINTENANCE_MODE.equals(maintenanceMode) && freeSpace > mostFreeSpace) {
                recommended = ref.getValue();
                mostFreeSpace = freeSpace;
            }
        }
        logger.info("Datastore with most free space in {}: {}", datastoreCluster, recommended);
        return recommended;
    }

    private String firstId(JsonNode summaries, String idField, String kind, String name) {
        String foundId = null;
        int matchCount = 0;
        for (JsonNode summary : summaries) {
            String id = summary.path(idField).asText("");
            if (id.isEmpty()) {
                continue;
            }
            if (foundId == null) {
                foundId = id;
            }
            matchCount++;
        }
        if (matchCount > 1) {
            logger.warn("WARNING: Found {} {} with the same name '{}'. Using the first match.", matchCount, kind, name);
        }
        return foundId;
    }

    private String firstValue(JsonNode ids, String kind, String name) {
        String foundId = null;
        int matchCount = 0;
        for (JsonNode id : ids) {
            if (id.asText("").isEmpty()) {
                continue;
            }
            if (foundId == null) {
                foundId = id.asText();
            }
            matchCount++;
        }
        if (matchCount > 1) {
            logger.warn("WARNING: Found {} {} with the same name '{}'. Using the first match.", matchCount, kind, name);
        }
        return foundId;
    }
}
