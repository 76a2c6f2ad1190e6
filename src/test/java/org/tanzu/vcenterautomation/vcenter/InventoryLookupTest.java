package org.tanzu.vcenterautomation.vcenter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InventoryLookupTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private VapiClient vapiClient;
    @Mock
    private VimClient vimClient;
    @Mock
    private VapiClient.DataCenterService datacenters;
    @Mock
    private VapiClient.FolderService folders;
    @Mock
    private VapiClient.ClusterService clusters;
    @Mock
    private VapiClient.LibraryService libraries;
    @Mock
    private VapiClient.LibraryItemService libraryItems;

    private InventoryLookup lookup;

    @BeforeEach
    void setUp() {
        lookup = new InventoryLookup(vapiClient, vimClient);
    }

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Test
    void returnsFirstOfDuplicateDatacenters() throws Exception {
        when(vapiClient.datacenters()).thenReturn(datacenters);
        when(datacenters.list("DC East")).thenReturn(json(
                "[{\"datacenter\":\"datacenter-3\",\"name\":\"DC East\"},{\"datacenter\":\"datacenter-9\",\"name\":\"DC East\"}]"));

        assertEquals("datacenter-3", lookup.getDatacenterByName("DC East"));
    }

    @Test
    void returnsNullWhenNothingMatches() throws Exception {
        when(vapiClient.datacenters()).thenReturn(datacenters);
        when(datacenters.list("DC West")).thenReturn(json("[]"));

        assertNull(lookup.getDatacenterByName("DC West"));
    }

    @Test
    void restrictsFolderLookupToVmFolders() throws Exception {
        when(vapiClient.folders()).thenReturn(folders);
        when(folders.list("Web", "datacenter-3", "VIRTUAL_MACHINE"))
                .thenReturn(json("[{\"folder\":\"group-v4\",\"name\":\"Web\",\"type\":\"VIRTUAL_MACHINE\"}]"));

        assertEquals("group-v4", lookup.getFolderByName("datacenter-3", "Web"));
    }

    @Test
    void readsRootResourcePoolOfCluster() throws Exception {
        when(vapiClient.clusters()).thenReturn(clusters);
        when(clusters.get("domain-c8")).thenReturn(json("{\"name\":\"Compute\",\"resource_pool\":\"resgroup-9\"}"));

        assertEquals("resgroup-9", lookup.getClusterResourcePool("domain-c8"));
    }

    @Test
    void findsLibraryItemInsideNamedLibrary() throws Exception {
        when(vapiClient.libraries()).thenReturn(libraries);
        when(vapiClient.libraryItems()).thenReturn(libraryItems);
        when(libraries.find("Templates")).thenReturn(json("[\"lib-1\"]"));
        when(libraryItems.find("ubuntu-22.04", "lib-1")).thenReturn(json("[\"item-7\"]"));

        assertEquals("item-7", lookup.getLibraryItemFromContentLibraryName("ubuntu-22.04", "Templates"));
    }

    @Test
    void skipsItemSearchWhenLibraryIsMissing() throws Exception {
        when(vapiClient.libraries()).thenReturn(libraries);
        when(libraries.find("Templates")).thenReturn(json("[]"));

        assertNull(lookup.getLibraryItemFromContentLibraryName("ubuntu-22.04", "Templates"));
        verify(vapiClient, never()).libraryItems();
    }

    @Test
    void findsLibraryItemInAnyLibrary() throws Exception {
        when(vapiClient.libraryItems()).thenReturn(libraryItems);
        when(libraryItems.find("ubuntu-22.04", null)).thenReturn(json("[\"item-7\",\"item-8\"]"));

        assertEquals("item-7", lookup.getLibraryItemByName("ubuntu-22.04"));
    }

    @Test
    void findsDatastoreClusterThroughVimClient() {
        ManagedObjectReference pod = new ManagedObjectReference("StoragePod", "group-p2");
        when(vimClient.findByName("StoragePod", "Gold")).thenReturn(List.of(pod));

        assertEquals(pod, lookup.findDatastoreClusterByName("Gold"));
    }

    private void stubStorageDrs(ManagedObjectReference pod, boolean enabled) throws Exception {
        when(vimClient.getProperty(pod, "podStorageDrsEntry")).thenReturn(json(
                "{\"storageDrsConfig\":{\"podConfig\":{\"enabled\":" + enabled + ",\"defaultVmBehavior\":\"automated\"}}}"));
    }

    @Test
    void usesStorageDrsRecommendationWhenEnabled() throws Exception {
        ManagedObjectReference pod = new ManagedObjectReference("StoragePod", "group-p2");
        stubStorageDrs(pod, true);
        when(vimClient.recommendDatastores(pod)).thenReturn(json("{\"recommendations\":["
                + "{\"key\":\"1\",\"action\":[{\"_typeName\":\"StoragePlacementAction\","
                + "\"destination\":{\"type\":\"Datastore\",\"value\":\"datastore-2\"}}]},"
                + "{\"key\":\"2\",\"action\":[{\"destination\":{\"type\":\"Datastore\",\"value\":\"datastore-4\"}}]}]}"));

        assertEquals("datastore-2", lookup.getRecommendedDatastore(pod));
        verify(vimClient, never()).getProperty(pod, "childEntity");
    }

    @Test
    void fallsBackToFreeSpaceWhenStorageDrsFails() throws Exception {
        ManagedObjectReference pod = new ManagedObjectReference("StoragePod", "group-p2");
        stubStorageDrs(pod, true);
        when(vimClient.recommendDatastores(pod)).thenThrow(new VapiException("Storage DRS is not available", null));
        when(vimClient.getProperty(pod, "childEntity"))
                .thenReturn(json("[{\"type\":\"Datastore\",\"value\":\"datastore-4\"}]"));
        when(vimClient.toReference(any(JsonNode.class))).thenReturn(new ManagedObjectReference("Datastore", "datastore-4"));
        when(vimClient.getProperty(new ManagedObjectReference("Datastore", "datastore-4"), "summary"))
                .thenReturn(json("{\"accessible\":true,\"maintenanceMode\":\"normal\",\"freeSpace\":500}"));

        assertEquals("datastore-4", lookup.getRecommendedDatastore(pod));
    }

    @Test
    void recommendsAccessibleDatastoreWithMostFreeSpace() throws Exception {
        ManagedObjectReference pod = new ManagedObjectReference("StoragePod", "group-p2");
        stubStorageDrs(pod, false);
        JsonNode children = json("[{\"type\":\"Datastore\",\"value\":\"datastore-1\"},"
                + "{\"type\":\"Datastore\",\"value\":\"datastore-2\"},"
                + "{\"type\":\"Datastore\",\"value\":\"datastore-3\"},"
                + "{\"type\":\"Datastore\",\"value\":\"datastore-4\"}]");
        when(vimClient.getProperty(pod, "childEntity")).thenReturn(children);
        when(vimClient.toReference(any(JsonNode.class))).thenAnswer(invocation -> {
            JsonNode node = invocation.getArgument(0);
            return new ManagedObjectReference(node.path("type").asText(), node.path("value").asText());
        });
        // Largest, but in maintenance
        when(vimClient.getProperty(new ManagedObjectReference("Datastore", "datastore-1"), "summary"))
                .thenReturn(json("{\"accessible\":true,\"maintenanceMode\":\"inMaintenance\",\"freeSpace\":900}"));
        when(vimClient.getProperty(new ManagedObjectReference("Datastore", "datastore-2"), "summary"))
                .thenReturn(json("{\"accessible\":true,\"maintenanceMode\":\"normal\",\"freeSpace\":300}"));
        when(vimClient.getProperty(new ManagedObjectReference("Datastore", "datastore-3"), "summary"))
                .thenReturn(json("{\"accessible\":false,\"maintenanceMode\":\"normal\",\"freeSpace\":800}"));
        when(vimClient.getProperty(new ManagedObjectReference("Datastore", "datastore-4"), "summary"))
                .thenReturn(json("{\"accessible\":true,\"maintenanceMode\":\"normal\",\"freeSpace\":500}"));

        assertEquals("datastore-4", lookup.getRecommendedDatastore(pod));
    }

    @Test
    void recommendsNothingWhenNoDatastoreQualifies() throws Exception {
        ManagedObjectReference pod = new ManagedObjectReference("StoragePod", "group-p2");
        stubStorageDrs(pod, false);
        when(vimClient.getProperty(pod, "childEntity")).thenReturn(json("[]"));

        assertNull(lookup.getRecommendedDatastore(pod));
        verify(vimClient, never()).recommendDatastores(pod);
    }
}
