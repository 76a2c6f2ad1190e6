package org.tanzu.vcenterautomation.modules;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.tanzu.vcenterautomation.config.VCenterConfig;
import org.tanzu.vcenterautomation.vcenter.InventoryLookup;
import org.tanzu.vcenterautomation.vcenter.ManagedObjectReference;
import org.tanzu.vcenterautomation.vcenter.OvfDeployment.DeploymentResult;
import org.tanzu.vcenterautomation.vcenter.OvfDeployment.DeploymentTarget;
import org.tanzu.vcenterautomation.vcenter.OvfDeployment.ResourcePoolDeploymentSpec;
import org.tanzu.vcenterautomation.vcenter.VapiClient;
import org.tanzu.vcenterautomation.vcenter.VapiException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deploys a virtual machine from an OVF template stored in a content library.
 *
 * Every named placement object (datacenter, datastore or datastore cluster, folder, host,
 * resource pool or cluster) is resolved to an identifier before the single deploy call.
 * An existing VM with the requested name is left untouched.
 */
@Component
public class ContentDeployOvfTemplate {

    private static final Logger logger = LoggerFactory.getLogger(ContentDeployOvfTemplate.class);

    public static final String MODULE_NAME = "vmware_content_deploy_ovf_template";

    static final List<String> STORAGE_PROVISIONING_CHOICES =
            List.of("thin", "thick", "eagerZeroedThick", "eagerzeroedthick");

    private final VapiClient vapiClient;
    private final InventoryLookup inventoryLookup;
    private final VCenterConfig vCenterConfig;

    public ContentDeployOvfTemplate(VapiClient vapiClient, InventoryLookup inventoryLookup,
                                    VCenterConfig vCenterConfig) {
        this.vapiClient = vapiClient;
        this.inventoryLookup = inventoryLookup;
        this.vCenterConfig = vCenterConfig;
    }

    /**
     * Runs the module.
     *
     * @param params The module parameters
     * @param checkMode When true, report what would change without deploying
     * @return The module result; vendor and lookup errors are reported as failed results
     */
    public ModuleResult run(DeployOvfTemplateParams params, boolean checkMode) {
        logger.info("=== MODULE CALLED: {}({}, checkMode={}) ===", MODULE_NAME, params, checkMode);
        try {
            params.validate();
            String storageProvisioning = resolveStorageProvisioning(params.getStorageProvisioning());

            String existingVmId = inventoryLookup.getVmByName(params.getName());
            if (existingVmId != null) {
                logger.info("Virtual machine '{}' already exists as {}", params.getName(), existingVmId);
                return ModuleResult.exit(false)
                        .put("vm_deploy_info", deployInfo(
                                "Virtual Machine '" + params.getName() + "' already Exists.", existingVmId));
            }

            if (checkMode) {
                return ModuleResult.exit(true)
                        .put("vm_name", params.getName())
                        .put("desired_operation", "Create VM with PowerOff State");
            }

            return deploy(params, storageProvisioning);
        } catch (ModuleFailedException e) {
            logger.error("{} failed: {}", MODULE_NAME, e.getMessage());
            return ModuleResult.fail(e.getMessage());
        } catch (VapiException e) {
            logger.error("{} failed with vCenter error: {}", MODULE_NAME, e.getMessage(), e);
            return ModuleResult.fail(e.getVendorMessage());
        }
    }

    private ModuleResult deploy(DeployOvfTemplateParams params, String storageProvisioning) {
        String datacenterId = inventoryLookup.getDatacenterByName(params.getDatacenter());
        if (datacenterId == null) {
            throw new ModuleFailedException("Failed to find the datacenter " + params.getDatacenter());
        }

        String datastoreId = null;
        if (params.getDatastore() != null) {
            datastoreId = inventoryLookup.getDatastoreByName(datacenterId, params.getDatastore());
            if (datastoreId == null) {
                throw new ModuleFailedException("Failed to find the datastore " + params.getDatastore());
            }
        }
        if (params.getDatastoreCluster() != null && datastoreId == null) {
            ManagedObjectReference datastoreCluster =
                    inventoryLookup.findDatastoreClusterByName(params.getDatastoreCluster());
            if (datastoreCluster == null) {
                throw new ModuleFailedException("Failed to find the datastore cluster " + params.getDatastoreCluster());
            }
            datastoreId = inventoryLookup.getRecommendedDatastore(datastoreCluster);
        }
        if (datastoreId == null) {
            throw new ModuleFailedException("Failed to find the datastore using either datastore or datastore cluster");
        }

        String libraryItemId = resolveLibraryItem(params.getTemplate(), params.getLibrary());

        String folderId = inventoryLookup.getFolderByName(datacenterId, params.getFolder());
        if (folderId == null) {
            throw new ModuleFailedException("Failed to find the folder " + params.getFolder());
        }

        String hostId = null;
        if (params.getHost() != null) {
            hostId = inventoryLookup.getHostByName(datacenterId, params.getHost());
            if (hostId == null) {
                throw new ModuleFailedException("Failed to find the Host " + params.getHost());
            }
        }

        String resourcePoolId = resolveResourcePool(params, datacenterId, hostId);

        // The host narrows the resource pool lookup only; the target carries pool and folder.
        DeploymentTarget target = new DeploymentTarget(resourcePoolId, null, folderId);
        JsonNode ovfSummary = vapiClient.ovf().filter(libraryItemId, target);
        String annotation = ovfSummary.path("annotation").asText("");

        ResourcePoolDeploymentSpec spec = new ResourcePoolDeploymentSpec(
                params.getName(), annotation, true, storageProvisioning, datastoreId);

        DeploymentResult result = vapiClient.ovf().deploy(libraryItemId, target, spec);
        logger.info("Deployment result for '{}': {}", params.getName(), result);

        if (result.isSucceeded()) {
            return ModuleResult.exit(true)
                    .put("vm_deploy_info", deployInfo(
                            "Deployed Virtual Machine '" + params.getName() + "'.", result.getId()));
        }
        ModuleResult failed = ModuleResult.exit(false)
                .put("vm_deploy_info", deployInfo("Virtual Machine deployment failed", ""));
        if (!result.getMessage().isEmpty()) {
            failed.warn(result.getMessage());
        }
        return failed;
    }

    private String resolveLibraryItem(String template, String library) {
        if (library != null) {
            String libraryItemId = inventoryLookup.getLibraryItemFromContentLibraryName(template, library);
            if (libraryItemId == null) {
                throw new ModuleFailedException(
                        "Failed to find the library Item " + template + " in content library " + library);
            }
            return libraryItemId;
        }
        String libraryItemId = inventoryLookup.getLibraryItemByName(template);
        if (libraryItemId == null) {
            throw new ModuleFailedException("Failed to find the library Item " + template);
        }
        return libraryItemId;
    }

    private String resolveResourcePool(DeployOvfTemplateParams params, String datacenterId, String hostId) {
        String resourcePoolId = null;
        if (params.getResourcePool() != null) {
            String clusterId = null;
            if (params.getCluster() != null) {
                clusterId = inventoryLookup.getClusterByName(datacenterId, params.getCluster());
                if (clusterId == null) {
                    throw new ModuleFailedException("Failed to find the Cluster " + params.getCluster());
                }
            }
            resourcePoolId = inventoryLookup.getResourcePoolByName(
                    datacenterId, params.getResourcePool(), clusterId, hostId);
            if (resourcePoolId == null) {
                throw new ModuleFailedException("Failed to find the resource_pool " + params.getResourcePool());
            }
        } else if (params.getCluster() != null) {
            String clusterId = inventoryLookup.getClusterByName(datacenterId, params.getCluster());
            if (clusterId == null) {
                throw new ModuleFailedException("Failed to find the Cluster " + params.getCluster());
            }
            resourcePoolId = inventoryLookup.getClusterResourcePool(clusterId);
        }
        if (resourcePoolId == null) {
            throw new ModuleFailedException("Failed to find a resource pool either by name or cluster");
        }
        return resourcePoolId;
    }

    String resolveStorageProvisioning(String requested) {
        String value = requested != null ? requested : vCenterConfig.getDefaultStorageProvisioning();
        if (!STORAGE_PROVISIONING_CHOICES.contains(value)) {
            throw new ModuleFailedException("value of storage_provisioning must be one of: "
                    + String.join(", ", STORAGE_PROVISIONING_CHOICES) + ", got: " + value);
        }
        return "eagerzeroedthick".equals(value) ? "eagerZeroedThick" : value;
    }

    private static Map<String, Object> deployInfo(String msg, String vmId) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("msg", msg);
        info.put("vm_id", vmId);
        return info;
    }
}
