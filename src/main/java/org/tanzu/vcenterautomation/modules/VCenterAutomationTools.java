package org.tanzu.vcenterautomation.modules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * Exposes the vCenter automation modules as MCP tools.
 *
 * Each tool builds the module parameters from its arguments and returns the module
 * result document unchanged, so failures reach the MCP client as "failed": true with
 * the reason in "msg".
 */
@Service
public class VCenterAutomationTools {

    private static final Logger logger = LoggerFactory.getLogger(VCenterAutomationTools.class);

    private final ContentDeployOvfTemplate contentDeployOvfTemplate;
    private final ObjectPermissionsInfo objectPermissionsInfo;

    public VCenterAutomationTools(ContentDeployOvfTemplate contentDeployOvfTemplate,
                                  ObjectPermissionsInfo objectPermissionsInfo) {
        this.contentDeployOvfTemplate = contentDeployOvfTemplate;
        this.objectPermissionsInfo = objectPermissionsInfo;
    }

    /**
     * Deploys a VM from an OVF template in a content library. Does nothing when a VM with
     * the requested name already exists.
     */
    @Tool(description = "Deploy a virtual machine from an OVF template stored in a vCenter content library. "
            + "Does nothing if a VM with the same name already exists. Either datastore or datastoreCluster, "
            + "and either resourcePool or cluster, must be given.")
    public ModuleResult deployOvfTemplate(
            @ToolParam(description = "Name of the OVF template (content library item)") String template,
            @ToolParam(description = "Name of the virtual machine to create") String name,
            @ToolParam(description = "Name of the datacenter to deploy into") String datacenter,
            @ToolParam(description = "Name of the content library holding the template", required = false) String library,
            @ToolParam(description = "Name of the datastore", required = false) String datastore,
            @ToolParam(description = "Name of the datastore cluster; its datastore with the most free space is used",
                    required = false) String datastoreCluster,
            @ToolParam(description = "Name of the VM folder, defaults to 'vm'", required = false) String folder,
            @ToolParam(description = "Name of the ESXi host", required = false) String host,
            @ToolParam(description = "Name of the resource pool", required = false) String resourcePool,
            @ToolParam(description = "Name of the cluster whose root resource pool is used", required = false) String cluster,
            @ToolParam(description = "Disk provisioning: thin, thick or eagerZeroedThick", required = false)
                    String storageProvisioning) {
        logger.info("=== MCP TOOL CALLED: deployOvfTemplate({}, {}) ===", template, name);
        DeployOvfTemplateParams params = new DeployOvfTemplateParams();
        params.setTemplate(template);
        params.setName(name);
        params.setDatacenter(datacenter);
        params.setLibrary(library);
        params.setDatastore(datastore);
        params.setDatastoreCluster(datastoreCluster);
        params.setFolder(folder);
        params.setHost(host);
        params.setResourcePool(resourcePool);
        params.setCluster(cluster);
        params.setStorageProvisioning(storageProvisioning);
        return contentDeployOvfTemplate.run(params, false);
    }

    /**
     * Lists the permissions a user or group holds directly on an inventory object.
     */
    @Tool(description = "Get the permissions defined on a vCenter inventory object for a user (principal) or a group. "
            + "Identify the object by objectName and objectType, or by moid. Use objectName 'rootFolder' for the root folder.")
    public ModuleResult getObjectPermissions(
            @ToolParam(description = "Name of the inventory object", required = false) String objectName,
            @ToolParam(description = "Object type: Folder, VirtualMachine, Datacenter, ResourcePool, Datastore, Network, "
                    + "HostSystem, ComputeResource, ClusterComputeResource or DistributedVirtualSwitch; defaults to Folder",
                    required = false) String objectType,
            @ToolParam(description = "Managed object id of the object, instead of objectName", required = false) String moid,
            @ToolParam(description = "User the permissions are assigned to", required = false) String principal,
            @ToolParam(description = "Group the permissions are assigned to", required = false) String group) {
        logger.info("=== MCP TOOL CALLED: getObjectPermissions({}, {}) ===", objectName != null ? objectName : moid, objectType);
        ObjectPermissionsParams params = new ObjectPermissionsParams();
        params.setObjectName(objectName);
        params.setObjectType(objectType);
        params.setMoid(moid);
        params.setPrincipal(principal);
        params.setGroup(group);
        return objectPermissionsInfo.run(params);
    }
}
