package org.tanzu.vcenterautomation.modules;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.tanzu.vcenterautomation.vcenter.ManagedObjectReference;
import org.tanzu.vcenterautomation.vcenter.VapiException;
import org.tanzu.vcenterautomation.vcenter.VimClient;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gathers the permissions defined directly on one inventory object for a user or group.
 * Read-only: the result never reports a change.
 */
@Component
public class ObjectPermissionsInfo {

    private static final Logger logger = LoggerFactory.getLogger(ObjectPermissionsInfo.class);

    public static final String MODULE_NAME = "vmware_object_permissions_info";

    static final String ROOT_FOLDER = "rootFolder";

    static final String DVS_WARNING = "You are applying permissions to a Distributed vSwitch. "
            + "This will probably fail, since Distributed vSwitches inherits permissions "
            + "from the datacenter or a folder level. "
            + "Define permissions on the datacenter or the folder containing the switch.";

    private final VimClient vimClient;

    public ObjectPermissionsInfo(VimClient vimClient) {
        this.vimClient = vimClient;
    }

    /**
     * Runs the module.
     *
     * @param params The module parameters
     * @return Result carrying "permissions", or a failed result
     */
    public ModuleResult run(ObjectPermissionsParams params) {
        logger.info("=== MODULE CALLED: {}({}) ===", MODULE_NAME, params);
        try {
            params.validate();

            JsonNode content = vimClient.retrieveServiceContent();
            ManagedObjectReference authorizationManager = vimClient.toReference(content.path("authorizationManager"));

            ModuleResult result = ModuleResult.exit(false);
            ManagedObjectReference entity = resolveObject(params, content);
            if (ObjectType.DistributedVirtualSwitch.name().equals(params.getObjectType())) {
                result.warn(DVS_WARNING);
            }

            JsonNode permissions = vimClient.retrieveEntityPermissions(authorizationManager, entity, false);
            Map<Integer, String> roleNames = roleNames(authorizationManager);

            List<Map<String, Object>> matching = new ArrayList<>();
            for (JsonNode permission : permissions) {
                if (appliesTo(permission, params)) {
                    matching.add(toResult(permission, roleNames));
                }
            }
            logger.info("Found {} permissions on {} for '{}' (of {} defined)",
                       matching.size(), entity, params.getAppliedTo(), permissions.size());
            return result.put("permissions", matching);
        } catch (ModuleFailedException e) {
            logger.error("{} failed: {}", MODULE_NAME, e.getMessage());
            return ModuleResult.fail(e.getMessage());
        } catch (VapiException e) {
            logger.error("{} failed with vCenter error: {}", MODULE_NAME, e.getMessage(), e);
            return ModuleResult.fail(e.getVendorMessage());
        }
    }

    private ManagedObjectReference resolveObject(ObjectPermissionsParams params, JsonNode content) {
        String objectType = params.getObjectType();
        if (ObjectType.Folder.name().equals(objectType) && ROOT_FOLDER.equals(params.getObjectName())) {
            return vimClient.toReference(content.path("rootFolder"));
        }
        if (params.getMoid() != null) {
            return new ManagedObjectReference(objectType, params.getMoid());
        }
        List<ManagedObjectReference> matches = vimClient.findByName(objectType, params.getObjectName());
        if (matches.isEmpty()) {
            throw new ModuleFailedException("Specified object " + params.getObjectName()
                    + " of type " + objectType + " was not found.");
        }
        return matches.get(0);
    }

    private static boolean appliesTo(JsonNode permission, ObjectPermissionsParams params) {
        // Domain prefixes are matched case-insensitively, as vCenter does on login.
        return permission.path("group").asBoolean(false) == params.appliesToGroup()
                && params.getAppliedTo().equalsIgnoreCase(permission.path("principal").asText(""));
    }

    private Map<Integer, String> roleNames(ManagedObjectReference authorizationManager) {
        Map<Integer, String> names = new HashMap<>();
        try {
            for (JsonNode role : vimClient.retrieveRoleList(authorizationManager)) {
                names.put(role.path("roleId").asInt(), role.path("name").asText());
            }
        } catch (VapiException e) {
            logger.warn("Could not read role list, permissions are reported without role names: {}", e.getMessage());
        }
        return names;
    }

    private static Map<String, Object> toResult(JsonNode permission, Map<Integer, String> roleNames) {
        Map<String, Object> entity = new LinkedHashMap<>();
        entity.put("type", permission.path("entity").path("type").asText(""));
        entity.put("value", permission.path("entity").path("value").asText(""));

        int roleId = permission.path("roleId").asInt();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("entity", entity);
        result.put("principal", permission.path("principal").asText(""));
        result.put("group", permission.path("group").asBoolean(false));
        result.put("role_id", roleId);
        result.put("role_name", roleNames.get(roleId));
        result.put("propagate", permission.path("propagate").asBoolean(false));
        return result;
    }
}
