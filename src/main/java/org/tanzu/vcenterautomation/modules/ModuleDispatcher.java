package org.tanzu.vcenterautomation.modules;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Runs a module by name against a JSON argument document.
 *
 * Keys starting with "_ansible_" are runtime keys and never bound to module parameters;
 * "_ansible_check_mode" turns on check mode. Connection keys (hostname, username,
 * password, port, validate_certs and the proxy settings) are split off before the module
 * parameters are bound; when any is present the module runs against that connection
 * instead of the shared one.
 */
@Component
public class ModuleDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(ModuleDispatcher.class);

    static final String RUNTIME_KEY_PREFIX = "_ansible_";
    static final String CHECK_MODE_KEY = "_ansible_check_mode";

    private final ContentDeployOvfTemplate contentDeployOvfTemplate;
    private final ObjectPermissionsInfo objectPermissionsInfo;
    private final ModuleFactory moduleFactory;
    private final ObjectMapper objectMapper;

    public ModuleDispatcher(ContentDeployOvfTemplate contentDeployOvfTemplate,
                            ObjectPermissionsInfo objectPermissionsInfo,
                            ModuleFactory moduleFactory) {
        this.contentDeployOvfTemplate = contentDeployOvfTemplate;
        this.objectPermissionsInfo = objectPermissionsInfo;
        this.moduleFactory = moduleFactory;
        this.objectMapper = new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Executes one module invocation.
     *
     * @param moduleName Module name, with or without a collection prefix
     * @param arguments The argument document; null or a JSON null is treated as empty
     * @return The module result; binding errors and unexpected errors are failed results
     */
    public ModuleResult execute(String moduleName, JsonNode arguments) {
        String module = shortName(moduleName);
        ObjectNode params = objectMapper.createObjectNode();
        ObjectNode connectionArgs = objectMapper.createObjectNode();
        boolean checkMode = false;

        if (arguments != null && !arguments.isNull()) {
            if (!arguments.isObject()) {
                return ModuleResult.fail("Module arguments must be a JSON object");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = arguments.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String key = field.getKey();
                if (CHECK_MODE_KEY.equals(key)) {
                    checkMode = field.getValue().asBoolean(false);
                    continue;
                }
                if (key.startsWith(RUNTIME_KEY_PREFIX) || field.getValue().isNull()) {
                    continue;
                }
                ObjectNode target = ConnectionParams.KEYS.contains(key) ? connectionArgs : params;
                target.set(key, field.getValue());
            }
        }

        logger.info("Executing module {} (checkMode={})", module, checkMode);
        try {
            switch (module) {
                case ContentDeployOvfTemplate.MODULE_NAME: {
                    DeployOvfTemplateParams deployParams = bind(module, params, DeployOvfTemplateParams.class);
                    ConnectionParams connection = bind(module, connectionArgs, ConnectionParams.class);
                    ContentDeployOvfTemplate target = connection.isEmpty()
                            ? contentDeployOvfTemplate : moduleFactory.contentDeployOvfTemplate(connection);
                    return target.run(deployParams, checkMode);
                }
                case ObjectPermissionsInfo.MODULE_NAME: {
                    ObjectPermissionsParams permissionParams = bind(module, params, ObjectPermissionsParams.class);
                    ConnectionParams connection = bind(module, connectionArgs, ConnectionParams.class);
                    ObjectPermissionsInfo target = connection.isEmpty()
                            ? objectPermissionsInfo : moduleFactory.objectPermissionsInfo(connection);
                    return target.run(permissionParams);
                }
                default:
                    return ModuleResult.fail("Unknown module: " + moduleName);
            }
        } catch (ModuleFailedException e) {
            logger.error("Module {} rejected its arguments: {}", module, e.getMessage());
            return ModuleResult.fail(e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Module {} failed unexpectedly: {}", module, e.getMessage(), e);
            return ModuleResult.fail("Module " + module + " failed: " + e.getMessage());
        }
    }

    private <T> T bind(String module, ObjectNode params, Class<T> type) {
        List<String> unsupported = new ArrayList<>();
        ObjectNode remaining = params.deepCopy();
        // Collect every unknown key rather than only the first one Jackson reports.
        while (true) {
            try {
                T bound = objectMapper.treeToValue(remaining, type);
                if (!unsupported.isEmpty()) {
                    throw unsupported(module, unsupported);
                }
                return bound;
            } catch (UnrecognizedPropertyException e) {
                unsupported.add(e.getPropertyName());
                remaining.remove(e.getPropertyName());
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new ModuleFailedException("argument parsing failed for (" + module + ") module: " + e.getMessage());
            }
        }
    }

    private static ModuleFailedException unsupported(String module, List<String> keys) {
        return new ModuleFailedException("Unsupported parameters for (" + module + ") module: " + String.join(", ", keys));
    }

    static String shortName(String moduleName) {
        if (moduleName == null) {
            return "";
        }
        int dot = moduleName.lastIndexOf('.');
        return dot >= 0 ? moduleName.substring(dot + 1) : moduleName;
    }
}
