package org.tanzu.vcenterautomation;

import org.springframework.ai.support.ToolCallbacks;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;
import org.tanzu.vcenterautomation.modules.ModuleRunner;
import org.tanzu.vcenterautomation.modules.VCenterAutomationTools;

import java.util.Arrays;
import java.util.List;

/**
 * Main Spring Boot application class for vCenter automation.
 *
 * The application runs in one of two modes:
 * - MCP server (default): the automation modules are exposed as MCP tools over SSE
 * - Module runner: started with --vcenter.module.name=... it runs one module invocation,
 *   prints the result document on stdout and exits with the module exit code
 *
 * @author vCenter MCP Team
 * @version 1.0.0
 */
@SpringBootApplication
@EnableConfigurationProperties
public class VCenterAutomationApplication {

    static final String MODULE_NAME_PROPERTY = "vcenter.module.name";

    /**
     * Main application entry point. Sets the MCP server identification and, for module
     * invocations, disables the web server.
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        System.setProperty("spring.application.name", "vcenter-automation");
        System.setProperty("spring.ai.mcp.server.name", "vcenter-automation");
        System.setProperty("spring.ai.mcp.server.version", "1.0.0");

        SpringApplication application = new SpringApplication(VCenterAutomationApplication.class);
        boolean moduleInvocation = isModuleInvocation(args);
        if (moduleInvocation) {
            application.setWebApplicationType(WebApplicationType.NONE);
        }

        ConfigurableApplicationContext context = application.run(args);
        if (moduleInvocation || context.getBeanNamesForType(ModuleRunner.class).length > 0) {
            System.exit(SpringApplication.exit(context));
        }
    }

    static boolean isModuleInvocation(String[] args) {
        return Arrays.stream(args).anyMatch(arg -> arg.startsWith("--" + MODULE_NAME_PROPERTY + "="))
                || System.getProperty(MODULE_NAME_PROPERTY) != null
                || System.getenv("VCENTER_MODULE_NAME") != null;
    }

    /**
     * Registers the automation modules with the MCP server.
     *
     * @param tools The service holding the deployOvfTemplate and getObjectPermissions tools
     * @return List of ToolCallback objects representing the available MCP tools
     */
    @Bean
    public List<ToolCallback> registerTools(VCenterAutomationTools tools) {
        return List.of(ToolCallbacks.from(tools));
    }
}
