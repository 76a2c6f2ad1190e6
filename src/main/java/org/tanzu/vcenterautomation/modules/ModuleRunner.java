package org.tanzu.vcenterautomation.modules;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Runs a single module invocation when the application is started with
 * {@code vcenter.module.name} set, instead of serving MCP requests.
 *
 * The argument document is read from {@code vcenter.module.args-file}; the result document
 * is written as JSON to stdout (logs go to stderr) and becomes the process exit code.
 */
@Component
@ConditionalOnProperty(prefix = "vcenter.module", name = "name")
public class ModuleRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(ModuleRunner.class);

    private final ModuleDispatcher moduleDispatcher;
    private final String moduleName;
    private final String argsFile;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private PrintStream out = System.out;
    private int exitCode;

    public ModuleRunner(ModuleDispatcher moduleDispatcher,
                        @Value("${vcenter.module.name}") String moduleName,
                        @Value("${vcenter.module.args-file:}") String argsFile) {
        this.moduleDispatcher = moduleDispatcher;
        this.moduleName = moduleName;
        this.argsFile = argsFile;
    }

    void setOut(PrintStream out) {
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        ModuleResult result;
        try {
            result = moduleDispatcher.execute(moduleName, readArguments());
        } catch (IOException e) {
            logger.error("Failed to read module arguments from '{}': {}", argsFile, e.getMessage(), e);
            result = ModuleResult.fail("Failed to read module arguments from " + argsFile + ": " + e.getMessage());
        }
        exitCode = result.exitCode();
        try {
            out.println(objectMapper.writeValueAsString(result));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize module result: " + e.getMessage(), e);
        }
        out.flush();
        logger.info("Module {} finished: changed={}, failed={}", moduleName, result.isChanged(), result.isFailed());
    }

    private JsonNode readArguments() throws IOException {
        if (argsFile == null || argsFile.isBlank()) {
            logger.info("No module argument file given, running {} without arguments", moduleName);
            return null;
        }
        String content = Files.readString(Path.of(argsFile), StandardCharsets.UTF_8);
        if (content.isBlank()) {
            return null;
        }
        JsonNode document = objectMapper.readTree(content);
        // Accept the wrapped {"ANSIBLE_MODULE_ARGS": {...}} form as well as bare arguments.
        return document.has("ANSIBLE_MODULE_ARGS") ? document.get("ANSIBLE_MODULE_ARGS") : document;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
