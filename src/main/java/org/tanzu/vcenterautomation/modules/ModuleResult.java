package org.tanzu.vcenterautomation.modules;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result document of one module invocation.
 *
 * Always carries "changed" and "failed"; carries "msg" on failure, "warnings" when
 * warnings were raised, and the module-specific keys added through {@link #put}.
 */
@JsonPropertyOrder({"changed", "failed", "msg", "warnings"})
public class ModuleResult {

    private final boolean changed;
    private final boolean failed;
    private final String msg;
    private final List<String> warnings = new ArrayList<>();
    private final Map<String, Object> values = new LinkedHashMap<>();

    private ModuleResult(boolean changed, boolean failed, String msg) {
        this.changed = changed;
        this.failed = failed;
        this.msg = msg;
    }

    /**
     * Creates a successful result.
     *
     * @param changed Whether the module changed anything on the platform
     * @return The result
     */
    public static ModuleResult exit(boolean changed) {
        return new ModuleResult(changed, false, null);
    }

    /**
     * Creates a failed result.
     *
     * @param msg Human-readable reason
     * @return The result
     */
    public static ModuleResult fail(String msg) {
        return new ModuleResult(false, true, msg);
    }

    public ModuleResult put(String key, Object value) {
        values.put(key, value);
        return this;
    }

    public ModuleResult warn(String warning) {
        warnings.add(warning);
        return this;
    }

    @JsonProperty("changed")
    public boolean isChanged() { return changed; }

    @JsonProperty("failed")
    public boolean isFailed() { return failed; }

    @JsonProperty("msg")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String getMsg() { return msg; }

    @JsonProperty("warnings")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<String> getWarnings() { return Collections.unmodifiableList(warnings); }

    @JsonAnyGetter
    public Map<String, Object> getValues() { return Collections.unmodifiableMap(values); }

    public Object get(String key) {
        return values.get(key);
    }

    /**
     * Process exit code for this result: 0 on success, 1 on failure.
     */
    public int exitCode() {
        return failed ? 1 : 0;
    }

    @Override
    public String toString() {
        return "ModuleResult{changed=" + changed + ", failed=" + failed + ", msg='" + msg
                + "', warnings=" + warnings + ", values=" + values + "}";
    }
}
