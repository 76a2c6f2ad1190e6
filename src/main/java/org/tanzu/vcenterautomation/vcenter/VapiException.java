package org.tanzu.vcenterautomation.vcenter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Error reported by vCenter, either as an Automation API error document
 * ({@code {"error_type": ..., "messages": [...]}}) or as a VI/JSON fault
 * ({@code {"_typeName": ..., "faultMessage": [...]}}).
 *
 * The vendor messages are kept separately so callers can surface them verbatim.
 */
public class VapiException extends RuntimeException {

    private final int statusCode;
    private final String errorType;
    private final List<String> vendorMessages;

    public VapiException(int statusCode, String errorType, List<String> vendorMessages, Throwable cause) {
        super(buildMessage(statusCode, errorType, vendorMessages), cause);
        this.statusCode = statusCode;
        this.errorType = errorType;
        this.vendorMessages = vendorMessages == null ? Collections.emptyList() : List.copyOf(vendorMessages);
    }

    public VapiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.errorType = null;
        this.vendorMessages = Collections.emptyList();
    }

    public int getStatusCode() { return statusCode; }
    public String getErrorType() { return errorType; }
    public List<String> getVendorMessages() { return vendorMessages; }

    /**
     * Returns the vendor messages joined by ", ", or the exception message when vCenter
     * sent none.
     *
     * @return Human-readable vendor error text
     */
    public String getVendorMessage() {
        if (vendorMessages.isEmpty()) {
            return getMessage();
        }
        return String.join(", ", vendorMessages);
    }

    /**
     * Builds the exception from an HTTP error response, reading the Automation API error
     * document or the VI/JSON fault it carries. Unparseable bodies are kept as the
     * only vendor message.
     *
     * @param statusCode HTTP status of the response
     * @param body Raw response body, may be empty
     * @param objectMapper Mapper used to parse the body
     * @param cause The transport exception
     * @return The vendor error
     */
    public static VapiException fromResponse(int statusCode, String body, ObjectMapper objectMapper, Throwable cause) {
        if (body == null || body.trim().isEmpty()) {
            return new VapiException(statusCode, null, Collections.emptyList(), cause);
        }
        JsonNode errorNode;
        try {
            errorNode = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return new VapiException(statusCode, null, List.of(body.trim()), cause);
        }

        List<String> messages = new ArrayList<>();
        String errorType;
        if (errorNode.has("_typeName")) {
            errorType = errorNode.path("_typeName").asText();
            for (JsonNode message : errorNode.path("faultMessage")) {
                String text = message.path("message").asText("");
                if (!text.isEmpty()) {
                    messages.add(text);
                }
            }
        } else {
            // Legacy /rest endpoints wrap the error document in "value"
            JsonNode error = errorNode.has("value") && errorNode.get("value").isObject()
                    ? errorNode.get("value") : errorNode;
            errorType = error.path("error_type").asText(null);
            for (JsonNode message : error.path("messages")) {
                String text = message.path("default_message").asText("");
                if (!text.isEmpty()) {
                    messages.add(text);
                }
            }
        }
        return new VapiException(statusCode, errorType, messages, cause);
    }

    private static String buildMessage(int statusCode, String errorType, List<String> vendorMessages) {
        StringBuilder message = new StringBuilder("vCenter error");
        if (errorType != null && !errorType.isEmpty()) {
            message.append(" ").append(errorType);
        }
        if (statusCode > 0) {
            message.append(" (HTTP ").append(statusCode).append(")");
        }
        if (vendorMessages != null && !vendorMessages.isEmpty()) {
            message.append(": ").append(String.join(", ", vendorMessages));
        }
        return message.toString();
    }
}
