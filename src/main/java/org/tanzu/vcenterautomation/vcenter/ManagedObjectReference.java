package org.tanzu.vcenterautomation.vcenter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Reference to a managed object in the VI/JSON API, serialized as
 * {@code {"_typeName": "ManagedObjectReference", "type": "Folder", "value": "group-d1"}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ManagedObjectReference {

    static final String TYPE_NAME = "ManagedObjectReference";

    private final String type;
    private final String value;

    @JsonCreator
    public ManagedObjectReference(@JsonProperty("type") String type, @JsonProperty("value") String value) {
        this.type = type;
        this.value = value;
    }

    @JsonProperty("_typeName")
    public String getTypeName() { return TYPE_NAME; }

    @JsonProperty("type")
    public String getType() { return type; }

    @JsonProperty("value")
    public String getValue() { return value; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ManagedObjectReference)) return false;
        ManagedObjectReference that = (ManagedObjectReference) o;
        return Objects.equals(type, that.type) && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        return type + ":" + value;
    }
}
