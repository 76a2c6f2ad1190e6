package org.tanzu.vcenterautomation.modules;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.util.StringUtils;

/**
 * Parameters of the object permissions info module. Blank strings count as not given.
 */
public class ObjectPermissionsParams {

    static final String DEFAULT_OBJECT_TYPE = "Folder";

    @JsonProperty("object_name")
    private String objectName;

    @JsonProperty("object_type")
    private String objectType;

    @JsonProperty("moid")
    private String moid;

    @JsonProperty("principal")
    private String principal;

    @JsonProperty("group")
    private String group;

    public String getObjectName() { return objectName; }
    public void setObjectName(String objectName) { this.objectName = optional(objectName); }

    /**
     * Returns the object type, Folder when none was given.
     */
    public String getObjectType() { return objectType == null ? DEFAULT_OBJECT_TYPE : objectType; }
    public void setObjectType(String objectType) { this.objectType = optional(objectType); }

    public String getMoid() { return moid; }
    public void setMoid(String moid) { this.moid = optional(moid); }

    public String getPrincipal() { return principal; }
    public void setPrincipal(String principal) { this.principal = optional(principal); }

    public String getGroup() { return group; }
    public void setGroup(String group) { this.group = optional(group); }

    public boolean appliesToGroup() {
        return group != null;
    }

    /**
     * The user or group the permissions are gathered for.
     */
    public String getAppliedTo() {
        return principal != null ? principal : group;
    }

    /**
     * Checks the exclusivity and requirement rules between moid/object_name and
     * principal/group, and the object type.
     *
     * @throws ModuleFailedException describing the first violated constraint
     */
    public void validate() {
        if (moid != null && objectName != null) {
            throw new ModuleFailedException("parameters are mutually exclusive: moid|object_name");
        }
        if (principal != null && group != null) {
            throw new ModuleFailedException("parameters are mutually exclusive: principal|group");
        }
        if (moid == null && objectName == null) {
            throw new ModuleFailedException("one of the following is required: moid, object_name");
        }
        if (principal == null && group == null) {
            throw new ModuleFailedException("one of the following is required: principal, group");
        }
        if (!ObjectType.isValid(getObjectType())) {
            throw new ModuleFailedException("Object type " + getObjectType() + " is not valid.");
        }
    }

    private static String optional(String value) {
        return StringUtils.hasText(value) ? value : null;
    }

    @Override
    public String toString() {
        return "ObjectPermissionsParams{objectName='" + objectName + "', objectType='" + getObjectType()
                + "', moid='" + moid + "', principal='" + principal + "', group='" + group + "'}";
    }
}
