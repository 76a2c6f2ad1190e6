package org.tanzu.vcenterautomation.modules;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Parameters of the content library OVF deploy module.
 *
 * Bound from the module argument document; names and aliases follow the playbook
 * conventions (template/ovf/ovf_template/template_src, library/content_library,
 * name/vm_name).
 *
 * Optional placement parameters given as blank strings are treated as not given, so a
 * caller that sends "" for every unused argument gets the same placement as one that
 * leaves them out.
 */
public class DeployOvfTemplateParams {

    static final String DEFAULT_FOLDER = "vm";

    @JsonProperty("template")
    @JsonAlias({"ovf", "ovf_template", "template_src"})
    private String template;

    @JsonProperty("library")
    @JsonAlias("content_library")
    private String library;

    @JsonProperty("name")
    @JsonAlias("vm_name")
    private String name;

    @JsonProperty("datacenter")
    private String datacenter;

    @JsonProperty("datastore")
    private String datastore;

    @JsonProperty("datastore_cluster")
    private String datastoreCluster;

    @JsonProperty("folder")
    private String folder = DEFAULT_FOLDER;

    @JsonProperty("host")
    private String host;

    @JsonProperty("resource_pool")
    private String resourcePool;

    @JsonProperty("cluster")
    private String cluster;

    /** Null means the configured default (VMWARE_STORAGE_PROVISIONING or thin) */
    @JsonProperty("storage_provisioning")
    private String storageProvisioning;

    public String getTemplate() { return template; }
    public void setTemplate(String template) { this.template = template; }

    public String getLibrary() { return library; }
    public void setLibrary(String library) { this.library = optional(library); }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getDatacenter() { return datacenter; }
    public void setDatacenter(String datacenter) { this.datacenter = datacenter; }

    public String getDatastore() { return datastore; }
    public void setDatastore(String datastore) { this.datastore = optional(datastore); }

    public String getDatastoreCluster() { return datastoreCluster; }
    public void setDatastoreCluster(String datastoreCluster) { this.datastoreCluster = optional(datastoreCluster); }

    public String getFolder() { return folder; }
    public void setFolder(String folder) { this.folder = StringUtils.hasText(folder) ? folder : DEFAULT_FOLDER; }

    public String getHost() { return host; }
    public void setHost(String host) { this.host = optional(host); }

    public String getResourcePool() { return resourcePool; }
    public void setResourcePool(String resourcePool) { this.resourcePool = optional(resourcePool); }

    public String getCluster() { return cluster; }
    public void setCluster(String cluster) { this.cluster = optional(cluster); }

    public String getStorageProvisioning() { return storageProvisioning; }
    public void setStorageProvisioning(String storageProvisioning) { this.storageProvisioning = optional(storageProvisioning); }

    /**
     * Checks required parameters and the datastore/datastore_cluster requirement.
     *
     * @throws ModuleFailedException describing the first violated constraint
     */
    public void validate() {
        List<String> missing = new ArrayList<>();
        if (isBlank(template)) missing.add("template");
        if (isBlank(name)) missing.add("name");
        if (isBlank(datacenter)) missing.add("datacenter");
        if (!missing.isEmpty()) {
            throw new ModuleFailedException("missing required arguments: " + String.join(", ", missing));
        }
        if (isBlank(datastore) && isBlank(datastoreCluster)) {
            throw new ModuleFailedException("one of the following is required: datastore, datastore_cluster");
        }
    }

    static boolean isBlank(String value) {
        return !StringUtils.hasText(value);
    }

    static String optional(String value) {
        return StringUtils.hasText(value) ? value : null;
    }

    @Override
    public String toString() {
        return "DeployOvfTemplateParams{template='" + template + "', library='" + library + "', name='" + name
                + "', datacenter='" + datacenter + "', datastore='" + datastore + "', datastoreCluster='" + datastoreCluster
                + "', folder='" + folder + "', host='" + host + "', resourcePool='" + resourcePool
                + "', cluster='" + cluster + "', storageProvisioning='" + storageProvisioning + "'}";
    }
}
