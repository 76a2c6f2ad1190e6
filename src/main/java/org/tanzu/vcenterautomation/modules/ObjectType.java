package org.tanzu.vcenterautomation.modules;

import java.util.Arrays;

/**
 * Inventory object types whose permissions can be inspected. The constant names are the
 * VI managed object type names.
 */
public enum ObjectType {
    Folder,
    VirtualMachine,
    Datacenter,
    ResourcePool,
    Datastore,
    Network,
    HostSystem,
    ComputeResource,
    ClusterComputeResource,
    DistributedVirtualSwitch;

    public static boolean isValid(String type) {
        return Arrays.stream(values()).anyMatch(value -> value.name().equals(type));
    }
}
