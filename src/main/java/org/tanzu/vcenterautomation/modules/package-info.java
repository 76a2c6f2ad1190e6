/**
 * Automation modules and their outer surfaces.
 *
 * <p>{@link org.tanzu.vcenterautomation.modules.ContentDeployOvfTemplate} deploys VMs from
 * content library OVF templates and {@link org.tanzu.vcenterautomation.modules.ObjectPermissionsInfo}
 * reports object permissions. Both return a {@link org.tanzu.vcenterautomation.modules.ModuleResult}
 * and never throw for vCenter or parameter errors.</p>
 *
 * <p>The modules are reachable as MCP tools through
 * {@link org.tanzu.vcenterautomation.modules.VCenterAutomationTools} and as one-shot
 * invocations through {@link org.tanzu.vcenterautomation.modules.ModuleRunner}.</p>
 */
package org.tanzu.vcenterautomation.modules;
