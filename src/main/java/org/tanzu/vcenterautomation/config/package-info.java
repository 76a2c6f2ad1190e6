/**
 * Configuration for the vCenter automation modules.
 *
 * <p>Provides connection settings and module defaults ({@link org.tanzu.vcenterautomation.config.VCenterConfig}),
 * completion of missing settings from VMWARE_* environment variables ({@link org.tanzu.vcenterautomation.config.VCenterConfigProcessor}),
 * and WebClient setup with optional insecure SSL ({@link org.tanzu.vcenterautomation.config.WebClientConfig}).
 */
package org.tanzu.vcenterautomation.config;
