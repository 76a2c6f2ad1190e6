/**
 * vCenter integration layer.
 *
 * <p>This package contains:
 * <ul>
 *   <li>{@link org.tanzu.vcenterautomation.vcenter.VapiClient} – client for the Automation REST API (/api): inventory listings, content library, OVF deploy.</li>
 *   <li>{@link org.tanzu.vcenterautomation.vcenter.VimClient} – client for the VI/JSON API (/sdk/vim25): object search, properties, permissions.</li>
 *   <li>{@link org.tanzu.vcenterautomation.vcenter.InventoryLookup} – resolves friendly names to vCenter identifiers.</li>
 * </ul>
 *
 * <p>Both clients raise {@link org.tanzu.vcenterautomation.vcenter.VapiException} with the vendor messages when vCenter reports an error.
 */
package org.tanzu.vcenterautomation.vcenter;
