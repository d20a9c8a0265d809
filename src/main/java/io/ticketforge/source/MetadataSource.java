package io.ticketforge.source;

import io.ticketforge.model.ProvisioningManifest;

/**
 * Yields the records to provision. Implementations perform whatever expansion
 * their input format needs; the plan builder only sees the manifest.
 */
public interface MetadataSource {
    ProvisioningManifest load();
}
