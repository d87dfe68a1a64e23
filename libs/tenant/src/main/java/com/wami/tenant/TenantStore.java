package com.wami.tenant;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the tenant data the hierarchy queries need.
 *
 * <p>Implemented by the storage layer; must be safe for concurrent readers.
 */
public interface TenantStore {

    Optional<Tenant> getTenant(TenantId id);

    List<Tenant> listTenants();
}
