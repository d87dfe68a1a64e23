package com.wami.tenant.testing;

import com.wami.tenant.Tenant;
import com.wami.tenant.TenantId;
import com.wami.tenant.TenantStore;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link TenantStore} for tests.
 * <p>
 * WHY in src/main: placed in the main source set so other modules can import this class in their
 * test scope via a regular Maven dependency.
 */
public final class InMemoryTenantStore implements TenantStore {

    private final Map<TenantId, Tenant> tenants = new ConcurrentHashMap<>();

    /** Stores a tenant, replacing any tenant with the same id. */
    public InMemoryTenantStore put(Tenant tenant) {
        tenants.put(tenant.id(), tenant);
        return this;
    }

    public InMemoryTenantStore remove(TenantId id) {
        tenants.remove(id);
        return this;
    }

    @Override
    public Optional<Tenant> getTenant(TenantId id) {
        return Optional.ofNullable(tenants.get(id));
    }

    @Override
    public List<Tenant> listTenants() {
        return List.copyOf(tenants.values());
    }
}
