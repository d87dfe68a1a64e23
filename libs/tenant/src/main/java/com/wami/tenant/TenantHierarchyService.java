package com.wami.tenant;

import com.wami.common.InvalidParameterException;
import com.wami.common.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Hierarchy queries over a {@link TenantStore}: quota inheritance, ancestry and administration.
 *
 * <p>Stateless apart from the store; safe to share between threads when the store is.
 */
public class TenantHierarchyService {

    private static final Logger log = LoggerFactory.getLogger(TenantHierarchyService.class);

    private final TenantStore store;

    public TenantHierarchyService(TenantStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Resolves the quotas in force for a tenant. An {@link QuotaMode#OVERRIDE} tenant uses its own
     * quotas; an inheriting tenant uses its parent's effective quotas; a root tenant always uses
     * its own.
     *
     * @throws ResourceNotFoundException if the tenant or any parent on the way up is missing
     */
    public TenantQuotas effectiveQuotas(TenantId id) {
        Set<TenantId> path = new LinkedHashSet<>();
        Tenant tenant = require(id);
        while (true) {
            if (!path.add(tenant.id())) {
                throw new InvalidParameterException("Tenant hierarchy has a cycle through " + tenant.id());
            }
            if (tenant.quotaMode() == QuotaMode.OVERRIDE || tenant.isRoot()) {
                log.debug("Effective quotas of {} resolved at {} via {}", id, tenant.id(), path);
                return tenant.quotas();
            }
            tenant = require(tenant.parentId());
        }
    }

    /** The existing ancestors of a tenant, root first, ending with the parent. */
    public List<Tenant> ancestors(TenantId id) {
        List<Tenant> ancestors = new ArrayList<>();
        for (TenantId ancestorId : id.ancestors()) {
            store.getTenant(ancestorId).ifPresent(ancestors::add);
        }
        return ancestors;
    }

    /** Ids of every stored tenant below {@code id}, in id order. */
    public List<TenantId> descendants(TenantId id) {
        return store.listTenants().stream()
                .map(Tenant::id)
                .filter(candidate -> candidate.isDescendantOf(id))
                .sorted(Comparator.comparing(TenantId::value))
                .toList();
    }

    /** Tenants whose parent is {@code id}, in id order. */
    public List<Tenant> children(TenantId id) {
        return store.listTenants().stream()
                .filter(t -> id.equals(t.parentId()))
                .sorted(Comparator.comparing(t -> t.id().value()))
                .toList();
    }

    /** The sub-tree rooted at {@code id}, or empty if there is no such tenant. */
    public Optional<TenantNode> tree(TenantId id) {
        return TenantNode.buildTree(store.listTenants(), id);
    }

    /**
     * True when {@code principalArn} administers the tenant or any of its ancestors.
     *
     * @throws ResourceNotFoundException if the tenant does not exist
     */
    public boolean isTenantAdmin(String principalArn, TenantId id) {
        if (require(id).isAdmin(principalArn)) {
            return true;
        }
        return ancestors(id).stream().anyMatch(ancestor -> ancestor.isAdmin(principalArn));
    }

    private Tenant require(TenantId id) {
        return store.getTenant(id).orElseThrow(() -> new ResourceNotFoundException("Tenant " + id));
    }
}
