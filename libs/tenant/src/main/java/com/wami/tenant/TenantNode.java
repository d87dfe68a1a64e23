package com.wami.tenant;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A tenant with its sub-tree, built from the {@code parentId} links of a flat tenant list.
 *
 * @param tenant   the tenant at this node
 * @param children direct children, ordered by id
 */
public record TenantNode(Tenant tenant, List<TenantNode> children) {

    public TenantNode {
        children = List.copyOf(children);
    }

    /**
     * Builds the tree rooted at {@code rootId}.
     *
     * @return the tree, or empty if {@code rootId} is not in {@code tenants}
     */
    public static Optional<TenantNode> buildTree(Collection<Tenant> tenants, TenantId rootId) {
        return tenants.stream()
                .filter(t -> t.id().equals(rootId))
                .findFirst()
                .map(root -> build(root, tenants, new HashSet<>()));
    }

    private static TenantNode build(Tenant tenant, Collection<Tenant> all, Set<TenantId> visited) {
        visited.add(tenant.id());
        List<TenantNode> children = new ArrayList<>();
        all.stream()
                .filter(t -> tenant.id().equals(t.parentId()) && !visited.contains(t.id()))
                .sorted(Comparator.comparing(t -> t.id().value()))
                .forEach(child -> children.add(build(child, all, visited)));
        return new TenantNode(tenant, children);
    }

    /** Ids of every tenant below this node, depth first. */
    public List<TenantId> allDescendants() {
        List<TenantId> descendants = new ArrayList<>();
        for (TenantNode child : children) {
            descendants.add(child.tenant.id());
            descendants.addAll(child.allDescendants());
        }
        return descendants;
    }

    public int descendantCount() {
        int count = children.size();
        for (TenantNode child : children) {
            count += child.descendantCount();
        }
        return count;
    }
}
