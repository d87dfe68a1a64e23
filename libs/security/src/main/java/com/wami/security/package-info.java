/**
 * Request context, tenant scoping and policy-based authorization.
 *
 * <p>{@link com.wami.security.WamiContext} identifies the caller. {@link
 * com.wami.security.TenantScopeEnforcer} keeps it inside its tenant subtree and {@link
 * com.wami.security.AuthorizationService} evaluates its stored policies.
 */
package com.wami.security;
