/**
 * The tenant hierarchy: ids, tenants, quota inheritance and tenant-level authorization.
 */
package com.wami.tenant;
