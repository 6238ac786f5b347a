package io.eventlog.spi;

import io.eventlog.DomainEvent;

import java.util.Objects;

/**
 * Synchronous "current tenant" lookup used to stamp events saved without a tenant.
 *
 * <p>The context is handed to the event store explicitly, either at construction or
 * per request through {@code JdbcEventStore.forTenant(...)}. A {@code null} answer
 * falls back to {@value DomainEvent#DEFAULT_TENANT}.
 */
@FunctionalInterface
public interface TenantContext {

  /** Context that never knows a tenant. */
  TenantContext NONE = () -> null;

  /**
   * Returns the current tenant, or {@code null} if unknown.
   */
  String currentTenantId();

  /**
   * Returns the current tenant, or {@value DomainEvent#DEFAULT_TENANT} when unknown.
   */
  default String resolveTenantId() {
    String tenantId = currentTenantId();
    return tenantId == null || tenantId.isBlank() ? DomainEvent.DEFAULT_TENANT : tenantId;
  }

  /**
   * Returns a context that always answers {@code tenantId}.
   */
  static TenantContext of(String tenantId) {
    Objects.requireNonNull(tenantId, "tenantId");
    return () -> tenantId;
  }
}
