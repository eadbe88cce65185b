/**
 * Vendor-specific event stores and their {@link java.util.ServiceLoader} registry.
 *
 * @see io.iamcore.jdbc.store.JdbcEventStores
 */
package io.iamcore.jdbc.store;
