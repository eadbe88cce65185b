/**
 * Spring Boot auto-configuration for iamcore.
 *
 * <p>{@link io.iamcore.spring.boot.IamCoreAutoConfiguration} wires the JDBC event log and the
 * command beans from a {@link javax.sql.DataSource}. Configure through {@code iamcore.*}
 * properties, see {@link io.iamcore.spring.boot.IamCoreProperties}.
 */
package io.iamcore.spring.boot;
