/**
 * Service Provider Interfaces (SPI) the command core depends on.
 *
 * <p>Integrators implement these to plug in event persistence, read-side queries, secret
 * protection and metrics.
 *
 * @see io.iamcore.spi.EventLog
 * @see io.iamcore.spi.DependentEntityQuery
 * @see io.iamcore.spi.SecretProvider
 * @see io.iamcore.spi.UserQuery
 * @see io.iamcore.spi.MetricsExporter
 */
package io.iamcore.spi;
