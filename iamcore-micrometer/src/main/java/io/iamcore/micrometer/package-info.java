/**
 * Micrometer bridge for {@link io.iamcore.spi.MetricsExporter}.
 */
package io.iamcore.micrometer;
