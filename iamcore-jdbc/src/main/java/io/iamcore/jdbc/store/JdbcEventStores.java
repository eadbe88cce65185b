package io.iamcore.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Picks the event store dialect for a database.
 *
 * <p>Dialects are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.iamcore.jdbc.store.AbstractJdbcEventStore}. A data source is
 * matched by its JDBC URL prefix first and by the database product name when the URL is
 * wrapped by a proxy driver.
 */
public final class JdbcEventStores {
  private static final Logger logger = Logger.getLogger(JdbcEventStores.class.getName());

  private static final List<AbstractJdbcEventStore> STORES = ServiceLoader.load(AbstractJdbcEventStore.class)
      .stream()
      .map(ServiceLoader.Provider::get)
      .toList();

  private JdbcEventStores() {
  }

  /**
   * Detects the dialect of the data source's database.
   *
   * @throws IllegalStateException if the connection metadata cannot be read
   * @throws IllegalArgumentException if neither the URL nor the product name matches a dialect
   */
  public static AbstractJdbcEventStore detect(DataSource dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    try (Connection conn = dataSource.getConnection()) {
      DatabaseMetaData metaData = conn.getMetaData();
      String url = metaData.getURL();
      Optional<AbstractJdbcEventStore> byUrl = url == null ? Optional.empty() : forUrl(url);
      if (byUrl.isPresent()) {
        return byUrl.get();
      }
      String product = metaData.getDatabaseProductName();
      AbstractJdbcEventStore byProduct = forProductName(product).orElseThrow(() ->
          new IllegalArgumentException("No event store found for JDBC URL " + url
              + " or database product " + product + ". Supported prefixes: " + allPrefixes()));
      logger.log(Level.FINE, "Event store {0} detected from database product {1}",
          new Object[] {byProduct.name(), product});
      return byProduct;
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect event store from DataSource", e);
    }
  }

  /**
   * Detects the dialect of the data source's database and points it at {@code tableName}.
   */
  public static AbstractJdbcEventStore detect(DataSource dataSource, String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    AbstractJdbcEventStore detected = detect(dataSource);
    return detected.tableName().equals(tableName) ? detected : detected.withTableName(tableName);
  }

  /**
   * Detects the dialect from a JDBC URL.
   *
   * @throws IllegalArgumentException if no dialect matches the URL
   */
  public static AbstractJdbcEventStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    return forUrl(jdbcUrl).orElseThrow(() -> new IllegalArgumentException(
        "No event store found for JDBC URL: " + jdbcUrl + ". Supported prefixes: " + allPrefixes()));
  }

  private static Optional<AbstractJdbcEventStore> forUrl(String jdbcUrl) {
    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    return STORES.stream()
        .filter(s -> s.jdbcUrlPrefixes().stream().anyMatch(p -> url.startsWith(p.toLowerCase(Locale.ROOT))))
        .findFirst();
  }

  // product names: "H2", "MySQL", "PostgreSQL"
  private static Optional<AbstractJdbcEventStore> forProductName(String product) {
    if (product == null) {
      return Optional.empty();
    }
    String name = product.toLowerCase(Locale.ROOT);
    return STORES.stream()
        .filter(s -> name.equals(s.name()))
        .findFirst();
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
