/**
 * Service provider interfaces: persistence, connections and metrics.
 *
 * <p>JDBC implementations of the stores live in the {@code bulkmail-jdbc} module;
 * a Micrometer {@link bulkmail.spi.MetricsExporter} lives in {@code bulkmail-micrometer}.
 */
package bulkmail.spi;
