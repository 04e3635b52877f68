/**
 * Service provider interfaces: persistence, worker transport, settings resolution,
 * the import library adapter and metrics.
 *
 * <p>JDBC implementations of {@link netimport.spi.JobStore},
 * {@link netimport.spi.WorkerTransport} and {@link netimport.spi.JobPurger} live in
 * {@code netimport-jdbc}; {@link netimport.spi.ImportExecutor} is supplied by the
 * application.
 */
package netimport.spi;
