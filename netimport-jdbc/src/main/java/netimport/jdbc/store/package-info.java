/**
 * Database-specific {@link netimport.spi.JobStore} implementations and their
 * {@link java.util.ServiceLoader}-based registry.
 */
package netimport.jdbc.store;
