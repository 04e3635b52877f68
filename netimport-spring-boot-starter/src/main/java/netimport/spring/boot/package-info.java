/**
 * Spring Boot auto-configuration for network import jobs.
 *
 * <p>Requires a {@link javax.sql.DataSource} and an {@link netimport.spi.ImportExecutor}
 * bean; everything else is derived from {@code netimport.*} properties.
 */
package netimport.spring.boot;
