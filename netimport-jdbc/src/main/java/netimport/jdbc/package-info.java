/**
 * JDBC persistence for import jobs: job and log stores, a database-backed worker
 * transport and age-based purgers for H2, MySQL and PostgreSQL.
 *
 * <p>DDL for each database ships as {@code schema/h2.sql}, {@code schema/mysql.sql} and
 * {@code schema/postgresql.sql} on the classpath.
 */
package netimport.jdbc;
