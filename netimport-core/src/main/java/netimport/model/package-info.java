/**
 * Value types for import jobs and their log streams.
 *
 * <p>{@link netimport.model.Job} and {@link netimport.model.LogEntry} are read-only
 * snapshots; every state change goes through a {@link netimport.spi.JobStore} method
 * that guards the transition in SQL.
 */
package netimport.model;
