/**
 * Persisted delivery state: records, statuses and delivery configuration.
 */
package eventbus.model;
