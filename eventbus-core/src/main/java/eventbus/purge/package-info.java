/**
 * Scheduled deletion of completed and dead-letter records past their retention period.
 */
package eventbus.purge;
