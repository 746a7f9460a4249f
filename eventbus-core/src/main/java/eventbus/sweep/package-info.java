/**
 * Scheduled sweep over pending and due-retry records.
 *
 * @see eventbus.sweep.EventSweeper
 * @see eventbus.sweep.PendingEventHandler
 */
package eventbus.sweep;
