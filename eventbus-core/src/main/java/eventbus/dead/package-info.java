/**
 * Dead-letter tooling for querying, counting, replaying and purging events that exhausted
 * their retries.
 *
 * @see eventbus.dead.DeadLetterManager
 */
package eventbus.dead;
