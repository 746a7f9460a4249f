/**
 * Publish-and-notify decorator with a bounded history of recent events.
 *
 * @see eventbus.stream.EventStreamPublisher
 */
package eventbus.stream;
