/**
 * Outbound notifications on the shared sync channel, and an in-memory transport.
 */
package syncengine.broadcast;
