/**
 * Batch processing of queued sync events, per-event steps, and the pending-update store
 * consulted by the health monitor for retries.
 */
package syncengine.dispatch;
