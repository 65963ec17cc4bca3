package syncengine.queue;

import syncengine.model.SyncEvent;

/**
 * Queue entry pairing an event with the time it was enqueued. The enqueue time, not the
 * event timestamp, decides whether a newer event for the same entity is merged into it.
 */
record QueuedSyncEvent(SyncEvent event, long enqueuedAt) {
}
