/**
 * Priority queue of pending sync events with same-entity deduplication and a length cap.
 */
package syncengine.queue;
