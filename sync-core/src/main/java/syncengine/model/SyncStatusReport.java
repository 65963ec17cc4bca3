package syncengine.model;

import java.time.Instant;

/**
 * Aggregate health of the engine as returned by {@code validateSyncStatus()}.
 *
 * @param connectedClients      live connections after purging idle ones
 * @param pendingUpdates        failed events awaiting retry
 * @param queuedEvents          events waiting in the queue
 * @param syncLag               ms since the latest completed event
 * @param lastSyncEvent         completion time of the latest event (epoch if none)
 * @param averageProcessingTime running average in ms
 * @param errorRate             {@code failedSyncs / totalEvents}, 0 when idle
 */
public record SyncStatusReport(
    int connectedClients,
    int pendingUpdates,
    int queuedEvents,
    long syncLag,
    Instant lastSyncEvent,
    double averageProcessingTime,
    double errorRate) {
}
