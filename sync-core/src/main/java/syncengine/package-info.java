/**
 * Event synchronization engine keeping cached aggregates consistent across views.
 *
 * <p>{@link syncengine.SyncEngine} is the entry point; the sub-packages hold its parts.
 */
package syncengine;
