/**
 * Adapts change-stream mutations and remote notifications into sync events.
 */
package syncengine.listener;
