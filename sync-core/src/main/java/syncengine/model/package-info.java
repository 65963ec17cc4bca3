/**
 * Value types shared by every engine component: sync events and their typed payloads,
 * broadcast notifications, connections, pending updates and status snapshots.
 */
package syncengine.model;
