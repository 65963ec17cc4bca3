/**
 * Health monitoring: the periodic health pass with retries, status reporting, forced
 * synchronization, and cross-view consistency checks.
 */
package syncengine.health;
