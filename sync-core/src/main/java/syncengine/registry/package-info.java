/** Registry of connected downstream consumers. */
package syncengine.registry;
