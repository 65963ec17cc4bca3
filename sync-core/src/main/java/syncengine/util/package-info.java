/**
 * Threading and waiting helpers shared by the engine components.
 */
package syncengine.util;
