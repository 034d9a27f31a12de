/**
 * Utilities.
 */
package alpha.eventsystem.util;
