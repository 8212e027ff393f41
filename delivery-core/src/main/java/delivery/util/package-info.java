/**
 * Small shared utilities: daemon thread naming and the payload record JSON codec.
 */
package delivery.util;
