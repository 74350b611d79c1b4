/**
 * In-process, bounded, non-blocking event distribution.
 */
package telemetry.bus;
