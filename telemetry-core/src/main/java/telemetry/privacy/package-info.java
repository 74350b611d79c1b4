/**
 * Scrubbing of sensitive data from text that leaves the process.
 *
 * @see telemetry.privacy.PrivacyScrubber
 */
package telemetry.privacy;
