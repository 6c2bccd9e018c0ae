package com.swarmprobe.core.reporting;

/**
 * Result of reporting an issue.
 *
 * @param reference tracker reference of the new or matched issue
 * @param created   false when an open duplicate was found and commented instead
 */
public record ReportOutcome(String reference, boolean created) {
}
