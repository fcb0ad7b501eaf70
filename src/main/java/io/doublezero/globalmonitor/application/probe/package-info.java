/**
 * Probe execution: cancellation contexts and the long-lived target registry that runs one probe per
 * target per tick under a concurrency bound.
 */
package io.doublezero.globalmonitor.application.probe;
