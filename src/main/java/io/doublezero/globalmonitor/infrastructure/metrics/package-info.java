/**
 * OpenTelemetry implementation of the metrics port.
 */
package io.doublezero.globalmonitor.infrastructure.metrics;
