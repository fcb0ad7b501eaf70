/**
 * Kafka adapters for publishing probe measurements.
 */
package io.doublezero.globalmonitor.adapter.kafka;
