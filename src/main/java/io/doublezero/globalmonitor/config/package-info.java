/**
 * Configuration loading and adapter wiring.
 */
package io.doublezero.globalmonitor.config;
