/**
 * Ports between the probe pipeline and its collaborators.
 */
package io.doublezero.globalmonitor.application.port;
