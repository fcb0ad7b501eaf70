/**
 * Runtime logging controls.
 */
package io.doublezero.globalmonitor.logging;
