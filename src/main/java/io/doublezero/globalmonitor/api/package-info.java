/**
 * Command-line entry point and argument parsing.
 */
package io.doublezero.globalmonitor.api;
