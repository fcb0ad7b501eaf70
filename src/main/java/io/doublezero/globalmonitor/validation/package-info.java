/**
 * Input validation helpers shared by CLI parsing and configuration loading.
 */
package io.doublezero.globalmonitor.validation;
