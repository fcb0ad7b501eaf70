/**
 * Planners that turn a tick's snapshots into probe targets and plans, and plan results into
 * measurement points.
 */
package io.doublezero.globalmonitor.application.plan;
