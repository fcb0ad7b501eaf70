/**
 * Adapters binding the monitor's ports to the operating system, Solana RPC and the DoubleZero
 * client.
 */
package io.doublezero.globalmonitor.infrastructure;
