/**
 * TPU QUIC handshake probing over Netty's QUIC codec.
 */
package io.doublezero.globalmonitor.infrastructure.quic;
