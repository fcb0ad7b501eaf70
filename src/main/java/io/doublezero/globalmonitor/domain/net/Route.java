package io.doublezero.globalmonitor.domain.net;

/**
 * Kernel route entry; only presence by destination matters to preflight checks.
 *
 * @param destination destination prefix or host as reported by the kernel
 * @param device outgoing interface
 * @param protocol routing protocol that installed the route
 */
public record Route(String destination, String device, String protocol) {}
