package io.doublezero.globalmonitor.application.port;

import io.doublezero.globalmonitor.domain.dz.RegistrySnapshot;
import java.io.IOException;

/**
 * Provides the DoubleZero users, devices and exchanges for a tick.
 */
public interface NetworkRegistrySource {
  RegistrySnapshot fetch() throws IOException;
}
