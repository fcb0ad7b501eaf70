package io.doublezero.globalmonitor.infrastructure.registry;

import io.doublezero.globalmonitor.application.port.MonitorDataException;
import io.doublezero.globalmonitor.application.port.NetworkRegistrySource;
import io.doublezero.globalmonitor.domain.dz.Device;
import io.doublezero.globalmonitor.domain.dz.Exchange;
import io.doublezero.globalmonitor.domain.dz.RegistrySnapshot;
import io.doublezero.globalmonitor.domain.dz.User;
import io.doublezero.globalmonitor.domain.dz.UserType;
import io.doublezero.globalmonitor.domain.net.Ipv4;
import io.doublezero.globalmonitor.infrastructure.json.JsonTree;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads an exported registry document from disk on every fetch.
 *
 * <pre>{@code
 * {
 *   "exchanges": [{"pubkey": "..", "code": "xams", "name": "Amsterdam"}],
 *   "devices":   [{"pubkey": "..", "code": "ams-dz01", "exchangePubkey": ".."}],
 *   "users":     [{"pubkey": "..", "userType": "IBRL", "clientIp": "..", "dzIp": "..",
 *                  "validatorPubkey": "..", "devicePubkey": ".."}]
 * }
 * }</pre>
 */
public final class JsonFileRegistrySource implements NetworkRegistrySource {
  private static final Logger log = LoggerFactory.getLogger(JsonFileRegistrySource.class);

  private final Path file;

  public JsonFileRegistrySource(Path file) {
    this.file = Objects.requireNonNull(file, "file");
  }

  @Override
  public RegistrySnapshot fetch() throws IOException {
    Object root;
    try (InputStream in = Files.newInputStream(file)) {
      root = JsonTree.parse(in);
    } catch (MonitorDataException ex) {
      throw new MonitorDataException("Malformed registry document " + file, ex);
    }
    return parse(root);
  }

  static RegistrySnapshot parse(Object root) throws MonitorDataException {
    if (!(root instanceof Map<?, ?>)) {
      throw new MonitorDataException("Registry document is not a JSON object");
    }
    Map<String, Object> doc = JsonTree.asObject(root);

    Map<String, Exchange> exchanges = new HashMap<>();
    for (Object item : JsonTree.asArray(doc.get("exchanges"))) {
      Map<String, Object> e = JsonTree.asObject(item);
      String pk = JsonTree.string(e, "pubkey");
      if (pk != null) {
        exchanges.put(pk, new Exchange(pk, JsonTree.string(e, "code"), JsonTree.string(e, "name")));
      }
    }

    Map<String, Device> devices = new HashMap<>();
    for (Object item : JsonTree.asArray(doc.get("devices"))) {
      Map<String, Object> d = JsonTree.asObject(item);
      String pk = JsonTree.string(d, "pubkey");
      if (pk != null) {
        Exchange exchange = exchanges.get(JsonTree.string(d, "exchangePubkey"));
        devices.put(pk, new Device(pk, JsonTree.string(d, "code"), exchange));
      }
    }

    List<User> users = new ArrayList<>();
    for (Object item : JsonTree.asArray(doc.get("users"))) {
      Map<String, Object> u = JsonTree.asObject(item);
      String pk = JsonTree.string(u, "pubkey");
      InetAddress clientIp = Ipv4.parse(JsonTree.string(u, "clientIp"));
      if (pk == null || clientIp == null) {
        log.debug("Skipping registry user without key or client address: {}", pk);
        continue;
      }
      UserType type;
      try {
        type = UserType.parse(JsonTree.string(u, "userType"));
      } catch (IllegalArgumentException ex) {
        throw new MonitorDataException("Registry user " + pk + " has an invalid type", ex);
      }
      users.add(new User(
          pk,
          type,
          clientIp,
          Ipv4.parse(JsonTree.string(u, "dzIp")),
          JsonTree.string(u, "validatorPubkey"),
          devices.get(JsonTree.string(u, "devicePubkey"))));
    }
    return RegistrySnapshot.of(users, devices.values(), exchanges.values());
  }
}
