package io.doublezero.globalmonitor.domain.dz;

import io.doublezero.globalmonitor.domain.net.Ipv4;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, indexed view of the DoubleZero registry for one tick.
 *
 * <p>Users are indexed by key, by overlay IP and by client IP. When several users share a client
 * IP the non-multicast user owns the client-IP index entry.</p>
 */
public final class RegistrySnapshot {
  private final Map<String, User> usersByPubkey;
  private final Map<String, User> usersByDzIp;
  private final Map<String, User> usersByClientIp;
  private final Map<String, Device> devicesByPubkey;
  private final Map<String, Device> devicesByCode;
  private final Map<String, Exchange> exchangesByPubkey;

  private RegistrySnapshot(
      Map<String, User> usersByPubkey,
      Map<String, User> usersByDzIp,
      Map<String, User> usersByClientIp,
      Map<String, Device> devicesByPubkey,
      Map<String, Device> devicesByCode,
      Map<String, Exchange> exchangesByPubkey) {
    this.usersByPubkey = Collections.unmodifiableMap(usersByPubkey);
    this.usersByDzIp = Collections.unmodifiableMap(usersByDzIp);
    this.usersByClientIp = Collections.unmodifiableMap(usersByClientIp);
    this.devicesByPubkey = Collections.unmodifiableMap(devicesByPubkey);
    this.devicesByCode = Collections.unmodifiableMap(devicesByCode);
    this.exchangesByPubkey = Collections.unmodifiableMap(exchangesByPubkey);
  }

  public static RegistrySnapshot empty() {
    return of(List.of(), List.of(), List.of());
  }

  /**
   * Builds the indexes from already-resolved entities.
   */
  public static RegistrySnapshot of(
      Collection<User> users, Collection<Device> devices, Collection<Exchange> exchanges) {
    Map<String, Exchange> exchangesByPk = new HashMap<>();
    for (Exchange exchange : exchanges) {
      exchangesByPk.put(exchange.pubkey(), exchange);
    }
    Map<String, Device> devicesByPk = new HashMap<>();
    Map<String, Device> devicesByCode = new HashMap<>();
    for (Device device : devices) {
      devicesByPk.put(device.pubkey(), device);
      devicesByCode.put(device.code(), device);
    }
    Map<String, User> byPk = new HashMap<>();
    Map<String, User> byDzIp = new HashMap<>();
    Map<String, User> byClientIp = new HashMap<>();
    for (User user : users) {
      byPk.put(user.pubkey(), user);
      if (Ipv4.usable(user.dzIp())) {
        byDzIp.put(Ipv4.text(user.dzIp()), user);
      }
      if (Ipv4.usable(user.clientIp())) {
        String key = Ipv4.text(user.clientIp());
        User existing = byClientIp.get(key);
        if (existing == null || (existing.multicast() && !user.multicast())) {
          byClientIp.put(key, user);
        }
      }
    }
    return new RegistrySnapshot(byPk, byDzIp, byClientIp, devicesByPk, devicesByCode, exchangesByPk);
  }

  public Map<String, User> usersByPubkey() {
    return usersByPubkey;
  }

  public Map<String, User> usersByDzIp() {
    return usersByDzIp;
  }

  public Map<String, User> usersByClientIp() {
    return usersByClientIp;
  }

  public Map<String, Device> devicesByPubkey() {
    return devicesByPubkey;
  }

  public Map<String, Device> devicesByCode() {
    return devicesByCode;
  }

  public Map<String, Exchange> exchangesByPubkey() {
    return exchangesByPubkey;
  }
}
