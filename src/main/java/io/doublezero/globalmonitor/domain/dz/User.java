package io.doublezero.globalmonitor.domain.dz;

import java.net.InetAddress;
import java.util.Objects;

/**
 * Network user registered on DoubleZero.
 *
 * @param pubkey user account key
 * @param type user type
 * @param clientIp public address of the user
 * @param dzIp overlay address, may be {@code null}
 * @param validatorPubkey validator identity the user declared, may be empty
 * @param device device the user is connected to; {@code null} when the device is not in the snapshot
 */
public record User(
    String pubkey, UserType type, InetAddress clientIp, InetAddress dzIp, String validatorPubkey, Device device) {

  public User {
    Objects.requireNonNull(pubkey, "pubkey");
    type = type == null ? UserType.IBRL : type;
    validatorPubkey = validatorPubkey == null ? "" : validatorPubkey;
  }

  public boolean multicast() {
    return type == UserType.MULTICAST;
  }

  /** Exchange code of the user's device, empty when the device is unknown. */
  public String exchangeCode() {
    return device == null ? "" : device.exchange().code();
  }

  public String deviceCode() {
    return device == null ? "" : device.code();
  }

  public String exchangeName() {
    return device == null ? "" : device.exchange().name();
  }
}
