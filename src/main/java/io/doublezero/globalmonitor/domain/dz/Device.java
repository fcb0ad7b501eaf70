package io.doublezero.globalmonitor.domain.dz;

/**
 * DoubleZero device (DZD) and the exchange it sits in.
 */
public record Device(String pubkey, String code, Exchange exchange) {
  public Device {
    pubkey = pubkey == null ? "" : pubkey;
    code = code == null ? "" : code;
    exchange = exchange == null ? Exchange.UNKNOWN : exchange;
  }
}
