package io.doublezero.globalmonitor.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void validateHostPortHandlesHostname() {
    assertEquals("kafka.internal:9092", Net.validateHostPort("kafka.internal:9092"));
  }

  @Test
  void validateHostPortHandlesIpv4() {
    assertEquals("10.0.0.1:80", Net.validateHostPort("10.0.0.1:80"));
  }

  @Test
  void validateHostPortRejectsMissingOrInvalidPort() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("localhost"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("localhost:70000"));
  }

  @Test
  void validateHostPortRejectsIpv6AndBadLabels() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("2001:db8::1:443"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("-bad.host:443"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("10.0.0.256:80"));
  }

  @Test
  void validateHostPortListChecksEveryEntry() {
    assertEquals("a:1, b:2", Net.validateHostPortList("a:1, b:2"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPortList("a:1,b"));
  }

  @Test
  void requireIpv4ParsesLiterals() {
    assertEquals("192.0.2.1", Net.requireIpv4("192.0.2.1").getHostAddress());
    assertThrows(IllegalArgumentException.class, () -> Net.requireIpv4("example.com"));
  }

  @Test
  void validateHttpUriRequiresSchemeAndHost() {
    assertEquals("https", Net.validateHttpUri("url", "https://api.mainnet-beta.solana.com").getScheme());
    assertThrows(IllegalArgumentException.class, () -> Net.validateHttpUri("url", "file:///etc/passwd"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHttpUri("url", "http:///path"));
  }
}
