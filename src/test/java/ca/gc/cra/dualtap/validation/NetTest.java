package ca.gc.cra.dualtap.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void validateHostNormalizesHostname() {
    assertEquals("www.dawn.com", Net.validateHost("targetDomains", "WWW.Dawn.com."));
  }

  @Test
  void validateHostHandlesIpv4() {
    assertEquals("127.0.0.1", Net.validateHost("listenHost", "127.0.0.1"));
  }

  @Test
  void validateHostRejectsBadOctet() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateHost("listenHost", "10.0.0.300"));
  }

  @Test
  void validateHostRejectsMalformedLabels() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateHost("targetDomains", "-dawn.com"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHost("targetDomains", "dawn..com"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHost("targetDomains", "da_wn.com"));
  }

  @Test
  void validatePortAcceptsEphemeralAndRejectsOutOfRange() {
    assertEquals(0, Net.validatePort("listenPort", 0));
    assertThrows(IllegalArgumentException.class, () -> Net.validatePort("listenPort", 70_000));
  }
}
