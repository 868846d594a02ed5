package ca.gc.cra.sentinel.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void canonicalIpNormalizesSpellings() {
    assertEquals("10.0.0.1", Net.canonicalIp("010.000.0.01"));
    assertEquals("2001:db8::1", Net.canonicalIp("[2001:DB8:0000:0:0:0:0:1]"));
    assertEquals("::1", Net.canonicalIp("0:0:0:0:0:0:0:1"));
    assertEquals("2001:db8:0:1::1", Net.canonicalIp("2001:db8:0:1:0:0:0:1"));
    assertEquals("2001:db8:0:1:1:1:1:1", Net.canonicalIp("2001:db8::1:1:1:1:1"));
    assertEquals("fe80::1:0:0:1", Net.canonicalIp("fe80:0:0:0:1:0:0:1"));
    assertTrue(Net.tryCanonicalIp("example.com").isEmpty());
    assertThrows(IllegalArgumentException.class, () -> Net.canonicalIp("2001:db8:::zz"));
  }

  @Test
  void requireIpAddressAcceptsBothFamilies() {
    assertEquals("192.168.1.20", Net.requireIpAddress(" 192.168.1.20 "));
    assertEquals("2001:db8::1", Net.requireIpAddress("[2001:db8::1]"));
  }

  @Test
  void requireIpAddressRejectsHostnamesAndBadOctets() {
    assertThrows(IllegalArgumentException.class, () -> Net.requireIpAddress("example.com"));
    assertThrows(IllegalArgumentException.class, () -> Net.requireIpAddress("10.0.0.256"));
    assertThrows(IllegalArgumentException.class, () -> Net.requireIpAddress("2001:db8:::zz"));
  }

  @Test
  void validateHostPortListNormalizesEntries() {
    assertEquals("broker-1:9092,[2001:db8::2]:9093",
        Net.validateHostPortList(" broker-1:9092 ,, [2001:db8::2]:9093"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPortList(",,"));
  }

  @Test
  void validateHostPortRejectsMissingOrOutOfRangePort() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("localhost"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("localhost:0"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHostPort("2001:db8::1:443"));
  }

  @Test
  void validateBindHostAllowsWildcardAndHostnames() {
    assertEquals("0.0.0.0", Net.validateBindHost("0.0.0.0"));
    assertEquals("monitor.local", Net.validateBindHost("monitor.local"));
    assertEquals("::1", Net.validateBindHost("::1"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateBindHost("-bad-.host"));
  }
}
