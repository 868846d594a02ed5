package ca.gc.cra.sentinel.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Network address validation for block rules, Kafka bootstrap lists, and the HTTP bind address.
 */
public final class Net {

  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH    = 63;

  // IPv4 dotted-quad shape (fast pre-check); octets are range-checked separately.
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");
  private static final Pattern IPV6_CHARS = Pattern.compile("\\A[0-9A-Fa-f:.]+\\z");

  private Net() {
    // Utility
  }

  /**
   * Validates an IPv4 or IPv6 literal without resolving names.
   *
   * @param value candidate address
   * @return trimmed literal; IPv6 literals are returned without brackets
   * @throws IllegalArgumentException when {@code value} is not an IP literal
   */
  public static String requireIpAddress(String value) {
    String sanitized = Strings.requireNonBlank("ip", value);
    if (sanitized.startsWith("[") && sanitized.endsWith("]")) {
      sanitized = sanitized.substring(1, sanitized.length() - 1);
    }
    if (IPV4_PATTERN.matcher(sanitized).matches()) {
      validateIpv4Octets(sanitized);
      return sanitized;
    }
    if (sanitized.indexOf(':') >= 0 && IPV6_CHARS.matcher(sanitized).matches()) {
      validateIpv6(sanitized);
      return sanitized;
    }
    throw new IllegalArgumentException("ip must be an IPv4 or IPv6 literal (was " + value + ")");
  }

  /**
   * Validates an IP literal and returns its canonical spelling: IPv4 octets without leading zeros, IPv6 in
   * lower case with the longest run of zero groups compressed.
   *
   * @param value candidate address, optionally bracketed
   * @return canonical literal
   * @throws IllegalArgumentException when {@code value} is not an IP literal
   */
  public static String canonicalIp(String value) {
    String literal = requireIpAddress(value);
    if (literal.indexOf(':') < 0) {
      String[] octets = literal.split("\\.");
      StringBuilder canonical = new StringBuilder(literal.length());
      for (int i = 0; i < octets.length; i++) {
        if (i > 0) {
          canonical.append('.');
        }
        canonical.append(Integer.parseInt(octets[i]));
      }
      return canonical.toString();
    }
    try {
      return compressIpv6(InetAddress.getByName(literal).getHostAddress());
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException("invalid IPv6 literal: " + literal, ex);
    }
  }

  /**
   * Canonical spelling of {@code value} when it is an IP literal.
   *
   * @param value candidate address; may be {@code null}
   * @return canonical literal, or empty when {@code value} is not an IP literal
   */
  public static Optional<String> tryCanonicalIp(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(canonicalIp(value));
    } catch (IllegalArgumentException ex) {
      return Optional.empty();
    }
  }

  /**
   * Validates a comma-separated list of {@code host:port} pairs such as a Kafka bootstrap list.
   *
   * @param value candidate list
   * @return normalized list joined by commas
   */
  public static String validateHostPortList(String value) {
    String sanitized = Strings.requireNonBlank("host:port list", value);
    List<String> normalized = new ArrayList<>();
    for (String token : sanitized.split(",")) {
      if (token.isBlank()) {
        continue;
      }
      normalized.add(validateHostPort(token));
    }
    if (normalized.isEmpty()) {
      throw new IllegalArgumentException("host:port list must contain at least one entry");
    }
    return String.join(",", normalized);
  }

  /** Validates a host:port string supporting hostnames, IPv4, and IPv6 literals. */
  public static String validateHostPort(String value) {
    final String sanitized = Strings.requireNonBlank("host:port", value).trim();
    final String host;
    final String portPart;
    final String normalizedHost;

    if (sanitized.startsWith("[")) {
      final int idx = sanitized.indexOf(']');
      if (idx < 0) {
        throw new IllegalArgumentException("host:port must close IPv6 literal with ']'");
      }
      host = sanitized.substring(1, idx);
      if (idx + 2 > sanitized.length() || sanitized.charAt(idx + 1) != ':') {
        throw new IllegalArgumentException("host:port must include :<port> after IPv6 literal");
      }
      portPart = sanitized.substring(idx + 2);
      validateIpv6(host);
      normalizedHost = '[' + host + ']';
    } else {
      final int lastColon = sanitized.lastIndexOf(':');
      if (lastColon <= 0 || lastColon == sanitized.length() - 1) {
        throw new IllegalArgumentException("host:port must use HOST:PORT format");
      }
      host = sanitized.substring(0, lastColon);
      portPart = sanitized.substring(lastColon + 1);
      if (host.indexOf(':') >= 0) {
        throw new IllegalArgumentException("IPv6 host must be wrapped in [ ]");
      }
      validateHost(host);
      normalizedHost = host;
    }

    final int port;
    try {
      port = Integer.parseInt(portPart);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("port must be numeric (was " + portPart + ")", ex);
    }
    Numbers.requireRange("port", port, 1, 65535);
    return normalizedHost + ':' + port;
  }

  /**
   * Validates a bind host: hostname, IPv4 literal, or IPv6 literal.
   *
   * @param value candidate host
   * @return trimmed host
   */
  public static String validateBindHost(String value) {
    String sanitized = Strings.requireNonBlank("host", value);
    if (sanitized.indexOf(':') >= 0) {
      return requireIpAddress(sanitized);
    }
    validateHost(sanitized);
    return sanitized;
  }

  private static void validateHost(String host) {
    if (IPV4_PATTERN.matcher(host).matches()) {
      validateIpv4Octets(host);
      return;
    }
    validateHostname(host);
  }

  private static void validateHostname(String host) {
    final int len = host.length();
    if (len == 0 || len > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException("invalid hostname length: " + len + " (must be 1.." + MAX_HOSTNAME_LENGTH + ')');
    }

    int start = 0;
    while (true) {
      final int dot = host.indexOf('.', start);
      final int end = (dot == -1) ? len : dot;
      validateLabel(host, start, end);
      if (dot == -1) {
        break;
      }
      start = dot + 1;
      if (start == len) {
        throw new IllegalArgumentException("invalid hostname: empty trailing label");
      }
    }
  }

  private static void validateLabel(String s, int start, int end) {
    final int labelLen = end - start;
    if (labelLen <= 0 || labelLen > MAX_LABEL_LENGTH) {
      throw new IllegalArgumentException("invalid hostname: label length " + labelLen + " (must be 1.." + MAX_LABEL_LENGTH + ")");
    }

    final char first = s.charAt(start);
    final char last  = s.charAt(end - 1);
    if (!isAsciiAlnum(first) || !isAsciiAlnum(last)) {
      throw new IllegalArgumentException("invalid hostname: labels must start/end with alphanumeric");
    }

    for (int i = start + 1; i < end - 1; i++) {
      final char c = s.charAt(i);
      if (!(isAsciiAlnum(c) || c == '-')) {
        throw new IllegalArgumentException("invalid hostname: illegal character '" + c + '\'');
      }
    }
  }

  private static void validateIpv4Octets(String host) {
    int startIndex = 0;
    for (int i = 0; i < 4; i++) {
      final int endIndex = (i < 3) ? host.indexOf('.', startIndex) : host.length();
      final String part = host.substring(startIndex, endIndex);
      final int octet = Integer.parseInt(part);
      Numbers.requireRange("IPv4 octet", octet, 0, 255);
      startIndex = endIndex + 1;
    }
  }

  // Literal-only input (checked by caller), so getByName never performs a DNS lookup.
  private static void validateIpv6(String host) {
    try {
      final InetAddress address = InetAddress.getByName(host);
      if (!(address instanceof Inet6Address)) {
        throw new IllegalArgumentException("invalid IPv6 literal: " + host);
      }
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException("invalid IPv6 literal: " + host, ex);
    }
  }

  // Input is the eight-group form produced by Inet6Address.getHostAddress().
  private static String compressIpv6(String full) {
    String[] groups = full.split(":");
    int bestStart = -1;
    int bestLength = 0;
    int runStart = -1;
    for (int i = 0; i < groups.length; i++) {
      if (!"0".equals(groups[i])) {
        runStart = -1;
        continue;
      }
      if (runStart < 0) {
        runStart = i;
      }
      if (i - runStart + 1 > bestLength) {
        bestStart = runStart;
        bestLength = i - runStart + 1;
      }
    }
    if (bestLength < 2) {
      return full;
    }
    String head = String.join(":", Arrays.copyOfRange(groups, 0, bestStart));
    String tail = String.join(":", Arrays.copyOfRange(groups, bestStart + bestLength, groups.length));
    return head + "::" + tail;
  }

  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || (c >= '0' && c <= '9');
  }
}
