package ca.gc.cra.sentinel.application.ingest;

import ca.gc.cra.sentinel.domain.traffic.HeaderList;
import ca.gc.cra.sentinel.validation.Net;
import java.util.Optional;

/**
 * Resolves the client address of an exchange: first {@code X-Forwarded-For} element, then {@code X-Real-IP},
 * then the directly connected peer.
 *
 * <p>Forwarding headers are only honoured when the edge is configured to trust them. IP literals are returned in
 * canonical form so that every spelling of one address is tracked and blocked as one client.</p>
 *
 * @since 0.1.0
 */
public final class ClientAddressResolver {
  static final String UNKNOWN = "unknown";

  private final boolean trustForwardedHeaders;

  public ClientAddressResolver(boolean trustForwardedHeaders) {
    this.trustForwardedHeaders = trustForwardedHeaders;
  }

  /**
   * Resolves the client address.
   *
   * @param headers request headers
   * @param peerAddress directly connected peer; may be blank
   * @return resolved address or {@code unknown}
   */
  public String resolve(HeaderList headers, String peerAddress) {
    String resolved = resolveRaw(headers, peerAddress);
    return Net.tryCanonicalIp(resolved).orElse(resolved);
  }

  private String resolveRaw(HeaderList headers, String peerAddress) {
    if (trustForwardedHeaders) {
      Optional<String> forwarded = headers.first("X-Forwarded-For")
          .map(value -> value.split(",", 2)[0].trim())
          .filter(value -> !value.isEmpty());
      if (forwarded.isPresent()) {
        return forwarded.get();
      }
      Optional<String> realIp = headers.first("X-Real-IP").map(String::trim).filter(value -> !value.isEmpty());
      if (realIp.isPresent()) {
        return realIp.get();
      }
    }
    if (peerAddress == null || peerAddress.isBlank()) {
      return UNKNOWN;
    }
    return stripPort(peerAddress.trim());
  }

  private static String stripPort(String peer) {
    if (peer.startsWith("[")) {
      int close = peer.indexOf(']');
      return close > 0 ? peer.substring(1, close) : peer;
    }
    int colon = peer.indexOf(':');
    if (colon > 0 && colon == peer.lastIndexOf(':')) {
      return peer.substring(0, colon);
    }
    return peer;
  }
}
