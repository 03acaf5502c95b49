package ca.gc.cra.dualtap.application.capture;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Allow-list of target domains. A host matches when it equals an allow-listed domain or is a subdomain of one.
 * Comparison ignores case, any {@code :port} suffix and a trailing dot.
 *
 * @since 0.1.0
 */
public final class TargetHostMatcher {
  private final Set<String> domains;

  /**
   * @param domains allow-listed domains; normalized on construction
   */
  public TargetHostMatcher(Set<String> domains) {
    Objects.requireNonNull(domains, "domains");
    Set<String> normalized = new LinkedHashSet<>();
    for (String domain : domains) {
      String host = normalize(domain);
      if (!host.isEmpty()) {
        normalized.add(host);
      }
    }
    this.domains = Set.copyOf(normalized);
  }

  /**
   * Tests a request host against the allow-list.
   *
   * @param host request host, possibly with port; {@code null} never matches
   * @return {@code true} when the host is a target
   */
  public boolean matches(String host) {
    if (host == null) {
      return false;
    }
    String candidate = normalize(host);
    if (candidate.isEmpty()) {
      return false;
    }
    for (String domain : domains) {
      if (candidate.equals(domain) || candidate.endsWith("." + domain)) {
        return true;
      }
    }
    return false;
  }

  /** @return normalized allow-list */
  public Set<String> domains() {
    return domains;
  }

  static String normalize(String raw) {
    if (raw == null) {
      return "";
    }
    String host = raw.trim().toLowerCase(Locale.ROOT);
    if (host.startsWith("[")) {
      int close = host.indexOf(']');
      host = close > 0 ? host.substring(1, close) : host.substring(1);
    } else {
      int colon = host.indexOf(':');
      if (colon >= 0 && colon == host.lastIndexOf(':')) {
        host = host.substring(0, colon);
      }
    }
    while (host.endsWith(".")) {
      host = host.substring(0, host.length() - 1);
    }
    return host;
  }

  @Override
  public String toString() {
    return "TargetHostMatcher" + domains;
  }
}
