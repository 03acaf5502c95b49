package ca.gc.cra.dualtap.validation;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Hostname and address validation for proxy bind addresses and target domain lists.
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class Net {

  // RFC-conservative bounds
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH = 63;

  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Validates and normalizes a hostname or IPv4 literal to lower case without a trailing dot.
   *
   * @param name logical name for diagnostics
   * @param value candidate host
   * @return normalized host
   * @throws IllegalArgumentException when the host is malformed
   */
  public static String validateHost(String name, String value) {
    String sanitized = Strings.requireNonBlank(name, value).toLowerCase(Locale.ROOT);
    if (sanitized.endsWith(".")) {
      sanitized = sanitized.substring(0, sanitized.length() - 1);
    }
    if (IPV4_PATTERN.matcher(sanitized).matches()) {
      validateIpv4Octets(sanitized);
      return sanitized;
    }
    validateHostname(name, sanitized);
    return sanitized;
  }

  /**
   * Validates a TCP port; {@code 0} is accepted to request an ephemeral port.
   *
   * @param name logical name for diagnostics
   * @param port candidate port
   * @return the port when valid
   */
  public static int validatePort(String name, int port) {
    return (int) Numbers.requireRange(name, port, 0, 65_535);
  }

  private static void validateHostname(String name, String host) {
    final int len = host.length();
    if (len == 0 || len > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException(
          name + ": invalid hostname length " + len + " (must be 1.." + MAX_HOSTNAME_LENGTH + ')');
    }
    int start = 0;
    while (true) {
      final int dot = host.indexOf('.', start);
      final int end = (dot == -1) ? len : dot;
      validateLabel(name, host, start, end);
      if (dot == -1) {
        break;
      }
      start = dot + 1;
    }
  }

  private static void validateLabel(String name, String s, int start, int end) {
    final int labelLen = end - start;
    if (labelLen <= 0 || labelLen > MAX_LABEL_LENGTH) {
      throw new IllegalArgumentException(
          name + ": invalid hostname label length " + labelLen + " in '" + s + "'");
    }
    if (!isAsciiAlnum(s.charAt(start)) || !isAsciiAlnum(s.charAt(end - 1))) {
      throw new IllegalArgumentException(
          name + ": hostname labels must start and end with alphanumerics ('" + s + "')");
    }
    for (int i = start + 1; i < end - 1; i++) {
      final char c = s.charAt(i);
      if (!(isAsciiAlnum(c) || c == '-')) {
        throw new IllegalArgumentException(name + ": illegal hostname character '" + c + '\'');
      }
    }
  }

  private static void validateIpv4Octets(String host) {
    for (String part : host.split("\\.")) {
      Numbers.requireRange("IPv4 octet", Integer.parseInt(part), 0, 255);
    }
  }

  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || (c >= '0' && c <= '9');
  }
}
