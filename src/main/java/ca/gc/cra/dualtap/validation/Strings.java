package ca.gc.cra.dualtap.validation;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Validation utilities for strings used by DUALTAP configuration and CLI layers.
 * <p><strong>Why:</strong> Capture adapters should only ever see sanitized header names, process names and
 * domain lists; rejecting bad input early keeps the proxy and instrumentation engines out of undefined states.</p>
 * <p><strong>Role:</strong> Domain support utilities invoked before ports/adapters allocate sockets, sessions or
 * database files.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No metrics or logs; validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Net
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Ensures a value contains only printable ASCII characters and is within the supplied length budget.
   *
   * @param name logical name for diagnostics
   * @param value candidate string; must be non-null
   * @param maxLength maximum permitted length in characters
   * @return validated value containing only characters {@code 0x20-0x7E}
   * @throws IllegalArgumentException if the value is blank, too long, or contains non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  /**
   * Validates an HTTP header field name (RFC 9110 token characters).
   *
   * @param name logical name for diagnostics
   * @param value candidate header name
   * @return trimmed header name
   * @throws IllegalArgumentException if the value contains characters outside the token set
   */
  public static String requireHeaderName(String name, String value) {
    String sanitized = requirePrintableAscii(name, value, 128);
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      boolean token = Character.isLetterOrDigit(c) || "!#$%&'*+-.^_`|~".indexOf(c) >= 0;
      if (!token) {
        throw new IllegalArgumentException(message(name, "must be a valid HTTP header name"));
      }
    }
    return sanitized;
  }

  /**
   * Splits a comma separated list, trimming entries and dropping blanks while preserving order.
   *
   * @param name logical name for diagnostics
   * @param value comma separated text; {@code null} yields an empty list
   * @return ordered, de-duplicated entries
   * @throws IllegalArgumentException if any entry contains control characters
   */
  public static List<String> splitList(String name, String value) {
    if (value == null || value.isBlank()) {
      return List.of();
    }
    Set<String> entries = new LinkedHashSet<>();
    for (String token : value.split(",")) {
      if (token.isBlank()) {
        continue;
      }
      entries.add(requireNonBlank(name, token));
    }
    return List.copyOf(new ArrayList<>(entries));
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
