package ca.gc.cra.dualtap.domain.instrument;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Message delivered asynchronously by injected hook code.
 * <p><strong>Why:</strong> Engines speak a loose wire form ({@code {type:"send", payload}} or
 * {@code {type:"error", description, stack}}); adapters consume this typed view instead.</p>
 * <p><strong>Thread-safety:</strong> Immutable apart from the payload object, which is passed through as received.</p>
 *
 * @param kind message kind
 * @param payload message payload; for {@link Kind#ERROR} the error description
 * @param stack script stack trace for errors; {@code null} otherwise
 * @since 0.1.0
 */
public record InstrumentationMessage(Kind kind, Object payload, String stack) {

  /** Message kinds understood by the capture core. */
  public enum Kind {
    /** Hook data sent by the script. */
    SEND,
    /** Script error raised inside the target process. */
    ERROR,
    /** Console output or any unrecognised message type. */
    LOG
  }

  public InstrumentationMessage {
    Objects.requireNonNull(kind, "kind");
  }

  /**
   * Creates a {@link Kind#SEND} message.
   *
   * @param payload hook payload
   * @return message
   */
  public static InstrumentationMessage send(Object payload) {
    return new InstrumentationMessage(Kind.SEND, payload, null);
  }

  /**
   * Creates a {@link Kind#ERROR} message.
   *
   * @param description error description
   * @param stack script stack, may be {@code null}
   * @return message
   */
  public static InstrumentationMessage error(String description, String stack) {
    return new InstrumentationMessage(Kind.ERROR, description, stack);
  }

  /**
   * Maps the engine wire form onto a typed message. Unknown {@code type} values become {@link Kind#LOG} carrying the
   * raw map.
   *
   * @param raw decoded wire message
   * @return typed message
   */
  public static InstrumentationMessage fromRaw(Map<String, Object> raw) {
    Objects.requireNonNull(raw, "raw");
    Object type = raw.get("type");
    String normalized = type == null ? "" : type.toString().toLowerCase(Locale.ROOT);
    switch (normalized) {
      case "send":
        return send(raw.get("payload"));
      case "error":
        Object description = raw.get("description");
        Object stack = raw.get("stack");
        return error(description == null ? null : description.toString(), stack == null ? null : stack.toString());
      case "log":
        return new InstrumentationMessage(Kind.LOG, raw.get("payload"), null);
      default:
        return new InstrumentationMessage(Kind.LOG, raw, null);
    }
  }
}
