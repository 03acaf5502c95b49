package ca.gc.cra.dualtap.application.port;

import ca.gc.cra.dualtap.domain.instrument.InstrumentationMessage;
import java.util.function.Consumer;

/**
 * Hook script injected into a target process.
 * <p>Messages are delivered on an engine-owned thread, concurrently with proxy callbacks.</p>
 *
 * @since 0.1.0
 */
public interface InstrumentationScript {
  /**
   * Registers the message handler. Must be called before {@link #load()}.
   *
   * @param handler receives every message the script emits
   */
  void onMessage(Consumer<InstrumentationMessage> handler);

  /**
   * Injects and starts the script.
   *
   * @throws InstrumentationException if the script fails to load
   */
  void load() throws InstrumentationException;

  /**
   * Stops the script and removes its hooks.
   *
   * @throws InstrumentationException if the engine reports a failure
   */
  void unload() throws InstrumentationException;
}
