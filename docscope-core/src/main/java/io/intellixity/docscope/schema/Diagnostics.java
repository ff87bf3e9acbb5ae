package io.intellixity.docscope.schema;

import java.util.ArrayList;
import java.util.List;

/**
 * Side-channel collector for anomalies met during inference and merging.
 * Not thread-safe; one instance per aggregation pass.
 */
public final class Diagnostics {
  private final List<String> messages = new ArrayList<>();

  public void add(String message) {
    if (message != null) messages.add(message);
  }

  public List<String> messages() { return List.copyOf(messages); }

  public boolean isEmpty() { return messages.isEmpty(); }

  public int size() { return messages.size(); }
}
