package io.intellixity.docscope.spi.discovery;

import io.intellixity.docscope.spi.source.DocumentSource;
import io.intellixity.docscope.spi.source.DocumentSourceException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Test source backed by lists; counts sample calls and can be told to fail. */
final class InMemoryDocumentSource implements DocumentSource {
  private final String name;
  private final Map<String, List<Map<String, Object>>> collections = new LinkedHashMap<>();
  int sampleCalls;
  boolean failing;

  InMemoryDocumentSource(String name) {
    this.name = name;
  }

  InMemoryDocumentSource with(String collection, List<Map<String, Object>> documents) {
    collections.put(collection, new ArrayList<>(documents));
    return this;
  }

  @Override
  public String name() { return name; }

  @Override
  public List<String> collectionNames() {
    if (failing) throw new DocumentSourceException("store unavailable");
    return new ArrayList<>(collections.keySet());
  }

  @Override
  public List<Map<String, Object>> sample(String collection, int limit) {
    sampleCalls++;
    if (failing) throw new DocumentSourceException("store unavailable");
    List<Map<String, Object>> docs = collections.getOrDefault(collection, List.of());
    return docs.subList(0, Math.min(limit, docs.size()));
  }
}
