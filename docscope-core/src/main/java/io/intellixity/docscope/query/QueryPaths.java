package io.intellixity.docscope.query;

/** Dotted path formatting for error messages. */
final class QueryPaths {
  private QueryPaths() {}

  static String child(String prefix, String key) {
    return (prefix == null || prefix.isEmpty()) ? key : prefix + "." + key;
  }

  static String index(String path, int i) {
    return path + "[" + i + "]";
  }
}
