package io.intellixity.docscope.mongo;

/** How {@link MongoDocumentSource} picks the documents of a sample. */
public enum SamplingMode {
  /** The first documents in natural order ({@code find().limit(n)}). */
  FIRST,
  /** A random sample ({@code $sample} aggregation stage). */
  RANDOM
}
