package io.intellixity.docscope.examples.config;

import io.intellixity.docscope.mongo.SamplingMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "docscope.mongo")
public class MongoProperties {
  private String uri;
  private String database;
  private int sampleSize = 100;
  private SamplingMode samplingMode = SamplingMode.FIRST;
  private final Cache cache = new Cache();

  public String getUri() { return uri; }
  public void setUri(String uri) { this.uri = uri; }
  public String getDatabase() { return database; }
  public void setDatabase(String database) { this.database = database; }
  public int getSampleSize() { return sampleSize; }
  public void setSampleSize(int sampleSize) { this.sampleSize = sampleSize; }
  public SamplingMode getSamplingMode() { return samplingMode; }
  public void setSamplingMode(SamplingMode samplingMode) { this.samplingMode = samplingMode; }
  public Cache getCache() { return cache; }

  /** Snapshot cache; max-entries 0 turns it off. */
  public static class Cache {
    private int maxEntries = 256;
    private Duration ttl = Duration.ofMinutes(10);
    /** Zero disables idle expiry. */
    private Duration idle = Duration.ZERO;

    public int getMaxEntries() { return maxEntries; }
    public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }
    public Duration getTtl() { return ttl; }
    public void setTtl(Duration ttl) { this.ttl = ttl; }
    public Duration getIdle() { return idle; }
    public void setIdle(Duration idle) { this.idle = idle; }
  }
}
