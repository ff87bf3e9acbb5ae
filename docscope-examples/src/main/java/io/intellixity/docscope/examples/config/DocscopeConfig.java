package io.intellixity.docscope.examples.config;

import io.intellixity.docscope.mongo.MongoToolkit;
import io.intellixity.docscope.spi.discovery.SchemaDiscovery;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(MongoProperties.class)
public class DocscopeConfig {

  @Bean(destroyMethod = "close")
  public MongoToolkit mongoToolkit(MongoProperties props) {
    MongoProperties.Cache c = props.getCache();
    SchemaDiscovery.CacheSettings cache = new SchemaDiscovery.CacheSettings(
        c.getMaxEntries(), millis(c.getTtl()), millis(c.getIdle()));
    MongoToolkit.Options options = new MongoToolkit.Options(props.getSampleSize(), props.getSamplingMode(), cache);
    // fails fast on a missing uri/database or an unreachable server
    return MongoToolkit.connect(props.getUri(), props.getDatabase(), options);
  }

  private static long millis(java.time.Duration d) {
    return (d == null) ? 0 : d.toMillis();
  }
}
