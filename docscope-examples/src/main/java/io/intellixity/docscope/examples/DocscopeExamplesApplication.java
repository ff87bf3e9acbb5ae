package io.intellixity.docscope.examples;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;

// The toolkit owns its MongoClient; Boot's auto-configured client is not used.
@SpringBootApplication(exclude = {MongoAutoConfiguration.class})
public class DocscopeExamplesApplication {
  public static void main(String[] args) {
    SpringApplication.run(DocscopeExamplesApplication.class, args);
  }
}
