package io.intellixity.docscope.examples.web;

import io.intellixity.docscope.examples.service.SchemaService;
import io.intellixity.docscope.spi.discovery.DatabaseSchema;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/schema")
public final class SchemaController {
  private final SchemaService schemas;

  public SchemaController(SchemaService schemas) {
    this.schemas = schemas;
  }

  @GetMapping
  public DatabaseSchema get(@RequestParam(value = "collection", required = false) String collection,
                            @RequestParam(value = "sampleSize", required = false) Integer sampleSize) {
    return schemas.schema(collection, sampleSize);
  }

  @DeleteMapping("/cache")
  public ResponseEntity<Void> clearCache() {
    schemas.clearCache();
    return ResponseEntity.noContent().build();
  }
}
