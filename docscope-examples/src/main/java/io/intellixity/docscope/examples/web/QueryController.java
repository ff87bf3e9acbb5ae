package io.intellixity.docscope.examples.web;

import io.intellixity.docscope.examples.service.SchemaService;
import io.intellixity.docscope.examples.service.SchemaService.ValidationReport;
import org.bson.Document;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/query")
public final class QueryController {
  private static final JsonWriterSettings RELAXED = JsonWriterSettings.builder().outputMode(JsonMode.RELAXED).build();

  private final SchemaService schemas;

  public QueryController(SchemaService schemas) {
    this.schemas = schemas;
  }

  @PostMapping(value = "/syntax", consumes = MediaType.APPLICATION_JSON_VALUE)
  public ValidationReport syntax(@RequestBody String filter) {
    return schemas.validateSyntax(FindBodies.filter(filter));
  }

  @PostMapping(value = "/{collection}/validate", consumes = MediaType.APPLICATION_JSON_VALUE)
  public ValidationReport validate(@PathVariable("collection") String collection, @RequestBody String filter) {
    return schemas.validate(collection, FindBodies.filter(filter));
  }

  /** Responds with extended JSON so ObjectIds and dates survive the trip. */
  @PostMapping(value = "/{collection}/find", consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<String> find(@PathVariable("collection") String collection, @RequestBody String body) {
    List<Document> docs = schemas.find(FindBodies.parse(collection, body));
    StringBuilder sb = new StringBuilder("[");
    for (int i = 0; i < docs.size(); i++) {
      if (i > 0) sb.append(',');
      sb.append(docs.get(i).toJson(RELAXED));
    }
    return ResponseEntity.ok(sb.append(']').toString());
  }
}
