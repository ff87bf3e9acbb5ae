package io.intellixity.docscope.examples.web;

import io.intellixity.docscope.spi.discovery.SchemaDiscoveryException;
import org.bson.BsonInvalidOperationException;
import org.bson.Document;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ApiExceptionHandlerTest {
  private final ApiExceptionHandler handler = new ApiExceptionHandler();

  @Test
  void nonDocumentFilterIsABadRequestWithOneError() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> FindBodies.filter("[1, 2]"));

    ResponseEntity<ApiExceptionHandler.ErrorBody> response = handler.badRequest(e);
    assertEquals(400, response.getStatusCode().value());
    assertFalse(response.getBody().valid());
    assertEquals(List.of(e.getMessage()), response.getBody().errors());
  }

  @Test
  void rawBsonParseFailuresAreBadRequests() {
    BsonInvalidOperationException e = assertThrows(BsonInvalidOperationException.class, () -> Document.parse("5"));
    assertEquals(400, handler.badRequest(e).getStatusCode().value());
  }

  @Test
  void unknownCollectionIsNotFound() {
    ResponseEntity<ApiExceptionHandler.ErrorBody> response =
        handler.discoveryFailed(new SchemaDiscoveryException("Collection 'nope' not found"));
    assertEquals(404, response.getStatusCode().value());
  }
}
