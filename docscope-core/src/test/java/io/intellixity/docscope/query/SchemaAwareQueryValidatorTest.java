package io.intellixity.docscope.query;

import io.intellixity.docscope.schema.CollectionSchema;
import io.intellixity.docscope.schema.CollectionSchemaAggregator;
import io.intellixity.docscope.schema.SchemaNode;
import io.intellixity.docscope.types.TypeTag;
import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

final class SchemaAwareQueryValidatorTest {
  private static final CollectionSchema ORDERS = new CollectionSchemaAggregator().aggregate(List.of(
      Document.parse("""
          {
            "_id": 1,
            "age": 31,
            "name": "Ann",
            "score": 4.5,
            "tags": ["a", "b"],
            "flags": [],
            "address": { "city": "Oslo", "zip": "0150" },
            "items": [ { "sku": "A1", "qty": 2 } ],
            "matrix": [1, 2]
          }
          """),
      Document.parse("{\"_id\": 2, \"age\": 42, \"name\": null, \"score\": 3}")
  )).schema();

  private static List<String> validate(String json) {
    return new SchemaAwareQueryValidator(ORDERS).validate(Document.parse(json));
  }

  private static List<String> errors(String json) {
    return QueryValidation.errorsOnly(validate(json));
  }

  @Test
  void rejectsMismatchedEquality() {
    List<String> errors = validate("{\"age\": \"old\"}");
    assertEquals(1, errors.size());
    assertTrue(errors.get(0).contains("age"));
  }

  @Test
  void acceptsCompatibleComparison() {
    assertTrue(validate("{\"age\": {\"$gte\": 30}}").isEmpty());
  }

  @Test
  void numericTagsAreInterchangeable() {
    assertTrue(validate("{\"age\": 30.5, \"score\": {\"$lt\": 5}}").isEmpty());
    assertTrue(validate("{\"age\": {\"$numberLong\": \"30\"}}").isEmpty());
  }

  @Test
  void nullIsAcceptedWhereItWasSeen() {
    assertTrue(validate("{\"name\": null}").isEmpty());
    assertEquals(1, validate("{\"age\": null}").size());
  }

  @Test
  void missingNestedSegmentIsNamed() {
    List<String> errors = validate("{\"address.country\": \"NO\"}");
    assertEquals(1, errors.size());
    assertTrue(errors.get(0).contains("'country'"), errors.get(0));
    assertTrue(validate("{\"address.city\": \"Oslo\"}").isEmpty());
  }

  @Test
  void missingTopLevelFieldIsReported() {
    List<String> errors = validate("{\"nope\": 1}");
    assertEquals(1, errors.size());
    assertTrue(errors.get(0).contains("'nope'"));
  }

  @Test
  void traversingThroughAScalarIsReported() {
    List<String> errors = validate("{\"age.value\": 1}");
    assertEquals(1, errors.size());
    assertTrue(errors.get(0).contains("not an object"), errors.get(0));
  }

  @Test
  void dottedPathsTraverseArraysOfDocuments() {
    assertTrue(validate("{\"items.sku\": \"A1\", \"items.0.qty\": {\"$gt\": 1}}").isEmpty());
    assertEquals(1, validate("{\"items.qty\": \"many\"}").size());
  }

  @Test
  void objectWithoutNestedSchemaIsReported() {
    CollectionSchema partial = CollectionSchema.of(Map.of(
        "meta", new SchemaNode(java.util.EnumSet.of(TypeTag.OBJECT), null, null)));
    List<String> errors = new SchemaAwareQueryValidator(partial).validate(Map.of("meta.x", 1));
    assertEquals(1, errors.size());
    assertTrue(errors.get(0).contains("no nested schema"));
  }

  @Test
  void scalarMatchesArrayElements() {
    assertTrue(validate("{\"tags\": \"a\"}").isEmpty());
    assertTrue(validate("{\"tags\": [\"a\", \"b\"]}").isEmpty());
    assertEquals(1, validate("{\"tags\": 5}").size());
  }

  @Test
  void regexMatchesStrings() {
    assertTrue(new SchemaAwareQueryValidator(ORDERS).validate(Map.of("name", Pattern.compile("^A"))).isEmpty());
    assertTrue(validate("{\"name\": {\"$regex\": \"^A\", \"$options\": \"i\"}}").isEmpty());
    List<String> onNumber = validate("{\"age\": {\"$regex\": \"^4\"}}");
    assertEquals(1, onNumber.size());
    assertTrue(QueryValidation.isWarning(onNumber.get(0)));
    assertEquals(1, validate("{\"name\": {\"$regex\": \"^A\", \"$options\": 1}}").size());
  }

  @Test
  void inChecksEveryElement() {
    List<String> errors = validate("{\"age\": {\"$in\": [1, \"x\", 3]}}");
    assertEquals(1, errors.size());
    assertTrue(errors.get(0).contains("age[1]"), errors.get(0));
    assertEquals(1, validate("{\"age\": {\"$nin\": 3}}").size());
  }

  @Test
  void typeOperatorWarnsOrRejects() {
    assertTrue(validate("{\"age\": {\"$type\": \"number\"}}").isEmpty());
    assertTrue(validate("{\"age\": {\"$type\": 16}}").isEmpty());

    List<String> notInSchema = validate("{\"age\": {\"$type\": \"string\"}}");
    assertEquals(1, notInSchema.size());
    assertTrue(QueryValidation.isWarning(notInSchema.get(0)));

    List<String> bogus = validate("{\"age\": {\"$type\": \"nonsense\"}}");
    assertEquals(1, bogus.size());
    assertFalse(QueryValidation.isWarning(bogus.get(0)));

    List<String> empty = validate("{\"age\": {\"$type\": []}}");
    assertEquals(1, empty.size());
    assertTrue(empty.get(0).contains("non-empty array"));
  }

  @Test
  void objectChildrenWinOverArrayIndexes() {
    SchemaNode both = new SchemaNode(EnumSet.of(TypeTag.OBJECT, TypeTag.ARRAY),
        Map.of("0", SchemaNode.of(TypeTag.STRING)), SchemaNode.of(TypeTag.INT));
    SchemaAwareQueryValidator v = new SchemaAwareQueryValidator(CollectionSchema.of(Map.of("f", both)));

    assertTrue(v.validate(Map.of("f.0", "x")).isEmpty());
    assertEquals(1, v.validate(Map.of("f.0", 5)).size());
    assertTrue(v.validate(Map.of("f.1", 5)).isEmpty());
  }

  @Test
  void arrayOperatorsRequireArrayFields() {
    assertEquals(1, validate("{\"age\": {\"$size\": 2}}").size());
    assertEquals(1, validate("{\"age\": {\"$all\": [1]}}").size());
    assertEquals(1, validate("{\"age\": {\"$elemMatch\": {\"$gt\": 1}}}").size());
    assertTrue(validate("{\"tags\": {\"$size\": 2, \"$all\": [\"a\"]}}").isEmpty());
    assertEquals(1, validate("{\"tags\": {\"$size\": -1}}").size());
  }

  @Test
  void allChecksElementTypes() {
    List<String> errors = validate("{\"tags\": {\"$all\": [\"a\", 7]}}");
    assertEquals(1, errors.size());
    assertTrue(errors.get(0).contains("tags[1]"));
  }

  @Test
  void elemMatchOnDocumentsValidatesSubQuery() {
    assertTrue(validate("{\"items\": {\"$elemMatch\": {\"sku\": \"A1\", \"qty\": {\"$gte\": 2}}}}").isEmpty());
    assertEquals(1, validate("{\"items\": {\"$elemMatch\": {\"colour\": \"red\"}}}").size());
    assertEquals(1, validate("{\"items\": {\"$elemMatch\": {\"qty\": \"two\"}}}").size());
  }

  @Test
  void logicalOperatorsInsideElemMatchUseElementFields() {
    assertTrue(validate("{\"items\": {\"$elemMatch\": {\"$or\": [{\"sku\": \"A1\"}, {\"qty\": 1}]}}}").isEmpty());
    List<String> errors = validate("{\"items\": {\"$elemMatch\": {\"$or\": [{\"age\": 1}]}}}");
    assertEquals(1, errors.size());
  }

  @Test
  void elemMatchOnPrimitivesValidatesOperatorBlock() {
    assertTrue(validate("{\"matrix\": {\"$elemMatch\": {\"$gte\": 1, \"$lt\": 5}}}").isEmpty());
    assertEquals(1, validate("{\"matrix\": {\"$elemMatch\": {\"$gte\": \"a\"}}}").size());
  }

  @Test
  void elementsOnlySeenEmptySkipElementChecks() {
    assertTrue(validate("{\"flags\": \"anything\"}").isEmpty());
    assertTrue(validate("{\"flags\": {\"$all\": [1, \"x\"]}}").isEmpty());
    assertTrue(validate("{\"flags\": {\"$elemMatch\": {\"on\": true}}}").isEmpty());
    assertEquals(1, validate("{\"flags\": {\"$elemMatch\": {\"$bogus\": 1}}}").size());
  }

  @Test
  void allAcceptsElemMatchDocuments() {
    assertTrue(validate("{\"items\": {\"$all\": [{\"$elemMatch\": {\"qty\": 2}}]}}").isEmpty());
    assertEquals(1, validate("{\"items\": {\"$all\": [{\"$elemMatch\": {\"qty\": \"x\"}}]}}").size());
  }

  @Test
  void fieldLevelNotIsValidatedAgainstTheField() {
    assertTrue(validate("{\"age\": {\"$not\": {\"$gt\": 5}}}").isEmpty());
    assertEquals(1, validate("{\"age\": {\"$not\": {\"$gt\": \"x\"}}}").size());
    assertEquals(1, validate("{\"age\": {\"$not\": {}}}").size());
    List<String> regexOnNumber = new SchemaAwareQueryValidator(ORDERS)
        .validate(Map.of("age", Map.of("$not", Pattern.compile("^4"))));
    assertEquals(1, regexOnNumber.size());
    assertTrue(QueryValidation.isWarning(regexOnNumber.get(0)));
  }

  @Test
  void documentLevelNotIsShallow() {
    List<String> messages = validate("{\"$not\": {\"age\": \"old\"}}");
    assertEquals(1, messages.size());
    assertTrue(QueryValidation.isWarning(messages.get(0)));
    assertEquals(1, validate("{\"$not\": 3}").size());
  }

  @Test
  void modAndBitwiseShapes() {
    assertTrue(validate("{\"age\": {\"$mod\": [2, 0]}}").isEmpty());
    assertEquals(1, validate("{\"age\": {\"$mod\": [2]}}").size());
    List<String> modOnString = validate("{\"name\": {\"$mod\": [2, 0]}}");
    assertEquals(1, modOnString.size());
    assertTrue(QueryValidation.isWarning(modOnString.get(0)));

    assertTrue(validate("{\"age\": {\"$bitsAllSet\": 6, \"$bitsAnyClear\": [0, 3]}}").isEmpty());
    assertEquals(1, validate("{\"age\": {\"$bitsAnySet\": \"x\"}}").size());
    assertEquals(1, validate("{\"age\": {\"$bitsAnySet\": -1}}").size());
  }

  @Test
  void geoOperatorsNeedDocumentOrArray() {
    assertTrue(validate("{\"address\": {\"$geoWithin\": {\"$centerSphere\": [[0, 0], 1]}}}").isEmpty());
    assertEquals(1, validate("{\"address\": {\"$near\": \"here\"}}").size());
    assertEquals(1, validate("{\"address\": {\"$geometry\": {}}}").size());
  }

  @Test
  void logicalOperatorsRecurseAtTheSameScope() {
    assertTrue(validate("{\"$or\": [{\"age\": 1}, {\"address.city\": \"Oslo\"}]}").isEmpty());
    List<String> errors = validate("{\"$and\": [{\"age\": \"x\"}, 4]}");
    assertEquals(2, errors.size());
    assertTrue(errors.get(1).contains("$and[1]"));
    assertEquals(1, validate("{\"$or\": {\"age\": 1}}").size());
    List<String> empty = validate("{\"$nor\": []}");
    assertEquals(1, empty.size());
    assertTrue(QueryValidation.isWarning(empty.get(0)));
  }

  @Test
  void documentLevelOperatorShapes() {
    assertTrue(validate("{\"$expr\": {\"$gt\": [\"$age\", 3]}, \"$comment\": \"why\"}").isEmpty());
    assertTrue(validate("{\"$text\": {\"$search\": \"coffee\"}}").isEmpty());
    assertEquals(1, validate("{\"$text\": {\"$language\": \"en\"}}").size());
    assertTrue(validate("{\"$where\": \"this.age > 3\"}").isEmpty());
    assertEquals(1, validate("{\"$where\": 3}").size());
    assertEquals(1, validate("{\"$gt\": 3}").size());
    assertEquals(1, validate("{\"$nope\": 3}").size());
  }

  @Test
  void fieldOperatorMisuse() {
    assertEquals(1, validate("{\"age\": {\"$or\": [1]}}").size());
    assertEquals(1, validate("{\"age\": {\"$gt\": 1, \"other\": 2}}").size());
    assertEquals(1, validate("{\"age\": {\"$unknown\": 1}}").size());
    assertEquals(1, validate("{\"age\": {\"$exists\": 1}}").size());
  }

  @Test
  void nestingBeyondMaxDepthIsReportedOnce() {
    SchemaAwareQueryValidator v = new SchemaAwareQueryValidator(ORDERS, 5);

    Object and = Map.of("age", 1);
    for (int i = 0; i < 10; i++) and = Map.of("$and", List.of(and));
    List<String> andErrors = v.validate(and);
    assertEquals(1, andErrors.size());
    assertTrue(andErrors.get(0).contains("maximum depth of 5"));

    Object not = Map.of("$gt", 1);
    for (int i = 0; i < 10; i++) not = Map.of("$not", not);
    List<String> notErrors = v.validate(Map.of("age", not));
    assertEquals(1, notErrors.size());
    assertTrue(notErrors.get(0).contains("maximum depth of 5"));
  }

  @Test
  void veryDeepQueriesDoNotOverflowTheStack() {
    Object q = Map.of("age", 1);
    for (int i = 0; i < 20_000; i++) q = Map.of("$and", List.of(q));
    assertEquals(1, new SchemaAwareQueryValidator(ORDERS).validate(q).size());
  }

  @Test
  void malformedRootYieldsExactlyOneError() {
    assertEquals(1, new SchemaAwareQueryValidator(ORDERS).validate("age").size());
    assertEquals(1, new SchemaAwareQueryValidator(null).validate(Map.of("age", 1)).size());
  }

  @Test
  void requireValidThrowsWithErrors() {
    QueryValidation.requireValidAgainstSchema(Document.parse("{\"$and\": []}"), ORDERS);

    QueryValidationException e = assertThrows(QueryValidationException.class,
        () -> QueryValidation.requireValidAgainstSchema(Document.parse("{\"age\": \"x\", \"nope\": 1}"), ORDERS));
    assertEquals(2, e.errors().size());
    assertThrows(QueryValidationException.class, () -> QueryValidation.requireValidSyntax(List.of()));
  }

  @Test
  void errorsOnlyDropsWarnings() {
    assertTrue(errors("{\"age\": {\"$type\": \"string\"}}").isEmpty());
  }
}
