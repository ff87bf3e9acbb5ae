package io.intellixity.docscope.query;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class QueryOperatorTest {

  @Test
  void looksUpByKey() {
    assertEquals(QueryOperator.ELEM_MATCH, QueryOperator.forKey("$elemMatch"));
    assertNull(QueryOperator.forKey("$elemmatch"));
    assertNull(QueryOperator.forKey(null));
    assertTrue(QueryOperator.isKnown("$bitsAnySet"));
  }

  @Test
  void scopesSeparateDocumentAndFieldOperators() {
    assertEquals(QueryOperator.Scope.DOCUMENT, QueryOperator.OR.scope());
    assertEquals(QueryOperator.Scope.FIELD, QueryOperator.NOT.scope());
    assertEquals(QueryOperator.Scope.NESTED, QueryOperator.GEOMETRY.scope());
    assertTrue(QueryOperator.NOR.isLogicalList());
    assertFalse(QueryOperator.NOT.isLogicalList());
  }

  @Test
  void everyKeyCarriesTheSigil() {
    for (QueryOperator op : QueryOperator.values()) {
      assertTrue(QueryOperator.isOperatorKey(op.key()), op.name());
      assertSame(op, QueryOperator.forKey(op.toString()));
    }
  }
}
