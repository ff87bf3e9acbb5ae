package io.intellixity.docscope.query;

import io.intellixity.docscope.schema.CollectionSchema;

import java.util.ArrayList;
import java.util.List;

/** Entry points for filter validation. */
public final class QueryValidation {
  public static final String WARNING_PREFIX = "Warning:";

  private QueryValidation() {}

  public static List<String> validateSyntax(Object query) {
    return new SyntaxQueryValidator().validate(query);
  }

  public static List<String> validateAgainstSchema(Object query, CollectionSchema schema) {
    return new SchemaAwareQueryValidator(schema).validate(query);
  }

  /** Throws when syntax validation reports anything other than warnings. */
  public static void requireValidSyntax(Object query) {
    requireNoErrors("Query syntax is invalid", validateSyntax(query));
  }

  public static void requireValidAgainstSchema(Object query, CollectionSchema schema) {
    requireNoErrors("Query does not match the collection schema", validateAgainstSchema(query, schema));
  }

  public static boolean isWarning(String message) {
    return message != null && message.startsWith(WARNING_PREFIX);
  }

  /** Errors only; warnings are dropped. */
  public static List<String> errorsOnly(List<String> messages) {
    List<String> out = new ArrayList<>();
    for (String m : messages) {
      if (!isWarning(m)) out.add(m);
    }
    return out;
  }

  private static void requireNoErrors(String what, List<String> messages) {
    List<String> errors = errorsOnly(messages);
    if (!errors.isEmpty()) {
      throw new QueryValidationException(what + ": " + String.join("; ", errors), errors);
    }
  }
}
