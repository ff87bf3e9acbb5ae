package io.intellixity.docscope.mongo;

import java.util.Objects;

public record SortField(String field, Direction direction) {
  public SortField {
    Objects.requireNonNull(field, "field");
    if (field.isBlank()) throw new IllegalArgumentException("sort field must not be blank");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public static SortField asc(String field) { return new SortField(field, Direction.ASC); }

  public static SortField desc(String field) { return new SortField(field, Direction.DESC); }

  public enum Direction {
    ASC(1), DESC(-1);

    private final int value;

    Direction(int value) { this.value = value; }

    /** Driver sort value: 1 or -1. */
    public int value() { return value; }

    public static Direction of(int value) {
      if (value == 1) return ASC;
      if (value == -1) return DESC;
      throw new IllegalArgumentException("Invalid sort direction " + value + " (expected 1 or -1)");
    }
  }
}
