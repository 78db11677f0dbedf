package io.intellixity.sqlchain.op;

/**
 * Paging request. {@code skip}, {@code take} and {@code seed} are optional.
 */
public record Limits(Integer skip, Integer take, LimitOptions options, Integer seed) {
  public static final Limits NONE = new Limits(null, null, LimitOptions.NONE, null);

  public Limits {
    options = (options == null) ? LimitOptions.NONE : options;
    if (skip != null && skip < 0) throw new IllegalArgumentException("skip must be >= 0");
    if (take != null && take < 0) throw new IllegalArgumentException("take must be >= 0");
    if (options == LimitOptions.NONE && (skip != null || take != null)) {
      options = LimitOptions.ROWS;
    }
    if (seed != null && options != LimitOptions.RANDOM_SAMPLE_ROWS) {
      throw new IllegalArgumentException("seed only applies to " + LimitOptions.RANDOM_SAMPLE_ROWS);
    }
  }

  public boolean isNone() {
    return options == LimitOptions.NONE;
  }
}
