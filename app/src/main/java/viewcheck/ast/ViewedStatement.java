package viewcheck.ast;

import java.util.Objects;

/** A statement followed by the view asserted after it. */
public record ViewedStatement(Statement statement, View post) {

  public ViewedStatement {
    Objects.requireNonNull(statement, "statement");
    Objects.requireNonNull(post, "post");
  }
}
