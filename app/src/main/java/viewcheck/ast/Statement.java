package viewcheck.ast;

import java.util.List;
import java.util.Objects;

/** A statement of the command language. */
public sealed interface Statement
    permits Statement.Prim, Statement.If, Statement.While, Statement.DoWhile, Statement.Blocks {

  record Prim(PrimSet prims) implements Statement {
    public Prim {
      Objects.requireNonNull(prims, "prims");
    }
  }

  record If(Expression condition, Block then, Block otherwise) implements Statement {
    public If {
      Objects.requireNonNull(condition, "condition");
      Objects.requireNonNull(then, "then");
      Objects.requireNonNull(otherwise, "otherwise");
    }
  }

  record While(Expression condition, Block body) implements Statement {
    public While {
      Objects.requireNonNull(condition, "condition");
      Objects.requireNonNull(body, "body");
    }
  }

  record DoWhile(Block body, Expression condition) implements Statement {
    public DoWhile {
      Objects.requireNonNull(body, "body");
      Objects.requireNonNull(condition, "condition");
    }
  }

  /** Parallel composition {@code b1 || b2 || ...}. */
  record Blocks(List<Block> blocks) implements Statement {
    public Blocks {
      blocks = List.copyOf(blocks);
    }
  }
}
