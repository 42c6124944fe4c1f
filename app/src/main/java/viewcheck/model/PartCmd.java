package viewcheck.model;

import java.util.List;
import java.util.Objects;
import viewcheck.command.Command;
import viewcheck.expr.BoolExpr;
import viewcheck.var.MarkedVar;
import viewcheck.var.Sym;

/** A typed statement: a command, or control flow around typed blocks. */
public sealed interface PartCmd permits PartCmd.Prim, PartCmd.While, PartCmd.Ite, PartCmd.Parallel {

  record Prim(Command command) implements PartCmd {
    public Prim {
      Objects.requireNonNull(command, "command");
    }
  }

  /** A {@code while} loop, or a {@code do-while} loop when {@code isDo} is set. */
  record While(boolean isDo, BoolExpr<Sym<MarkedVar>> condition, ModelBlock body)
      implements PartCmd {
    public While {
      Objects.requireNonNull(condition, "condition");
      Objects.requireNonNull(body, "body");
    }
  }

  record Ite(BoolExpr<Sym<MarkedVar>> condition, ModelBlock then, ModelBlock otherwise)
      implements PartCmd {
    public Ite {
      Objects.requireNonNull(condition, "condition");
      Objects.requireNonNull(then, "then");
      Objects.requireNonNull(otherwise, "otherwise");
    }
  }

  record Parallel(List<ModelBlock> blocks) implements PartCmd {
    public Parallel {
      blocks = List.copyOf(blocks);
    }
  }
}
