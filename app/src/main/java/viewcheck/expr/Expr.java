package viewcheck.expr;

/**
 * Root of the two-sorted (integer / Boolean) expression tree. Trees are immutable values and
 * compare structurally.
 *
 * @param <V> the variable representation at the leaves
 */
public sealed interface Expr<V> permits IntExpr, BoolExpr {}
