package viewcheck.view;

import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.Multiset;
import viewcheck.expr.BoolExpr;
import viewcheck.expr.Expr;
import viewcheck.expr.Exprs;

/** Multiset operations over guarded view instances. */
public final class GuardedViews {
  private GuardedViews() {}

  public static ImmutableMultiset<GFunc> empty() {
    return ImmutableMultiset.of();
  }

  /** A single unconditionally held instance. */
  public static ImmutableMultiset<GFunc> unconditional(Func<Expr<String>> item) {
    return ImmutableMultiset.of(new GFunc(Exprs.bTrue(), item));
  }

  /** Multiset sum: occurrence counts add up. */
  public static ImmutableMultiset<GFunc> union(Multiset<GFunc> left, Multiset<GFunc> right) {
    return ImmutableMultiset.<GFunc>builder().addAll(left).addAll(right).build();
  }

  /** Strengthens the guard of every instance with {@code condition}, preserving counts. */
  public static ImmutableMultiset<GFunc> withGuard(
      Multiset<GFunc> views, BoolExpr<String> condition) {
    ImmutableMultiset.Builder<GFunc> builder = ImmutableMultiset.builder();
    for (Multiset.Entry<GFunc> entry : views.entrySet()) {
      GFunc view = entry.getElement();
      builder.addCopies(
          new GFunc(Exprs.mkAnd(view.guard(), condition), view.item()), entry.getCount());
    }
    return builder.build();
  }
}
