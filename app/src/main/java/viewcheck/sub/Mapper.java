package viewcheck.sub;

import java.util.Objects;
import java.util.function.Function;

/**
 * A pair of functions, one per expression sort.
 *
 * @param <SI> integer-sorted input
 * @param <SB> Boolean-sorted input
 * @param <DI> integer-sorted output
 * @param <DB> Boolean-sorted output
 */
public interface Mapper<SI, SB, DI, DB> {

  DI mapInt(SI in);

  DB mapBool(SB in);

  static <SI, SB, DI, DB> Mapper<SI, SB, DI, DB> make(
      Function<? super SI, ? extends DI> intFn, Function<? super SB, ? extends DB> boolFn) {
    Objects.requireNonNull(intFn, "intFn");
    Objects.requireNonNull(boolFn, "boolFn");
    return new Mapper<>() {
      @Override
      public DI mapInt(SI in) {
        return intFn.apply(in);
      }

      @Override
      public DB mapBool(SB in) {
        return boolFn.apply(in);
      }
    };
  }

  /** Mapper applying the same function to both sorts. */
  static <S, D> Mapper<S, S, D, D> cmake(Function<? super S, ? extends D> fn) {
    return make(fn, fn);
  }

  /** Runs {@code first}, then {@code second}, sort by sort. */
  static <SI, SB, MI, MB, DI, DB> Mapper<SI, SB, DI, DB> compose(
      Mapper<SI, SB, MI, MB> first,
      Mapper<? super MI, ? super MB, ? extends DI, ? extends DB> second) {
    Objects.requireNonNull(first, "first");
    Objects.requireNonNull(second, "second");
    return make(
        in -> second.mapInt(first.mapInt(in)), in -> second.mapBool(first.mapBool(in)));
  }
}
