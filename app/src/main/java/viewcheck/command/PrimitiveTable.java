package viewcheck.command;

import static viewcheck.expr.Exprs.aAdd;
import static viewcheck.expr.Exprs.aInt;
import static viewcheck.expr.Exprs.aSub;
import static viewcheck.expr.Exprs.aVar;
import static viewcheck.expr.Exprs.bTrue;
import static viewcheck.expr.Exprs.bVar;
import static viewcheck.expr.Exprs.mkAnd;
import static viewcheck.expr.Exprs.mkEq;
import static viewcheck.expr.Exprs.mkImplies;
import static viewcheck.expr.Exprs.mkNot;

import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import viewcheck.expr.BoolExpr;
import viewcheck.expr.Expr;
import viewcheck.expr.IntExpr;
import viewcheck.var.Param;
import viewcheck.var.VarType;

/**
 * Semantics table mapping primitive names to their two-state relations.
 *
 * <p>Parameter conventions of the built-ins: post-state arguments are named {@code *After},
 * everything else is read in the pre-state. {@code !I++(x, xAfter)} increments {@code x}.
 */
public final class PrimitiveTable {
  public static final String LOAD = "!ILoad";
  public static final String LOAD_INCREMENT = "!ILoad++";
  public static final String LOAD_DECREMENT = "!ILoad--";
  public static final String INCREMENT = "!I++";
  public static final String DECREMENT = "!I--";
  public static final String INT_SET = "!ISet";
  public static final String BOOL_LOAD = "!BLoad";
  public static final String BOOL_SET = "!BSet";
  public static final String INT_CAS = "ICAS";
  public static final String BOOL_CAS = "BCAS";

  private static final PrimitiveTable BUILTINS = new PrimitiveTable(builtinDefs());

  private final ImmutableMap<String, PrimitiveDef> defs;

  private PrimitiveTable(Map<String, PrimitiveDef> defs) {
    this.defs = ImmutableMap.copyOf(defs);
  }

  public static PrimitiveTable builtins() {
    return BUILTINS;
  }

  /** Copy of this table with {@code name} (re)defined. */
  public PrimitiveTable with(String name, PrimitiveDef def) {
    Map<String, PrimitiveDef> copy = new LinkedHashMap<>(defs);
    copy.put(name, def);
    return new PrimitiveTable(copy);
  }

  public Optional<PrimitiveDef> lookup(String name) {
    return Optional.ofNullable(defs.get(name));
  }

  public Set<String> names() {
    return defs.keySet();
  }

  private static Map<String, PrimitiveDef> builtinDefs() {
    Map<String, PrimitiveDef> defs = new LinkedHashMap<>();
    defs.put(
        LOAD,
        new PrimitiveDef(ints("destAfter", "src"), mkEq(i("destAfter"), i("src"))));
    defs.put(
        LOAD_INCREMENT,
        new PrimitiveDef(
            ints("destAfter", "src", "srcAfter"),
            mkAnd(
                mkEq(i("destAfter"), i("src")),
                mkEq(i("srcAfter"), aAdd(i("src"), aInt(1))))));
    defs.put(
        LOAD_DECREMENT,
        new PrimitiveDef(
            ints("destAfter", "src", "srcAfter"),
            mkAnd(
                mkEq(i("destAfter"), i("src")),
                mkEq(i("srcAfter"), aSub(i("src"), aInt(1))))));
    defs.put(
        INCREMENT,
        new PrimitiveDef(ints("x", "xAfter"), mkEq(i("xAfter"), aAdd(i("x"), aInt(1)))));
    defs.put(
        DECREMENT,
        new PrimitiveDef(ints("x", "xAfter"), mkEq(i("xAfter"), aSub(i("x"), aInt(1)))));
    defs.put(
        INT_SET,
        new PrimitiveDef(ints("destAfter", "value"), mkEq(i("destAfter"), i("value"))));
    defs.put(
        BOOL_LOAD,
        new PrimitiveDef(bools("destAfter", "src"), mkEq(b("destAfter"), b("src"))));
    defs.put(
        BOOL_SET,
        new PrimitiveDef(bools("destAfter", "value"), mkEq(b("destAfter"), b("value"))));
    defs.put(INT_CAS, cas(VarType.INT));
    defs.put(BOOL_CAS, cas(VarType.BOOL));
    defs.put(
        Commands.ASSUME,
        new PrimitiveDef(List.of(Param.boolParam("cond")), bVar("cond")));
    defs.put(Commands.ID, new PrimitiveDef(List.of(), bTrue()));
    return defs;
  }

  /**
   * {@code CAS(dest, test, set)}: if {@code dest == test} then {@code dest := set}, otherwise
   * {@code test := dest}.
   */
  private static PrimitiveDef cas(VarType type) {
    List<Param> formals =
        List.of(
            new Param(type, "dest"),
            new Param(type, "destAfter"),
            new Param(type, "test"),
            new Param(type, "testAfter"),
            new Param(type, "set"));
    BoolExpr<String> succeeded = mkEq(leaf(type, "dest"), leaf(type, "test"));
    BoolExpr<String> body =
        mkAnd(
            mkImplies(
                succeeded,
                mkAnd(
                    mkEq(leaf(type, "destAfter"), leaf(type, "set")),
                    mkEq(leaf(type, "testAfter"), leaf(type, "test")))),
            mkImplies(
                mkNot(succeeded),
                mkAnd(
                    mkEq(leaf(type, "destAfter"), leaf(type, "dest")),
                    mkEq(leaf(type, "testAfter"), leaf(type, "dest")))));
    return new PrimitiveDef(formals, body);
  }

  private static Expr<String> leaf(VarType type, String name) {
    return type == VarType.INT ? i(name) : b(name);
  }

  private static IntExpr<String> i(String name) {
    return aVar(name);
  }

  private static BoolExpr<String> b(String name) {
    return bVar(name);
  }

  private static List<Param> ints(String... names) {
    return Arrays.stream(names).map(Param::intParam).toList();
  }

  private static List<Param> bools(String... names) {
    return Arrays.stream(names).map(Param::boolParam).toList();
  }
}
