package dice;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

import com.google.common.collect.ImmutableList;

/**
 * Lowers an optimized expression into a {@link TracedEvaluator}.
 *
 * <p>Mirrors {@link Compiler} node for node: operands are evaluated in the same order and dice are
 * drawn, exploded and selected by the same rules, so for identical draws both evaluators produce
 * the same value. Only callers of this lowering pay for building the {@link Trace}.
 */
public final class Tracer implements ExpressionVisitor<Tracer.Node> {
  private static final Tracer INSTANCE = new Tracer();

  /** A traced node: evaluates its subtree and returns the trace that carries the value. */
  @FunctionalInterface
  interface Node {
    Trace evaluate(RandomSource random);
  }

  public static TracedEvaluator compile(Expression expression) {
    Node root = lower(expression);
    return random -> TracedResult.create(root.evaluate(random));
  }

  private static Node lower(Expression expression) {
    return expression.accept(INSTANCE);
  }

  @Override
  public Node visit(Expression.Constant node) {
    int value = node.value();
    return random -> Trace.ConstantTrace.create(value);
  }

  @Override
  public Node visit(Expression.DiceTerm node) {
    String notation = node.raw();
    int count = node.count();
    int sides = node.sides();
    boolean exploding = node.exploding();

    int amount = node.keep().map(Expression.DiceTerm.Keep::amount).orElse(count);
    boolean high =
        node.keep().map(k -> k.mode() == Expression.DiceTerm.KeepMode.HIGH).orElse(true);

    return random -> {
      List<ImmutableList<Integer>> draws = new ArrayList<>(count);
      int[] totals = new int[count];
      for (int i = 0; i < count; i++) {
        ImmutableList<Integer> die = rollDie(random, sides, exploding);
        draws.add(die);
        totals[i] = die.stream().mapToInt(Integer::intValue).sum();
      }

      // Kept flags are only assigned once every die is rolled; ties go to the die rolled first.
      Comparator<Integer> byTotal = Comparator.comparingInt(i -> totals[i]);
      if (high) byTotal = byTotal.reversed();
      boolean[] kept = new boolean[count];
      IntStream.range(0, count)
          .boxed()
          .sorted(byTotal.thenComparing(Comparator.<Integer>naturalOrder()))
          .limit(amount)
          .forEach(i -> kept[i] = true);

      ImmutableList.Builder<Trace.DieRoll> rolls = ImmutableList.builder();
      int value = 0;
      for (int i = 0; i < count; i++) {
        ImmutableList<Integer> die = draws.get(i);
        for (int j = 0; j < die.size(); j++) {
          rolls.add(Trace.DieRoll.create(die.get(j), j < die.size() - 1, kept[i]));
        }
        if (kept[i]) value += totals[i];
      }
      return Trace.DiceTrace.create(notation, rolls.build(), value);
    };
  }

  // Every draw of one die, the base draw first and then its explosions.
  private static ImmutableList<Integer> rollDie(RandomSource random, int sides, boolean exploding) {
    ImmutableList.Builder<Integer> draws = ImmutableList.builder();
    int face = random.roll(sides);
    draws.add(face);
    for (int explosions = 0;
        exploding && face == sides && explosions < Expression.DiceTerm.EXPLOSION_CAP;
        explosions++) {
      face = random.roll(sides);
      draws.add(face);
    }
    return draws.build();
  }

  @Override
  public Node visit(Expression.Binary node) {
    BinaryOperator op = node.op();
    ImmutableList<Node> operands =
        node.operands().stream().map(Tracer::lower).collect(ImmutableList.toImmutableList());

    return random -> {
      List<Trace> traces = new ArrayList<>(operands.size());
      int value = 0;
      for (int i = 0; i < operands.size(); i++) {
        Trace trace = operands.get(i).evaluate(random);
        traces.add(trace);
        value = i == 0 ? trace.value() : op.apply(value, trace.value());
      }
      return Trace.OperationTrace.create(op, traces, value);
    };
  }

  @Override
  public Node visit(Expression.Group node) {
    return lower(node.inner());
  }

  private Tracer() {}
}
