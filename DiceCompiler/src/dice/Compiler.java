package dice;

import java.util.Arrays;

import com.google.common.collect.ImmutableList;

/**
 * Lowers an optimized expression into a value-only {@link Evaluator}: a tree of small function
 * objects capturing nothing but their child evaluators and literal parameters.
 *
 * <p>The resulting evaluator builds no trace and holds no mutable state, so it may be invoked
 * concurrently with independent {@link RandomSource}s. See {@link Tracer} for the instrumented
 * counterpart, which must stay in lockstep with this lowering.
 */
public final class Compiler implements ExpressionVisitor<Evaluator> {
  private static final Compiler INSTANCE = new Compiler();

  public static Evaluator compile(Expression expression) {
    return expression.accept(INSTANCE);
  }

  @Override
  public Evaluator visit(Expression.Constant node) {
    int value = node.value();
    return random -> value;
  }

  @Override
  public Evaluator visit(Expression.DiceTerm node) {
    int count = node.count();
    int sides = node.sides();
    boolean exploding = node.exploding();

    if (!node.keep().isPresent()) {
      return random -> {
        int total = 0;
        for (int i = 0; i < count; i++) {
          total += rollDie(random, sides, exploding);
        }
        return total;
      };
    }

    int amount = node.keep().get().amount();
    boolean high = node.keep().get().mode() == Expression.DiceTerm.KeepMode.HIGH;
    return random -> {
      int[] totals = new int[count];
      for (int i = 0; i < count; i++) {
        totals[i] = rollDie(random, sides, exploding);
      }
      Arrays.sort(totals);

      int total = 0;
      int from = high ? count - amount : 0;
      for (int i = from; i < from + amount; i++) {
        total += totals[i];
      }
      return total;
    };
  }

  // One die, with its explosions added in.
  private static int rollDie(RandomSource random, int sides, boolean exploding) {
    int face = random.roll(sides);
    int total = face;
    for (int explosions = 0;
        exploding && face == sides && explosions < Expression.DiceTerm.EXPLOSION_CAP;
        explosions++) {
      face = random.roll(sides);
      total += face;
    }
    return total;
  }

  @Override
  public Evaluator visit(Expression.Binary node) {
    BinaryOperator op = node.op();
    ImmutableList<Expression> operands = node.operands();
    if (operands.size() == 2) {
      Evaluator lhs = compile(operands.get(0));
      Evaluator rhs = compile(operands.get(1));
      return random -> op.apply(lhs.invoke(random), rhs.invoke(random));
    }

    Evaluator[] evaluators = operands.stream().map(Compiler::compile).toArray(Evaluator[]::new);
    return random -> {
      int value = evaluators[0].invoke(random);
      for (int i = 1; i < evaluators.length; i++) {
        value = op.apply(value, evaluators[i].invoke(random));
      }
      return value;
    };
  }

  @Override
  public Evaluator visit(Expression.Group node) {
    return compile(node.inner());
  }

  private Compiler() {}
}
