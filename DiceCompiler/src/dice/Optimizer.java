package dice;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Rewrites a parsed expression into its minimal equivalent: groups are dropped, constant-only
 * subtrees are folded and chains of one operator are flattened into a single n-ary node.
 *
 * <p>Any subtree containing a dice term is left unfolded, so every possible sequence of random
 * draws evaluates identically before and after optimization.
 */
public final class Optimizer {

  public static Expression optimize(Expression expression) throws DivideByZeroException {
    switch (expression.type()) {
      case CONSTANT:
      case DICE_TERM:
        return expression;
      case GROUP:
        return optimize(expression.<Expression.Group>cast().inner());
      case BINARY:
        return optimizeBinary(expression.cast());
      default:
        throw new AssertionError(expression.type());
    }
  }

  // Left-leaning chains such as "1d6 + 1 + 1 + ..." nest one level per operator, so the left spine
  // is walked with an explicit stack instead of recursion.
  private static Expression optimizeBinary(Expression.Binary binary)
      throws DivideByZeroException {
    Deque<Expression.Binary> spine = new ArrayDeque<>();
    Expression leftmost = binary;
    while (leftmost.type() == Expression.Type.BINARY) {
      Expression.Binary node = leftmost.cast();
      spine.push(node);
      leftmost = node.operands().get(0);
    }

    Expression lhs = optimize(leftmost);
    Chain chain = null;
    while (!spine.isEmpty()) {
      Expression.Binary node = spine.pop();
      if (chain == null || chain.op != node.op()) {
        if (chain != null) lhs = chain.build();
        chain = new Chain(node.op());
        chain.add(lhs, 0, node.offset());
      }
      chain.offset = node.offset();
      for (int i = 1; i < node.operands().size(); i++) {
        chain.add(optimize(node.operands().get(i)), i, node.offset());
      }
    }
    return chain.build();
  }

  // The operands of one flattened run of a single operator, collected left to right.
  private static final class Chain {
    private final BinaryOperator op;
    private final List<Expression> operands = new ArrayList<>();
    private int offset;

    Chain(BinaryOperator op) {
      this.op = op;
    }

    void add(Expression operand, int index, int offset) throws DivideByZeroException {
      // A constant zero divisor fails whether or not the dividend is random.
      if (op == BinaryOperator.DIVIDE && index > 0 && isZero(operand)) {
        throw new DivideByZeroException(offset);
      }

      if (canSplice(op, operand, index)) {
        operands.addAll(operand.<Expression.Binary>cast().operands());
      } else if (operands.size() == 1 && isConstant(operands.get(0)) && isConstant(operand)) {
        // Constant-only prefix: fold it as soon as it grows.
        int value =
            op.apply(
                operands.get(0).<Expression.Constant>cast().value(),
                operand.<Expression.Constant>cast().value());
        operands.set(0, new Expression.Constant(value, offset));
      } else {
        operands.add(operand);
      }
    }

    Expression build() {
      if (operands.size() == 1) return operands.get(0);
      return new Expression.Binary(op, operands, offset);
    }
  }

  private static boolean isConstant(Expression expression) {
    return expression.type() == Expression.Type.CONSTANT;
  }

  private static boolean isZero(Expression expression) {
    return isConstant(expression) && expression.<Expression.Constant>cast().value() == 0;
  }

  // SUBTRACT and DIVIDE only absorb their left-hand chain: a - (b - c) must stay nested.
  private static boolean canSplice(BinaryOperator op, Expression operand, int index) {
    if (operand.type() != Expression.Type.BINARY) return false;
    if (operand.<Expression.Binary>cast().op() != op) return false;

    return op.isAssociative() || index == 0;
  }

  private Optimizer() {}
}
