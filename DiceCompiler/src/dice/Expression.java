package dice;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

// AST for dice notation. Nodes are immutable; each node exclusively owns its children.
public abstract class Expression {

  public enum Type {
    CONSTANT,
    DICE_TERM,
    BINARY,

    // Intermediary node.
    // Doesn't exist in the optimized tree.
    GROUP;
  }

  private final Type type;
  private final int offset;

  private Expression(Type type, int offset) {
    this.type = type;
    this.offset = offset;
  }

  public Type type() {
    return type;
  }

  /** Source offset of the token this node came from; for binary operations, the operator. */
  public int offset() {
    return offset;
  }

  /** Canonical dice notation for this subtree. */
  public abstract String raw();

  public abstract <V> V accept(ExpressionVisitor<V> visitor);

  @Override
  public String toString() {
    return raw();
  }

  @SuppressWarnings("unchecked")
  public <T extends Expression> T cast() {
    return (T) this;
  }

  public static class Constant extends Expression {
    private final int value;

    public Constant(int value, int offset) {
      super(Type.CONSTANT, offset);
      this.value = value;
    }

    public int value() {
      return value;
    }

    // The notation has no unary minus, so negative values are written as a subtraction.
    @Override
    public String raw() {
      if (value >= 0) return Integer.toString(value);
      if (value == Integer.MIN_VALUE) return "(0 - " + Integer.MAX_VALUE + " - 1)";
      return "(0 - " + -value + ")";
    }

    @Override
    public <V> V accept(ExpressionVisitor<V> visitor) {
      return visitor.visit(this);
    }
  }

  public static class DiceTerm extends Expression {
    /**
     * Maximum number of additional draws a single exploding die may make. Guarantees termination
     * for dice that always explode, such as {@code d1!}; hitting the cap just stops exploding.
     */
    public static final int EXPLOSION_CAP = 100;

    /** Maximum number of dice in one term. Larger counts are rejected by the parser. */
    public static final int MAX_COUNT = 1000;

    public enum KeepMode {
      HIGH("kh"),
      LOW("kl");

      private final String repr;

      KeepMode(String repr) {
        this.repr = repr;
      }

      public String repr() {
        return repr;
      }
    }

    @AutoValue
    public abstract static class Keep {
      public abstract KeepMode mode();

      public abstract int amount();

      public static Keep create(KeepMode mode, int amount) {
        Preconditions.checkArgument(amount >= 1, "keep amount must be positive: %s", amount);
        return new AutoValue_Expression_DiceTerm_Keep(mode, amount);
      }

      @Override
      public String toString() {
        return mode().repr() + amount();
      }
    }

    private final int count;
    private final int sides;
    private final boolean exploding;
    private final Optional<Keep> keep;

    public DiceTerm(int count, int sides, boolean exploding, Optional<Keep> keep, int offset) {
      super(Type.DICE_TERM, offset);
      Preconditions.checkArgument(
          count >= 0 && count <= MAX_COUNT, "dice count out of range: %s", count);
      Preconditions.checkArgument(sides >= 1, "dice need at least one side: %s", sides);
      Preconditions.checkArgument(
          !keep.isPresent() || keep.get().amount() <= count,
          "cannot keep %s of %s dice",
          keep.map(Keep::amount).orElse(0),
          count);

      this.count = count;
      this.sides = sides;
      this.exploding = exploding;
      this.keep = keep;
    }

    public int count() {
      return count;
    }

    public int sides() {
      return sides;
    }

    public boolean exploding() {
      return exploding;
    }

    public Optional<Keep> keep() {
      return keep;
    }

    @Override
    public String raw() {
      return count + "d" + sides + (exploding ? "!" : "") + keep.map(Keep::toString).orElse("");
    }

    @Override
    public <V> V accept(ExpressionVisitor<V> visitor) {
      return visitor.visit(this);
    }
  }

  public static class Binary extends Expression {
    private final BinaryOperator op;
    private final ImmutableList<Expression> operands;

    public Binary(BinaryOperator op, Iterable<? extends Expression> operands, int offset) {
      super(Type.BINARY, offset);
      this.op = op;
      this.operands = ImmutableList.copyOf(operands);
      Preconditions.checkArgument(
          this.operands.size() >= 2, "binary operation needs two operands: %s", this.operands);
    }

    public BinaryOperator op() {
      return op;
    }

    // Evaluated left to right; the first operand is the left-hand side of every SUBTRACT/DIVIDE.
    public ImmutableList<Expression> operands() {
      return operands;
    }

    @Override
    public String raw() {
      StringBuilder sb = new StringBuilder();
      for (int i = 0; i < operands.size(); i++) {
        Expression operand = operands.get(i);
        if (i > 0) sb.append(' ').append(op.repr()).append(' ');

        if (needsParenthesis(operand, i)) {
          sb.append('(').append(operand.raw()).append(')');
        } else {
          sb.append(operand.raw());
        }
      }
      return sb.toString();
    }

    private boolean needsParenthesis(Expression operand, int index) {
      if (operand.type() != Type.BINARY) return false;

      int precedence = operand.<Binary>cast().op().precedence();
      return precedence < op.precedence() || (index > 0 && precedence == op.precedence());
    }

    @Override
    public <V> V accept(ExpressionVisitor<V> visitor) {
      return visitor.visit(this);
    }
  }

  // Explicit parenthesis, kept until the optimizer so the parse tree mirrors the source.
  public static class Group extends Expression {
    private final Expression inner;

    public Group(Expression inner, int offset) {
      super(Type.GROUP, offset);
      this.inner = Preconditions.checkNotNull(inner);
    }

    public Expression inner() {
      return inner;
    }

    @Override
    public String raw() {
      return "(" + inner.raw() + ")";
    }

    @Override
    public <V> V accept(ExpressionVisitor<V> visitor) {
      return visitor.visit(this);
    }
  }
}
