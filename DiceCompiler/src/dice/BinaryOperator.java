package dice;

import java.util.Arrays;
import java.util.Optional;

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;

public enum BinaryOperator {
  ADD("+", Token.Type.PLUS, true),
  SUBTRACT("-", Token.Type.MINUS, false),
  MULTIPLY("*", Token.Type.STAR, true),
  DIVIDE("/", Token.Type.SLASH, false);

  private final String repr;
  private final Token.Type tokenType;
  private final boolean associative;

  BinaryOperator(String repr, Token.Type tokenType, boolean associative) {
    this.repr = repr;
    this.tokenType = tokenType;
    this.associative = associative;
  }

  public String repr() {
    return repr;
  }

  // Whether operands may be regrouped at any position, not only along the left chain.
  public boolean isAssociative() {
    return associative;
  }

  /**
   * Applies this operator. Division truncates toward zero and all operations wrap on overflow, so
   * constant folding and evaluation agree on every input.
   *
   * @throws ArithmeticException on division by zero
   */
  public int apply(int lhs, int rhs) {
    switch (this) {
      case ADD:
        return lhs + rhs;
      case SUBTRACT:
        return lhs - rhs;
      case MULTIPLY:
        return lhs * rhs;
      case DIVIDE:
        return lhs / rhs;
      default:
        throw new AssertionError(this);
    }
  }

  private static final ImmutableMap<Token.Type, BinaryOperator> TOKEN_MAP =
      Maps.uniqueIndex(Arrays.asList(values()), b -> b.tokenType);

  public static Optional<BinaryOperator> fromToken(Token token) {
    return Optional.ofNullable(TOKEN_MAP.get(token.type()));
  }

  // Tightest binding first.
  private static final ImmutableList<ImmutableSet<BinaryOperator>> ORDER_OF_OPERATIONS =
      ImmutableList.of(ImmutableSet.of(MULTIPLY, DIVIDE), ImmutableSet.of(ADD, SUBTRACT));

  static {
    // Ensure each operator is listed exactly once.
    Verify.verify(
        Arrays.asList(values())
            .stream()
            .allMatch(b -> ORDER_OF_OPERATIONS.stream().filter(s -> s.contains(b)).count() == 1));
  }

  /** Higher binds tighter. */
  public int precedence() {
    for (int i = 0; i < ORDER_OF_OPERATIONS.size(); i++) {
      if (ORDER_OF_OPERATIONS.get(i).contains(this)) return ORDER_OF_OPERATIONS.size() - i;
    }
    throw new AssertionError(this);
  }
}
