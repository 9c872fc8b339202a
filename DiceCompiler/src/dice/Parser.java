package dice;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

/**
 * Operator-precedence parser for dice notation.
 *
 * <p>Binary operators are resolved with a shunting-yard pass over an operand and an operator
 * stack. Dice terms are consumed whole by {@link #parseDiceTerm} before any operator is looked at,
 * so {@code 1d6+2} always reads as {@code (1d6) + 2}.
 */
public class Parser {
  private final ImmutableList<Token> tokens;
  private int index = 0;

  public Parser(ImmutableList<Token> tokens) {
    Preconditions.checkArgument(
        !tokens.isEmpty() && Iterables.getLast(tokens).type() == Token.Type.END,
        "token stream must be terminated by END");
    this.tokens = tokens;
  }

  /** Parses the whole token stream into a single expression, with explicit groups preserved. */
  public Expression parse() throws ParseException {
    Expression expression = parseExpression();

    Token token = peek();
    if (token.type() != Token.Type.END) {
      throw unexpected(token, "expected end of expression");
    }
    return expression;
  }

  private Expression parseExpression() throws ParseException {
    Deque<Expression> operands = new ArrayDeque<>();
    Deque<Token> operators = new ArrayDeque<>();

    operands.push(parsePrimary());
    while (true) {
      Token token = peek();
      Optional<BinaryOperator> op = BinaryOperator.fromToken(token);
      if (!op.isPresent()) break;
      next();

      // Everything is left-associative, so equal precedence reduces too.
      while (!operators.isEmpty()
          && operator(operators.peek()).precedence() >= op.get().precedence()) {
        reduce(operands, operators);
      }
      operators.push(token);
      operands.push(parsePrimary());
    }

    while (!operators.isEmpty()) {
      reduce(operands, operators);
    }

    Verify.verify(operands.size() == 1, "unbalanced operand stack: %s", operands);
    return operands.pop();
  }

  private static void reduce(Deque<Expression> operands, Deque<Token> operators) {
    Token token = operators.pop();
    Expression rhs = operands.pop();
    Expression lhs = operands.pop();
    operands.push(
        new Expression.Binary(operator(token), ImmutableList.of(lhs, rhs), token.offset()));
  }

  private static BinaryOperator operator(Token token) {
    return BinaryOperator.fromToken(token).get();
  }

  private Expression parsePrimary() throws ParseException {
    Token token = peek();
    switch (token.type()) {
      case LPAREN:
        {
          next();
          Expression inner = parseExpression();

          Token close = peek();
          if (close.type() != Token.Type.RPAREN) {
            throw close.type() == Token.Type.END
                ? new ParseException(
                    ParseException.Kind.UNEXPECTED_END, close.offset(), "expected ')'")
                : unexpected(close, "expected ')'");
          }
          next();
          return new Expression.Group(inner, token.offset());
        }
      case NUMBER:
        {
          next();
          if (peek().type() == Token.Type.DICE_MARKER) {
            return parseDiceTerm(token.value(), token.offset());
          }
          if (peek().type().isKeep()) {
            // "2kh3": the count is known even though the 'd' is missing.
            Token keepToken = next();
            keepAmount(keepToken, token.value());
            throw new ParseException(
                ParseException.Kind.INVALID_DICE_TERM,
                keepToken.offset(),
                "expected 'd' between dice count and keep selector");
          }
          return new Expression.Constant(token.value(), token.offset());
        }
      case DICE_MARKER:
        // A bare 'd' rolls a single die.
        return parseDiceTerm(1, token.offset());
      case END:
        throw new ParseException(
            ParseException.Kind.UNEXPECTED_END, token.offset(), "expected a number or dice term");
      default:
        throw unexpected(token, "expected a number or dice term");
    }
  }

  // [count] d sides [!] [k|kh|kl amount], with the count already consumed.
  private Expression.DiceTerm parseDiceTerm(int count, int offset) throws ParseException {
    Verify.verify(next().type() == Token.Type.DICE_MARKER);
    if (count > Expression.DiceTerm.MAX_COUNT) {
      throw new ParseException(
          ParseException.Kind.INVALID_DICE_TERM,
          offset,
          String.format(
              "cannot roll more than %d dice, got %d", Expression.DiceTerm.MAX_COUNT, count));
    }

    Token sidesToken = peek();
    if (sidesToken.type() != Token.Type.NUMBER) {
      throw new ParseException(
          ParseException.Kind.INVALID_DICE_TERM,
          sidesToken.offset(),
          "expected number of sides after 'd'");
    }
    next();

    int sides = sidesToken.value();
    if (sides < 1) {
      throw new ParseException(
          ParseException.Kind.INVALID_DICE_TERM,
          sidesToken.offset(),
          String.format("dice must have at least one side, got %d", sides));
    }

    boolean exploding = false;
    if (peek().type() == Token.Type.BANG) {
      next();
      exploding = true;
    }

    Optional<Expression.DiceTerm.Keep> keep = Optional.empty();
    if (peek().type().isKeep()) {
      Token keepToken = next();
      int amount = keepAmount(keepToken, count);
      keep =
          Optional.of(
              Expression.DiceTerm.Keep.create(
                  keepToken.type() == Token.Type.KEEP_HIGH
                      ? Expression.DiceTerm.KeepMode.HIGH
                      : Expression.DiceTerm.KeepMode.LOW,
                  amount));
    }

    return new Expression.DiceTerm(count, sides, exploding, keep, offset);
  }

  private static int keepAmount(Token keepToken, int count) throws ParseException {
    int amount = keepToken.value();
    if (amount < 1) {
      throw new ParseException(
          ParseException.Kind.INVALID_DICE_TERM,
          keepToken.offset(),
          "keep selector needs an amount of at least 1");
    } else if (amount > count) {
      throw new ParseException(
          ParseException.Kind.KEEP_EXCEEDS_COUNT,
          keepToken.offset(),
          String.format("cannot keep %d of %d dice", amount, count));
    }
    return amount;
  }

  private Token peek() {
    return tokens.get(index);
  }

  // END is never consumed, so the cursor cannot run off the stream.
  private Token next() {
    Token token = tokens.get(index);
    if (token.type() != Token.Type.END) index++;
    return token;
  }

  private static ParseException unexpected(Token token, String expectation) {
    return new ParseException(
        ParseException.Kind.UNEXPECTED_TOKEN,
        token.offset(),
        String.format("unexpected '%s': %s", token, expectation));
  }
}
