package dice;

import com.google.auto.value.AutoValue;

/** A single lexical unit of dice notation. */
@AutoValue
public abstract class Token {
  public enum Type {
    NUMBER,
    DICE_MARKER,
    BANG,
    KEEP_HIGH,
    KEEP_LOW,
    PLUS,
    MINUS,
    STAR,
    SLASH,
    LPAREN,
    RPAREN,
    END;

    public boolean isKeep() {
      return this == KEEP_HIGH || this == KEEP_LOW;
    }
  }

  public abstract Type type();

  // The literal for NUMBER, the amount for KEEP_HIGH / KEEP_LOW, 0 otherwise.
  public abstract int value();

  public abstract int offset();

  public static Token create(Type type, int value, int offset) {
    return new AutoValue_Token(type, value, offset);
  }

  public static Token of(Type type, int offset) {
    return create(type, 0, offset);
  }

  @Override
  public String toString() {
    switch (type()) {
      case NUMBER:
        return Integer.toString(value());
      case DICE_MARKER:
        return "d";
      case BANG:
        return "!";
      case KEEP_HIGH:
        return "kh" + value();
      case KEEP_LOW:
        return "kl" + value();
      case PLUS:
        return "+";
      case MINUS:
        return "-";
      case STAR:
        return "*";
      case SLASH:
        return "/";
      case LPAREN:
        return "(";
      case RPAREN:
        return ")";
      case END:
        return "<end>";
      default:
        throw new AssertionError(type());
    }
  }
}
