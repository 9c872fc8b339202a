package dice;

public class ParseException extends CompilerException {
  private static final long serialVersionUID = 1L;

  public enum Kind {
    UNEXPECTED_TOKEN,
    UNEXPECTED_END,
    INVALID_DICE_TERM,
    KEEP_EXCEEDS_COUNT;
  }

  private final Kind kind;

  public ParseException(Kind kind, int offset, String errorMsg) {
    super(offset, errorMsg);
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }
}
