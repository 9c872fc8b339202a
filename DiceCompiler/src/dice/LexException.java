package dice;

public class LexException extends CompilerException {
  private static final long serialVersionUID = 1L;

  private final char character;

  public LexException(int offset, char character, String errorMsg) {
    super(offset, errorMsg);
    this.character = character;
  }

  public LexException(int offset, char character) {
    this(offset, character, String.format("unrecognized character '%c'", character));
  }

  public char character() {
    return character;
  }
}
