package dice;

/** Base of every error reported while compiling a dice expression. */
public class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;

  private final int offset;
  private final String errorMsg;

  public CompilerException(int offset, String errorMsg) {
    super(String.format("at %d: %s", offset, errorMsg));
    this.offset = offset;
    this.errorMsg = errorMsg;
  }

  /** The 0-based character offset in the source text where the error was found. */
  public int offset() {
    return offset;
  }

  public String errorMsg() {
    return errorMsg;
  }
}
