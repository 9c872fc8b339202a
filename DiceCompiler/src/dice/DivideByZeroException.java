package dice;

/** Raised when constant folding meets a division by zero. */
public class DivideByZeroException extends CompilerException {
  private static final long serialVersionUID = 1L;

  public DivideByZeroException(int offset) {
    super(offset, "division by zero");
  }
}
