package dice;

/** A compiled dice expression producing only its final value. */
@FunctionalInterface
public interface Evaluator {
  /**
   * Evaluates the expression once, drawing every die from {@code random}.
   *
   * @throws ArithmeticException if a divisor that involves dice evaluates to zero; constant zero
   *     divisors are rejected at compile time
   */
  int invoke(RandomSource random);
}
