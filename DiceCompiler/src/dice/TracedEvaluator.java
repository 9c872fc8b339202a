package dice;

/** A compiled dice expression which records every roll decision it makes. */
@FunctionalInterface
public interface TracedEvaluator {
  /**
   * Evaluates the expression once and returns its value together with a fresh trace.
   *
   * @throws ArithmeticException if a divisor that involves dice evaluates to zero, exactly when
   *     the matching {@link Evaluator} would
   */
  TracedResult invoke(RandomSource random);
}
