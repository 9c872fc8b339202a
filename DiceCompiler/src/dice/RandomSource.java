package dice;

import java.util.Random;

import com.google.common.base.Preconditions;

/**
 * The only randomness an evaluator consumes. Thread-safety is up to the implementation; evaluators
 * never share one between calls.
 */
@FunctionalInterface
public interface RandomSource {

  /** Returns a uniformly distributed integer in {@code [1, sides]}. */
  int roll(int sides);

  static RandomSource from(Random random) {
    Preconditions.checkNotNull(random);
    return sides -> random.nextInt(sides) + 1;
  }
}
