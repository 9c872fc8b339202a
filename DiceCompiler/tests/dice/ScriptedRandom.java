package dice;

import static com.google.common.truth.Truth.assertThat;

import java.util.ArrayDeque;
import java.util.Deque;

import com.google.common.primitives.Ints;

// Replays a fixed sequence of draws.
final class ScriptedRandom implements RandomSource {
  private final Deque<Integer> draws;

  ScriptedRandom(int... draws) {
    this.draws = new ArrayDeque<>(Ints.asList(draws));
  }

  @Override
  public int roll(int sides) {
    if (draws.isEmpty()) throw new AssertionError("ran out of scripted draws");

    int face = draws.pop();
    if (face < 1 || face > sides) {
      throw new AssertionError(String.format("draw %d does not fit a d%d", face, sides));
    }
    return face;
  }

  void assertExhausted() {
    assertThat(draws).isEmpty();
  }

  static RandomSource maximum() {
    return sides -> sides;
  }

  static RandomSource unused() {
    return sides -> {
      throw new AssertionError("unexpected draw");
    };
  }
}
