package dice;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Random;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;

public class CompilerTest {

  private static Evaluator compile(String source) throws CompilerException {
    return Compiler.compile(DiceCompiler.parse(source));
  }

  private static void assertEvaluates(String source, int value, int... draws)
      throws CompilerException {
    ScriptedRandom random = new ScriptedRandom(draws);
    assertThat(compile(source).invoke(random)).isEqualTo(value);
    random.assertExhausted();
  }

  @Test
  public void constantIgnoresRandomness() throws CompilerException {
    assertThat(compile("4").invoke(ScriptedRandom.unused())).isEqualTo(4);
    assertThat(compile("4 + 3 * 2").invoke(ScriptedRandom.unused())).isEqualTo(10);
  }

  @Test
  public void sumsDice() throws CompilerException {
    assertEvaluates("3d6", 6, 1, 2, 3);
    assertEvaluates("d20 + 5", 17, 12);
    assertEvaluates("(1d4 + 1) * 2", 8, 3);
    assertEvaluates("0d6 + 1", 1);
  }

  @Test
  public void evaluatesOperandsLeftToRight() throws CompilerException {
    assertEvaluates("1d6 - 1d4", -2, 2, 4);
    assertEvaluates("1d20 / 1d4", 3, 10, 3);
    assertEvaluates("1d6 - 1d6 - 1d6", -5, 1, 2, 4);
  }

  @Test
  public void keepsHighest() throws CompilerException {
    assertEvaluates("2d20kh1", 15, 15, 3);
    assertEvaluates("4d6kh3", 14, 1, 5, 3, 6);
    assertEvaluates("4d6k3", 14, 1, 5, 3, 6);
  }

  @Test
  public void keepsLowest() throws CompilerException {
    assertEvaluates("2d20kl1", 3, 15, 3);
    assertEvaluates("4d6kl2", 4, 1, 5, 3, 6);
    assertEvaluates("3d6kl3", 9, 2, 3, 4);
  }

  @Test
  public void explodes() throws CompilerException {
    assertEvaluates("1d6!", 14, 6, 6, 2);
    assertEvaluates("2d6!", 11, 3, 6, 2);
    assertEvaluates("1d6", 6, 6);
  }

  @Test
  public void explodingDiceAreKeptAsOneTotal() throws CompilerException {
    // The first die totals 6 + 2 = 8, which beats the 5.
    assertEvaluates("2d6!kh1", 8, 6, 2, 5);
    assertEvaluates("2d6!kl1", 5, 6, 2, 5);
  }

  @Test
  public void explosionIsCapped() throws CompilerException {
    assertThat(compile("1d1!").invoke(ScriptedRandom.maximum()))
        .isEqualTo(1 + Expression.DiceTerm.EXPLOSION_CAP);
    assertThat(compile("2d6!").invoke(ScriptedRandom.maximum()))
        .isEqualTo(2 * 6 * (1 + Expression.DiceTerm.EXPLOSION_CAP));
  }

  @Test
  public void holdsNoStateBetweenInvocations() throws CompilerException {
    Evaluator evaluator = compile("4d6kh3 + 2");
    for (int i = 0; i < 1000; i++) {
      assertThat(evaluator.invoke(new ScriptedRandom(1, 5, 3, 6))).isEqualTo(16);
    }
  }

  @Test
  public void safeToInvokeConcurrently() throws CompilerException {
    Evaluator evaluator = compile("10d6!kh5 * 2 - 3d4kl1");

    int[] sequential =
        IntStream.range(0, 2000)
            .map(seed -> evaluator.invoke(RandomSource.from(new Random(seed))))
            .toArray();
    int[] parallel =
        IntStream.range(0, 2000)
            .parallel()
            .map(seed -> evaluator.invoke(RandomSource.from(new Random(seed))))
            .toArray();

    assertThat(parallel).isEqualTo(sequential);
  }

  @Test
  public void randomDivisorOfZeroFailsAtEvaluation() throws CompilerException {
    Evaluator evaluator = compile("10 / (1d2 - 1)");

    assertThat(evaluator.invoke(new ScriptedRandom(2))).isEqualTo(10);
    assertThrows(ArithmeticException.class, () -> evaluator.invoke(new ScriptedRandom(1)));
  }
}
