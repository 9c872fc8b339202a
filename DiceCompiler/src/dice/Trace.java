package dice;

import java.util.stream.Collectors;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * Record of one traced evaluation, one node per expression node evaluated. Built fresh for every
 * {@link TracedEvaluator#invoke} call.
 */
public abstract class Trace {

  public enum Type {
    CONSTANT,
    DICE,
    OPERATION;
  }

  Trace() {}

  public abstract Type type();

  /** The value the traced node evaluated to. */
  public abstract int value();

  @SuppressWarnings("unchecked")
  public <T extends Trace> T cast() {
    return (T) this;
  }

  @AutoValue
  public abstract static class ConstantTrace extends Trace {
    public static ConstantTrace create(int value) {
      return new AutoValue_Trace_ConstantTrace(value);
    }

    @Override
    public final Type type() {
      return Type.CONSTANT;
    }

    @Override
    public String toString() {
      return Integer.toString(value());
    }
  }

  /**
   * A single draw of a single die. When {@link #exploded()} is set, the draw that directly follows
   * belongs to the same die.
   */
  @AutoValue
  public abstract static class DieRoll {
    public abstract int face();

    public abstract boolean exploded();

    // Shared by every draw of the same die; false when the keep selector dropped the die.
    public abstract boolean kept();

    public static DieRoll create(int face, boolean exploded, boolean kept) {
      return new AutoValue_Trace_DieRoll(face, exploded, kept);
    }

    @Override
    public String toString() {
      return (kept() ? "" : "~") + face() + (exploded() ? "!" : "");
    }
  }

  @AutoValue
  public abstract static class DiceTrace extends Trace {
    // The dice term in canonical notation, e.g. "2d20kh1".
    public abstract String notation();

    // In roll order.
    public abstract ImmutableList<DieRoll> rolls();

    public static DiceTrace create(String notation, Iterable<DieRoll> rolls, int value) {
      return new AutoValue_Trace_DiceTrace(value, notation, ImmutableList.copyOf(rolls));
    }

    @Override
    public final Type type() {
      return Type.DICE;
    }

    @Override
    public String toString() {
      return rolls()
          .stream()
          .map(DieRoll::toString)
          .collect(Collectors.joining(", ", notation() + "[", "]"));
    }
  }

  @AutoValue
  public abstract static class OperationTrace extends Trace {
    public abstract BinaryOperator op();

    public abstract ImmutableList<Trace> operands();

    public static OperationTrace create(BinaryOperator op, Iterable<Trace> operands, int value) {
      return new AutoValue_Trace_OperationTrace(value, op, ImmutableList.copyOf(operands));
    }

    @Override
    public final Type type() {
      return Type.OPERATION;
    }

    @Override
    public String toString() {
      return operands()
          .stream()
          .map(Trace::toString)
          .collect(Collectors.joining(" " + op().repr() + " ", "(", ")"));
    }
  }
}
