package dice;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class TracedResult {
  public abstract int value();

  public abstract Trace trace();

  public static TracedResult create(Trace trace) {
    return new AutoValue_TracedResult(trace.value(), trace);
  }
}
