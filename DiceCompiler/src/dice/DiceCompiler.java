package dice;

import com.google.common.collect.ImmutableList;

/**
 * Entry point to the dice notation pipeline: lexing, parsing, optimization and lowering into one of
 * the two evaluators.
 *
 * <p>Compilation is the expensive part; callers should keep the returned evaluator and invoke it
 * repeatedly rather than recompiling the same notation.
 */
public final class DiceCompiler {

  /** Parses and optimizes {@code source}, without lowering it. */
  public static Expression parse(String source) throws CompilerException {
    ImmutableList<Token> tokens = new Lexer(source).tokenize();
    return Optimizer.optimize(new Parser(tokens).parse());
  }

  public static Evaluator compileValue(String source) throws CompilerException {
    return Compiler.compile(parse(source));
  }

  public static TracedEvaluator compileTraced(String source) throws CompilerException {
    return Tracer.compile(parse(source));
  }

  private DiceCompiler() {}
}
