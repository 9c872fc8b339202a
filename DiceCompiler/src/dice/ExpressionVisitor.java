package dice;

/** Lowers each node variant of an {@link Expression} tree into a {@code V}. */
public interface ExpressionVisitor<V> {
  V visit(Expression.Constant node);

  V visit(Expression.DiceTerm node);

  V visit(Expression.Binary node);

  V visit(Expression.Group node);
}
