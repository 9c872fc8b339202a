package dice;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Ints;

/** Produces a tokenization of dice notation. */
public class Lexer {
  private static final ImmutableMap<Character, Token.Type> SINGLE_CHAR_TOKENS =
      ImmutableMap.<Character, Token.Type>builder()
          .put('d', Token.Type.DICE_MARKER)
          .put('D', Token.Type.DICE_MARKER)
          .put('!', Token.Type.BANG)
          .put('+', Token.Type.PLUS)
          .put('-', Token.Type.MINUS)
          .put('*', Token.Type.STAR)
          .put('/', Token.Type.SLASH)
          .put('(', Token.Type.LPAREN)
          .put(')', Token.Type.RPAREN)
          .build();

  private final String source;
  private int pos = -1; // In the initial state we have not read anything yet.
  private char ch = ' ';

  private final ImmutableList.Builder<Token> tokensBuilder = ImmutableList.builder();

  public Lexer(String source) {
    this.source = Preconditions.checkNotNull(source);
  }

  public ImmutableList<Token> tokenize() throws LexException {
    while (advance()) {
      if (Character.isWhitespace(ch)) continue;

      if (isDigit(ch)) {
        int start = pos;
        tokensBuilder.add(Token.create(Token.Type.NUMBER, readNumber(), start));
        continue;
      }

      if (ch == 'k' || ch == 'K') {
        tokensBuilder.add(readKeep());
        continue;
      }

      Token.Type type = SINGLE_CHAR_TOKENS.get(ch);
      if (type == null) throw new LexException(pos, ch);

      tokensBuilder.add(Token.of(type, pos));
    }

    tokensBuilder.add(Token.of(Token.Type.END, source.length()));
    return tokensBuilder.build();
  }

  // k, kh or kl, directly followed by the amount.
  private Token readKeep() throws LexException {
    int start = pos;
    Token.Type type = Token.Type.KEEP_HIGH;
    if (canPeek() && (peek() == 'h' || peek() == 'H')) {
      advance();
    } else if (canPeek() && (peek() == 'l' || peek() == 'L')) {
      advance();
      type = Token.Type.KEEP_LOW;
    }

    // A missing amount is left for the parser to reject.
    if (!canPeek() || !isDigit(peek())) return Token.of(type, start);

    advance();
    return Token.create(type, readNumber(), start);
  }

  private int readNumber() throws LexException {
    int start = pos;
    while (canPeek() && isDigit(peek())) advance();

    Integer value = Ints.tryParse(source.substring(start, pos + 1));
    if (value == null) {
      throw new LexException(start, source.charAt(start), "number does not fit in 32 bits");
    }
    return value;
  }

  private static boolean isDigit(char ch) {
    return ch >= '0' && ch <= '9';
  }

  private boolean canPeek() {
    return pos + 1 < source.length();
  }

  private char peek() {
    return source.charAt(pos + 1);
  }

  private boolean advance() {
    if (++pos >= source.length()) return false;

    ch = source.charAt(pos);
    return true;
  }
}
