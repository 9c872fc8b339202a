package dice;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.truth.Correspondence;

public class LexerTest {

  private static ImmutableList<Token> tokenize(String source) throws LexException {
    return new Lexer(source).tokenize();
  }

  @Test
  public void emptyInput() throws LexException {
    ImmutableList<Token> tokens = tokenize("   ");

    assertThat(tokens).containsExactly(Token.of(Token.Type.END, 3));
  }

  @Test
  public void diceWithModifier() throws LexException {
    ImmutableList<Token> tokens = tokenize("2d20kh1 + 5");

    assertThat(tokens)
        .containsExactly(
            Token.create(Token.Type.NUMBER, 2, 0),
            Token.of(Token.Type.DICE_MARKER, 1),
            Token.create(Token.Type.NUMBER, 20, 2),
            Token.create(Token.Type.KEEP_HIGH, 1, 4),
            Token.of(Token.Type.PLUS, 8),
            Token.create(Token.Type.NUMBER, 5, 10),
            Token.of(Token.Type.END, 11))
        .inOrder();
  }

  @Test
  public void caseInsensitive() throws LexException {
    assertTypes(
        tokenize("4D6KL3"),
        Token.Type.NUMBER,
        Token.Type.DICE_MARKER,
        Token.Type.NUMBER,
        Token.Type.KEEP_LOW,
        Token.Type.END);
    assertThat(tokenize("4D6KL3").get(3).value()).isEqualTo(3);
    assertThat(tokenize("4d6Kh2").get(3)).isEqualTo(Token.create(Token.Type.KEEP_HIGH, 2, 3));
  }

  @Test
  public void plainKeepMeansKeepHigh() throws LexException {
    assertThat(tokenize("3d6k2").get(3)).isEqualTo(Token.create(Token.Type.KEEP_HIGH, 2, 3));
  }

  @Test
  public void keepWithoutAmount() throws LexException {
    assertThat(tokenize("2d6k").get(3)).isEqualTo(Token.of(Token.Type.KEEP_HIGH, 3));
    assertThat(tokenize("2d6kl + 1").get(3)).isEqualTo(Token.of(Token.Type.KEEP_LOW, 3));
  }

  @Test
  public void operatorsAndExplosion() throws LexException {
    assertTypes(
        tokenize("(d6! - 1) * 3 / 2"),
        Token.Type.LPAREN,
        Token.Type.DICE_MARKER,
        Token.Type.NUMBER,
        Token.Type.BANG,
        Token.Type.MINUS,
        Token.Type.NUMBER,
        Token.Type.RPAREN,
        Token.Type.STAR,
        Token.Type.NUMBER,
        Token.Type.SLASH,
        Token.Type.NUMBER,
        Token.Type.END);
  }

  @Test
  public void unrecognizedCharacterError() {
    LexException ex = assertThrows(LexException.class, () -> tokenize("1d6 % 2"));

    assertThat(ex.offset()).isEqualTo(4);
    assertThat(ex.character()).isEqualTo('%');
    assertThat(ex).hasMessageThat().contains("'%'");
  }

  @Test
  public void strayLetterError() {
    LexException ex = assertThrows(LexException.class, () -> tokenize("2d6h1"));

    assertThat(ex.offset()).isEqualTo(3);
    assertThat(ex.character()).isEqualTo('h');
  }

  @Test
  public void numberOverflowError() {
    LexException ex = assertThrows(LexException.class, () -> tokenize("1 + 99999999999"));

    assertThat(ex.offset()).isEqualTo(4);
  }

  private static void assertTypes(ImmutableList<Token> tokens, Token.Type... types) {
    assertThat(tokens).comparingElementsUsing(tokenTypes()).containsExactly(types).inOrder();
  }

  private static Correspondence<Token, Token.Type> tokenTypes() {
    return Correspondence.from((t, type) -> t.type() == type, "has type");
  }
}
