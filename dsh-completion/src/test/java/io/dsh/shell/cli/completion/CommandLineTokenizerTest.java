package io.dsh.shell.cli.completion;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CommandLineTokenizerTest {

  private CommandLineTokenizer tokenizer;

  @BeforeEach
  void setUp() {
    tokenizer = new CommandLineTokenizer();
  }

  @Nested
  class Tokenize {

    @Test
    void emptyAndNullLinesHaveNoTokens() {
      assertTrue(tokenizer.tokenize("").isEmpty());
      assertTrue(tokenizer.tokenize(null).isEmpty());
      assertTrue(tokenizer.tokenize("   ").isEmpty());
    }

    @Test
    void splitsOnWhitespaceAndKeepsSpans() {
      List<Token> tokens = tokenizer.tokenize("git  commit -m");

      assertEquals(3, tokens.size());
      assertEquals(new Token("git", 0, 3), tokens.get(0));
      assertEquals(new Token("commit", 5, 11), tokens.get(1));
      assertEquals(new Token("-m", 12, 14), tokens.get(2));
    }

    @Test
    void keepsQuotedWhitespaceInsideOneToken() {
      List<Token> tokens = tokenizer.tokenize("git commit -m \"hello world\"");

      assertEquals(4, tokens.size());
      assertEquals("\"hello world\"", tokens.get(3).value());
      assertEquals(27, tokens.get(3).end());
    }

    @Test
    void unterminatedQuoteRunsToEndOfLine() {
      List<Token> tokens = tokenizer.tokenize("echo 'abc def");

      assertEquals(2, tokens.size());
      assertEquals("'abc def", tokens.get(1).value());
      assertEquals(13, tokens.get(1).end());
    }

    @Test
    void quotesInsideAWordDoNotSplitIt() {
      List<Token> tokens = tokenizer.tokenize("a\"b c\"d e");

      assertEquals(2, tokens.size());
      assertEquals("a\"b c\"d", tokens.get(0).value());
      assertEquals("e", tokens.get(1).value());
    }
  }

  @Nested
  class CursorOwnership {

    @Test
    void cursorAtTokenEndBelongsToThatToken() {
      List<Token> tokens = tokenizer.tokenize("git commit");

      assertEquals(0, tokenizer.tokenIndexAt(tokens, 3));
      assertTrue(tokenizer.isInsideToken(tokens, 0, 3));
    }

    @Test
    void cursorAfterTrailingSpaceStartsNewToken() {
      List<Token> tokens = tokenizer.tokenize("git ");

      int index = tokenizer.tokenIndexAt(tokens, 4);
      assertEquals(1, index);
      assertFalse(tokenizer.isInsideToken(tokens, index, 4));
    }

    @Test
    void cursorInWhitespaceBetweenTokens() {
      List<Token> tokens = tokenizer.tokenize("a   b");

      int index = tokenizer.tokenIndexAt(tokens, 2);
      assertEquals(1, index);
      assertFalse(tokenizer.isInsideToken(tokens, index, 2));
    }

    @Test
    void prefixAtTruncatesAtCursor() {
      Token token = new Token("commit", 4, 10);

      assertEquals("co", token.prefixAt(6));
      assertEquals("", token.prefixAt(4));
      assertEquals("commit", token.prefixAt(10));
    }
  }

  @Nested
  class Unquote {

    @Test
    void stripsMatchingQuotes() {
      assertEquals("hello world", CommandLineTokenizer.unquote("\"hello world\""));
      assertEquals("x", CommandLineTokenizer.unquote("'x'"));
    }

    @Test
    void stripsDanglingOpeningQuote() {
      assertEquals("test", CommandLineTokenizer.unquote("\"test"));
    }

    @Test
    void leavesPlainWordsAlone() {
      assertEquals("plain", CommandLineTokenizer.unquote("plain"));
      assertEquals("", CommandLineTokenizer.unquote(""));
    }
  }
}
