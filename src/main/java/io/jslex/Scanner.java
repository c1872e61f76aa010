/*
 * Copyright © 2022,2023 James Crawford
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package io.jslex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.IntPredicate;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static io.jslex.TokenType.*;

/**
 * Scanner for ECMAScript source text. It reads code units from a CharacterStream
 * and produces a stream of tokens one at a time for a parser to consume.
 *
 * The Scanner always has one token of lookahead: after {@link #next()} returns,
 * the token just returned is the <em>current</em> token and the following one has
 * already been scanned as the <em>next</em> token (see {@link #peek()}). The parser
 * can also ask for a second token of lookahead via {@link #peekAhead()}.
 *
 * Literal text (identifiers, strings, numbers, template spans and regular expression
 * bodies) is collected into LiteralBuffers. The Scanner owns three buffers for cooked
 * text and three for raw template text and hands them out so that no two live tokens
 * ever share a buffer. A token's literal is only valid while the token is still one of
 * current, next or next-next.
 *
 * Some constructs cannot be decided by the Scanner alone. Whether a '/' starts a regular
 * expression or is a division operator depends on the grammar, so the parser calls
 * {@link #scanRegExpPattern(boolean)} when it knows it expects a regular expression.
 * Similarly when the parser reaches the '}' that ends a template substitution it calls
 * {@link #scanTemplateContinuation()} to carry on with the template text.
 *
 * For ambiguous constructs (such as arrow function parameters) the parser can set a
 * bookmark, scan ahead, and then rewind back to the bookmark if it guessed wrong.
 *
 * Errors do not stop the Scanner. The first error is remembered (along with where it
 * occurred) and scanning carries on, usually producing an ILLEGAL token, so that the
 * parser can decide how to report it. Later errors are ignored.
 */
public class Scanner {
  private static final Logger LOGGER = Logger.getLogger(Scanner.class.getName());

  public static final int MAX_SMI_VALUE = (1 << 30) - 1;

  private static final int END_OF_INPUT     = CharacterStream.END_OF_INPUT;
  private static final int MAX_UNICODE_CHAR = 0x10FFFF;

  private final ScannerOptions  options;
  private       CharacterStream source;

  // Buffers collecting literal strings, numbers, etc.
  private final LiteralBuffer[] literalBuffers    = { new LiteralBuffer(), new LiteralBuffer(), new LiteralBuffer() };
  private final LiteralBuffer[] rawLiteralBuffers = { new LiteralBuffer(), new LiteralBuffer(), new LiteralBuffer() };

  // Values parsed from magic comments
  private final LiteralBuffer sourceUrl        = new LiteralBuffer();
  private final LiteralBuffer sourceMappingUrl = new LiteralBuffer();
  private final LiteralBuffer commentName      = new LiteralBuffer();

  private final TokenDesc current  = new TokenDesc();     // Token last returned by next()
  private final TokenDesc next     = new TokenDesc();     // One token lookahead
  private final TokenDesc nextNext = new TokenDesc();     // Second token of lookahead (after peekAhead())
  private       TokenDesc scanTarget = next;              // Where scan() puts the token it scans

  private final LiteralScope literalScope = new LiteralScope();

  // One code point of lookahead (possibly made up of two code units). END_OF_INPUT at end.
  private int c0;

  private boolean  foundHtmlComment          = false;
  private Location octalPos                  = Location.INVALID;
  private Location decimalWithLeadingZeroPos = Location.INVALID;

  private MessageTemplate scannerError         = null;
  private Location        scannerErrorLocation = Location.INVALID;

  private enum BookmarkState { NOT_SET, SET, APPLIED }

  private BookmarkState bookmarkState = BookmarkState.NOT_SET;
  private Bookmark      bookmark      = null;

  /**
   * Create a Scanner with default options
   */
  public Scanner() {
    this(ScannerOptions.create().build());
  }

  public Scanner(ScannerOptions options) {
    this.options = options;
  }

  /**
   * Attach the Scanner to its source and scan the first token (which becomes the next token).
   * Leading white space is treated as though it comes after a line terminator so that an
   * HTML comment end ('-->') at the very start is skipped.
   * @param source  the source to scan
   */
  public void initialize(CharacterStream source) {
    if (this.source != null) {
      throw new IllegalStateException("Internal error: Scanner already initialized");
    }
    this.source = source;
    advance();
    current.clear();
    next.clear();
    nextNext.clear();
    next.afterLineTerminator = true;
    scan();
  }

  /**
   * Move to the next token. The token that was the next token becomes the current token
   * and a new next token is scanned (unless one has already been scanned by peekAhead()).
   * @return the type of the new current token
   */
  public TokenType next() {
    checkInitialized();
    current.copyFrom(next);
    if (nextNext.isValid()) {
      next.copyFrom(nextNext);
      nextNext.clear();
    }
    else {
      next.afterLineTerminator   = false;
      next.afterMultilineComment = false;
      scan();
    }
    return current.type;
  }

  /**
   * @return the type of the next token without advancing
   */
  public TokenType peek() {
    return next.type;
  }

  /**
   * Return the type of the token after the next one. The token is scanned the first
   * time and remembered for subsequent calls and for the following call to next().
   * @return the type of the token after the next one
   */
  public TokenType peekAhead() {
    checkInitialized();
    if (nextNext.isValid()) {
      return nextNext.type;
    }
    nextNext.afterLineTerminator   = false;
    nextNext.afterMultilineComment = false;
    scanTarget = nextNext;
    try {
      scan();
    }
    finally {
      scanTarget = next;
    }
    return nextNext.type;
  }

  public TokenType currentToken()  { return current.type; }
  public Location  location()      { return current.location(); }
  public Location  peekLocation()  { return next.location(); }

  public boolean         hasError()         { return scannerError != null; }
  public MessageTemplate getError()         { return scannerError; }
  public Location        getErrorLocation() { return scannerErrorLocation; }

  /**
   * Throw the first error seen so far (if there has been one)
   * @throws ScannerError if an error has been latched
   */
  public void throwIfError() {
    if (hasError()) {
      throw new ScannerError(scannerError, scannerErrorLocation);
    }
  }

  //////////////////////////////////////////////////////////////////////

  // = Literal accessors

  /**
   * @return literal for the current token or null if token has no literal
   */
  public LiteralBuffer currentLiteral()    { return current.literalChars; }
  public LiteralBuffer nextLiteral()       { return next.literalChars; }
  public LiteralBuffer currentRawLiteral() { return current.rawLiteralChars; }

  public boolean isLiteralOneByte() { return literalOf(current).isOneByte(); }
  public int     literalLength()    { return literalOf(current).length(); }

  public boolean literalContainsEscapes()     { return literalContainsEscapes(current); }
  public boolean nextLiteralContainsEscapes() { return literalContainsEscapes(next); }

  public boolean isLiteralContextualKeyword(String keyword) {
    return current.literalChars != null && current.literalChars.isContextualKeyword(keyword);
  }

  public boolean isNextContextualKeyword(String keyword) {
    return next.literalChars != null && next.literalChars.isContextualKeyword(keyword);
  }

  /**
   * Check whether current literal is exactly the given (ASCII) text
   * @param data           the text to compare with
   * @param allowEscapes   whether to match if the source used escapes to spell the literal
   * @return true if literal matches
   */
  public boolean literalMatches(String data, boolean allowEscapes) {
    LiteralBuffer literal = current.literalChars;
    return literal != null &&
           (allowEscapes || !literalContainsEscapes(current)) &&
           literal.isContextualKeyword(data);
  }

  public boolean literalMatches(String data)          { return literalMatches(data, true); }
  public boolean unescapedLiteralMatches(String data) { return literalMatches(data, false); }

  /**
   * Add current literal to the given DuplicateFinder.
   * @param finder  the finder
   * @param value   the value to associate with the literal
   * @return value if literal not seen before or value associated with first occurrence
   */
  public int findSymbol(DuplicateFinder finder, int value) {
    LiteralBuffer literal = literalOf(current);
    return finder.addSymbol(literal.backingStore(), 0, literal.byteLength(), literal.isOneByte(), value);
  }

  /**
   * @return value of current numeric token
   */
  public double doubleValue() {
    if (!current.type.isNumber()) {
      throw new IllegalStateException("Internal error: current token " + current.type + " is not a number");
    }
    if (current.type == SMI) {
      return current.smiValue;
    }
    return NumberConversions.stringToDouble(literalOf(current));
  }

  public boolean containsDot() {
    LiteralBuffer literal = literalOf(current);
    for (int i = 0; i < literal.length(); i++) {
      if (literal.charAt(i) == '.') {
        return true;
      }
    }
    return false;
  }

  /**
   * @return value of current SMI token
   */
  public int smiValue() {
    return current.smiValue;
  }

  /**
   * @return location of last legacy octal literal or octal escape or Location.INVALID if none
   */
  public Location octalPosition()      { return octalPos; }
  public void     clearOctalPosition() { octalPos = Location.INVALID; }

  public Location decimalWithLeadingZeroPosition()      { return decimalWithLeadingZeroPos; }
  public void     clearDecimalWithLeadingZeroPosition() { decimalWithLeadingZeroPos = Location.INVALID; }

  /**
   * @return true if a line terminator (not counting those inside multi-line comments) comes before the next token
   */
  public boolean hasLineTerminatorBeforeNext()   { return next.afterLineTerminator; }
  public boolean hasMultilineCommentBeforeNext() { return next.afterMultilineComment; }

  /**
   * @return true if there was a line terminator before the next token, possibly inside a multi-line comment
   */
  public boolean hasAnyLineTerminatorBeforeNext() {
    return next.afterLineTerminator || next.afterMultilineComment;
  }

  /**
   * Check for a line terminator between the next token and the one after it.
   * Scans the token after the next token if not already done.
   * @return true if there is a line terminator after the next token
   */
  public boolean hasLineTerminatorAfterNext() {
    peekAhead();
    return nextNext.afterLineTerminator || nextNext.afterMultilineComment;
  }

  public boolean foundHtmlComment() { return foundHtmlComment; }

  public LiteralBuffer sourceUrl()        { return sourceUrl; }
  public LiteralBuffer sourceMappingUrl() { return sourceMappingUrl; }

  //////////////////////////////////////////////////////////////////////

  // = Parser directed scanning

  /**
   * Skip forward to the given position and scan the token found there as the next
   * token. Used to skip over source (such as a function body) that has already been
   * scanned. The position must not be before the end of the next token.
   * @param pos  the source position to skip to
   */
  public void seekForward(int pos) {
    checkInitialized();
    if (nextNext.isValid()) {
      throw new IllegalStateException("Internal error: seekForward() invoked after peekAhead()");
    }
    int currentPos = sourcePos();
    if (pos < currentPos) {
      throw new IllegalArgumentException("Cannot seek backwards from " + currentPos + " to " + pos);
    }
    if (pos != currentPos) {
      // Lookahead code point has already been read from the stream
      int count = pos - source.pos();
      if (count < 0) {
        throw new IllegalArgumentException("Cannot seek into middle of surrogate pair at " + currentPos);
      }
      source.seekForward(count);
      advance();
    }
    // Don't care about line terminators in the part we skipped
    next.afterLineTerminator   = false;
    next.afterMultilineComment = false;
    scan();
  }

  /**
   * Scan a regular expression body. Must only be invoked when the next token is the
   * '/' (or '/=') that starts the regular expression. On success the next token becomes
   * a REGEXP_LITERAL whose literal is the body of the regular expression.
   * @param seenEqual  true if next token was '/=' (in which case '=' is part of the body)
   * @return true if a regular expression body was scanned
   */
  public boolean scanRegExpPattern(boolean seenEqual) {
    checkInitialized();
    if (!next.type.is(DIV, ASSIGN_DIV) || nextNext.isValid()) {
      throw new IllegalStateException("Internal error: scanRegExpPattern() requires '/' as next token but found " + next.type);
    }
    boolean inCharacterClass = false;
    next.rawLiteralChars = null;
    try (LiteralScope literal = startLiteral()) {
      if (seenEqual) {
        addLiteralChar('=');
      }
      while (c0 != '/' || inCharacterClass) {
        if (c0 == END_OF_INPUT || CharPredicates.isLineTerminator(c0)) {
          return unterminatedRegExp();
        }
        if (c0 == '\\') {
          addLiteralCharAdvance();
          if (c0 == END_OF_INPUT || CharPredicates.isLineTerminator(c0)) {
            return unterminatedRegExp();
          }
          addLiteralCharAdvance();
        }
        else {
          if (c0 == '[') { inCharacterClass = true; }
          if (c0 == ']') { inCharacterClass = false; }
          addLiteralCharAdvance();
        }
      }
      advance();    // Consume '/'
      literal.complete();
    }
    next.type   = REGEXP_LITERAL;
    next.endPos = sourcePos();
    return true;
  }

  /**
   * Scan the flags that follow a regular expression body. The next token (the
   * REGEXP_LITERAL) is extended to include the flags.
   * @return the flags or empty if there was an invalid or repeated flag
   */
  public Optional<Set<RegExpFlag>> scanRegExpFlags() {
    checkInitialized();
    if (next.type != REGEXP_LITERAL) {
      throw new IllegalStateException("Internal error: scanRegExpFlags() requires regular expression as next token but found " + next.type);
    }
    Set<RegExpFlag> flags = EnumSet.noneOf(RegExpFlag.class);
    while (c0 != END_OF_INPUT && CharPredicates.isIdentifierPart(c0)) {
      RegExpFlag flag = RegExpFlag.fromChar(c0);
      if (flag == null || flags.contains(flag)) {
        int pos = sourcePos();
        reportScannerError(new Location(pos, pos + 1), MessageTemplate.MALFORMED_REG_EXP_FLAGS);
        return Optional.empty();
      }
      flags.add(flag);
      advance();
    }
    next.endPos = sourcePos();
    return Optional.of(flags);
  }

  /**
   * Continue scanning a template literal after the '}' that ends a substitution.
   * Must only be invoked when the next token is that '}'. The next token becomes
   * the TEMPLATE_SPAN or TEMPLATE_TAIL that follows.
   * @return the type of the new next token
   */
  public TokenType scanTemplateContinuation() {
    checkInitialized();
    if (next.type != RBRACE || nextNext.isValid()) {
      throw new IllegalStateException("Internal error: scanTemplateContinuation() requires '}' as next token but found " + next.type);
    }
    next.literalChars    = null;
    next.rawLiteralChars = null;
    next.type   = scanTemplateSpan();
    next.endPos = sourcePos();
    return next.type;
  }

  //////////////////////////////////////////////////////////////////////

  // = Bookmarks

  /**
   * Remember the current state so that we can come back to it later.
   * Only one bookmark can exist at a time.
   * @return false if bookmark could not be set
   */
  public boolean setBookmark() {
    checkInitialized();
    if (bookmarkState != BookmarkState.NOT_SET || nextNext.isValid() || !source.setBookmark()) {
      return false;
    }
    bookmark = new Bookmark();
    bookmark.save();
    bookmarkState = BookmarkState.SET;
    if (LOGGER.isLoggable(Level.FINER)) {
      LOGGER.finer("Bookmark set at " + bookmark.next.begPos);
    }
    return true;
  }

  /**
   * Restore the state saved by {@link #setBookmark()}. The current and next tokens,
   * their literals, the line terminator flags and the error status are all put back
   * to what they were when the bookmark was set.
   */
  public void resetToBookmark() {
    if (bookmarkState != BookmarkState.SET) {
      throw new IllegalStateException("Internal error: resetToBookmark() invoked when bookmark is " + bookmarkState);
    }
    source.resetToBookmark();
    bookmark.restore();
    bookmark      = null;
    bookmarkState = BookmarkState.APPLIED;
    if (LOGGER.isLoggable(Level.FINER)) {
      LOGGER.finer("Reset to bookmark at " + next.begPos);
    }
  }

  public boolean bookmarkHasBeenSet()   { return bookmarkState == BookmarkState.SET; }
  public boolean bookmarkHasBeenReset() { return bookmarkState == BookmarkState.APPLIED; }

  public void dropBookmark() {
    if (bookmarkState != BookmarkState.NOT_SET && LOGGER.isLoggable(Level.FINER)) {
      LOGGER.finer("Bookmark dropped (was " + bookmarkState + ")");
    }
    bookmark      = null;
    bookmarkState = BookmarkState.NOT_SET;
  }

  /**
   * Bookmark that is dropped automatically at the end of a try-with-resources block:
   * <pre>
   *   try (Scanner.BookmarkScope bookmark = new Scanner.BookmarkScope(scanner)) {
   *     if (bookmark.set()) {
   *       ...
   *       bookmark.reset();
   *     }
   *   }
   * </pre>
   */
  public static class BookmarkScope implements AutoCloseable {
    private final Scanner scanner;

    public BookmarkScope(Scanner scanner) {
      this.scanner = scanner;
    }

    public boolean set()          { return scanner.setBookmark(); }
    public void    reset()        { scanner.resetToBookmark(); }
    public boolean hasBeenSet()   { return scanner.bookmarkHasBeenSet(); }
    public boolean hasBeenReset() { return scanner.bookmarkHasBeenReset(); }

    @Override
    public void close() {
      scanner.dropBookmark();
    }
  }

  /**
   * Saved state for a bookmark. Literals of the current and next tokens are copied
   * since the buffers they live in will be reused as scanning continues.
   */
  private class Bookmark {
    int                   savedC0;
    final TokenDesc       current           = new TokenDesc();
    final TokenDesc       next              = new TokenDesc();
    final LiteralBuffer   currentLiteral    = new LiteralBuffer();
    final LiteralBuffer   currentRawLiteral = new LiteralBuffer();
    final LiteralBuffer   nextLiteral       = new LiteralBuffer();
    final LiteralBuffer   nextRawLiteral    = new LiteralBuffer();
    boolean               foundHtmlComment;
    Location              octalPos;
    Location              decimalWithLeadingZeroPos;
    MessageTemplate       error;
    Location              errorLocation;

    void save() {
      savedC0 = c0;
      saveToken(current, Scanner.this.current, currentLiteral, currentRawLiteral);
      saveToken(next, Scanner.this.next, nextLiteral, nextRawLiteral);
      foundHtmlComment          = Scanner.this.foundHtmlComment;
      octalPos                  = Scanner.this.octalPos;
      decimalWithLeadingZeroPos = Scanner.this.decimalWithLeadingZeroPos;
      error                     = scannerError;
      errorLocation             = scannerErrorLocation;
    }

    void restore() {
      c0 = savedC0;
      nextNext.clear();
      scanTarget = Scanner.this.next;
      // Current gets buffers 0 and next gets buffers 1 so they can never alias each other
      restoreToken(Scanner.this.current, current, currentLiteral, currentRawLiteral, 0);
      restoreToken(Scanner.this.next, next, nextLiteral, nextRawLiteral, 1);
      Scanner.this.foundHtmlComment          = foundHtmlComment;
      Scanner.this.octalPos                  = octalPos;
      Scanner.this.decimalWithLeadingZeroPos = decimalWithLeadingZeroPos;
      scannerError                           = error;
      scannerErrorLocation                   = errorLocation;
    }

    private void saveToken(TokenDesc to, TokenDesc from, LiteralBuffer literal, LiteralBuffer rawLiteral) {
      to.copyFrom(from);
      if (from.literalChars != null) {
        literal.copyFrom(from.literalChars);
        to.literalChars = literal;
      }
      if (from.rawLiteralChars != null) {
        rawLiteral.copyFrom(from.rawLiteralChars);
        to.rawLiteralChars = rawLiteral;
      }
    }

    private void restoreToken(TokenDesc to, TokenDesc from, LiteralBuffer literal, LiteralBuffer rawLiteral, int bufferIndex) {
      to.copyFrom(from);
      if (from.literalChars != null) {
        literalBuffers[bufferIndex].copyFrom(literal);
        to.literalChars = literalBuffers[bufferIndex];
      }
      if (from.rawLiteralChars != null) {
        rawLiteralBuffers[bufferIndex].copyFrom(rawLiteral);
        to.rawLiteralChars = rawLiteralBuffers[bufferIndex];
      }
    }
  }

  //////////////////////////////////////////////////////////////////////

  // = Scanning

  /**
   * Scan a single token into scanTarget, skipping white space and comments
   */
  private void scan() {
    TokenDesc desc = scanTarget;
    desc.literalChars    = null;
    desc.rawLiteralChars = null;
    desc.smiValue        = 0;

    TokenType token;
    do {
      desc.begPos = sourcePos();

      if (c0 >= 0 && c0 < ONE_CHAR_TOKENS.length && ONE_CHAR_TOKENS[c0] != null) {
        token = select(ONE_CHAR_TOKENS[c0]);
        break;
      }

      switch (c0) {
        case ' ':
        case '\t':
          advance();
          token = WHITESPACE;
          break;

        case '\n':
          advance();
          desc.afterLineTerminator = true;
          token = WHITESPACE;
          break;

        case '"':
        case '\'':
          token = scanString();
          break;

        case '<':
          // < <= << <<= <!--
          advance();
          if (c0 == '=') {
            token = select(LTE);
          }
          else
          if (c0 == '<') {
            token = select('=', ASSIGN_SHL, SHL);
          }
          else
          if (c0 == '!' && options.allowHtmlComments()) {
            token = scanHtmlComment();
          }
          else {
            token = LT;
          }
          break;

        case '>':
          // > >= >> >>= >>> >>>=
          advance();
          if (c0 == '=') {
            token = select(GTE);
          }
          else
          if (c0 == '>') {
            advance();
            if (c0 == '=') {
              token = select(ASSIGN_SAR);
            }
            else
            if (c0 == '>') {
              token = select('=', ASSIGN_SHR, SHR);
            }
            else {
              token = SAR;
            }
          }
          else {
            token = GT;
          }
          break;

        case '=':
          // = == === =>
          advance();
          if (c0 == '=') {
            token = select('=', EQ_STRICT, EQ);
          }
          else
          if (c0 == '>') {
            token = select(ARROW);
          }
          else {
            token = ASSIGN;
          }
          break;

        case '!':
          // ! != !==
          advance();
          token = c0 == '=' ? select('=', NE_STRICT, NE) : NOT;
          break;

        case '+':
          // + ++ +=
          advance();
          token = c0 == '+' ? select(INC) :
                  c0 == '=' ? select(ASSIGN_ADD) :
                              ADD;
          break;

        case '-':
          // - -- --> -=
          advance();
          if (c0 == '-') {
            advance();
            if (c0 == '>' && options.allowHtmlComments() && (desc.afterLineTerminator || desc.afterMultilineComment)) {
              // Line that starts with '-->' is treated as a comment
              advance();
              foundHtmlComment = true;
              token = skipSingleLineComment();
            }
            else {
              token = DEC;
            }
          }
          else {
            token = c0 == '=' ? select(ASSIGN_SUB) : SUB;
          }
          break;

        case '*':
          // * *= ** **=
          advance();
          if (c0 == '*' && options.allowHarmonyExponentiationOperator()) {
            token = select('=', ASSIGN_EXP, EXP);
          }
          else {
            token = c0 == '=' ? select(ASSIGN_MUL) : MUL;
          }
          break;

        case '%':
          token = select('=', ASSIGN_MOD, MOD);
          break;

        case '/':
          // /  // /* /=
          advance();
          if (c0 == '/') {
            advance();
            if (c0 == '#' || c0 == '@') {
              advance();
              token = skipSourceUrlComment();
            }
            else {
              token = skipSingleLineComment();
            }
          }
          else
          if (c0 == '*') {
            token = skipMultiLineComment();
          }
          else {
            token = c0 == '=' ? select(ASSIGN_DIV) : DIV;
          }
          break;

        case '&':
          // & && &=
          advance();
          token = c0 == '&' ? select(AND) :
                  c0 == '=' ? select(ASSIGN_BIT_AND) :
                              BIT_AND;
          break;

        case '|':
          // | || |=
          advance();
          token = c0 == '|' ? select(OR) :
                  c0 == '=' ? select(ASSIGN_BIT_OR) :
                              BIT_OR;
          break;

        case '^':
          token = select('=', ASSIGN_BIT_XOR, BIT_XOR);
          break;

        case '.':
          // . ... Number
          advance();
          if (CharPredicates.isDecimalDigit(c0)) {
            token = scanNumber(true);
          }
          else {
            token = PERIOD;
            if (c0 == '.') {
              advance();
              if (c0 == '.') {
                token = select(ELLIPSIS);
              }
              else {
                pushBack('.');
              }
            }
          }
          break;

        case '`':
          token = scanTemplateStart();
          break;

        default:
          if (c0 == END_OF_INPUT) {
            token = EOS;
          }
          else
          if (CharPredicates.isIdentifierStart(c0) || c0 == '\\') {
            token = scanIdentifierOrKeyword();
          }
          else
          if (CharPredicates.isDecimalDigit(c0)) {
            token = scanNumber(false);
          }
          else
          if (skipWhiteSpace()) {
            token = WHITESPACE;
          }
          else {
            advance();
            reportScannerError(new Location(desc.begPos, sourcePos()), MessageTemplate.INVALID_OR_UNEXPECTED_TOKEN);
            token = ILLEGAL;
          }
          break;
      }
      // Keep going while we are only skipping white space and comments
    } while (token == WHITESPACE);

    // End of input occupies the position after the last code unit
    desc.endPos = token == EOS ? desc.begPos + 1 : sourcePos();
    desc.type   = token;
  }

  private boolean skipWhiteSpace() {
    int startPosition = sourcePos();
    while (true) {
      while (c0 != END_OF_INPUT) {
        if (CharPredicates.isLineTerminator(c0)) {
          scanTarget.afterLineTerminator = true;
        }
        else
        if (!CharPredicates.isWhiteSpace(c0)) {
          break;
        }
        advance();
      }

      // An HTML comment end '-->' at the start of a line (with only white space in
      // front of it) makes the rest of the line a comment
      if (c0 != '-' || !scanTarget.afterLineTerminator || !options.allowHtmlComments()) {
        break;
      }
      advance();
      if (c0 != '-') {
        pushBack('-');
        break;
      }
      advance();
      if (c0 != '>') {
        pushBack('-');
        pushBack('-');
        break;
      }
      advance();
      foundHtmlComment = true;
      skipSingleLineComment();
    }
    return sourcePos() != startPosition;
  }

  /**
   * Skip to end of line. The line terminator itself is not part of the comment.
   */
  private TokenType skipSingleLineComment() {
    while (c0 != END_OF_INPUT && !CharPredicates.isLineTerminator(c0)) {
      advance(false, false);
    }
    return WHITESPACE;
  }

  private TokenType skipSourceUrlComment() {
    tryToParseSourceUrlComment();
    return skipSingleLineComment();
  }

  /**
   * Magic comments are of the form: //[#@]\s&lt;name&gt;=\s*&lt;value&gt;\s*
   * where name is sourceURL or sourceMappingURL. We have already seen the '//#' or '//@'.
   */
  private void tryToParseSourceUrlComment() {
    if (!CharPredicates.isWhiteSpace(c0)) {
      return;
    }
    advance();
    commentName.reset();
    while (c0 != END_OF_INPUT && !CharPredicates.isWhiteSpaceOrLineTerminator(c0) && c0 != '=') {
      commentName.addChar(c0);
      advance();
    }
    LiteralBuffer value;
    if (commentName.isContextualKeyword("sourceURL")) {
      value = sourceUrl;
    }
    else
    if (commentName.isContextualKeyword("sourceMappingURL")) {
      value = sourceMappingUrl;
    }
    else {
      return;
    }
    if (c0 != '=') {
      return;
    }
    advance();
    value.reset();
    while (c0 != END_OF_INPUT && CharPredicates.isWhiteSpace(c0)) {
      advance();
    }
    while (c0 != END_OF_INPUT && !CharPredicates.isLineTerminator(c0)) {
      // Quotes are not allowed in the value
      if (c0 == '"' || c0 == '\'') {
        value.reset();
        return;
      }
      if (CharPredicates.isWhiteSpace(c0)) {
        break;
      }
      value.addChar(c0);
      advance();
    }
    // Only white space allowed after the value
    while (c0 != END_OF_INPUT && !CharPredicates.isLineTerminator(c0)) {
      if (!CharPredicates.isWhiteSpace(c0)) {
        value.reset();
        break;
      }
      advance();
    }
  }

  /**
   * Skip a multi-line comment. A comment that contains a line terminator counts as a
   * line terminator for the purposes of automatic semicolon insertion.
   */
  private TokenType skipMultiLineComment() {
    int start = sourcePos() - 1;   // Position of '/'
    advance();                     // Skip '*'
    while (c0 != END_OF_INPUT) {
      int ch = c0;
      advance(false, false);
      if (CharPredicates.isLineTerminator(ch)) {
        scanTarget.afterMultilineComment = true;
      }
      if (ch == '*' && c0 == '/') {
        advance();
        return WHITESPACE;
      }
    }
    reportScannerError(new Location(start, sourcePos()), MessageTemplate.UNTERMINATED_COMMENT);
    return ILLEGAL;
  }

  /**
   * Check for '&lt;!--' comment. We have already seen the '&lt;' and c0 is '!'.
   */
  private TokenType scanHtmlComment() {
    advance();
    if (c0 != '-') {
      pushBack('!');
      return LT;
    }
    advance();
    if (c0 != '-') {
      pushBack('-');
      pushBack('!');
      return LT;
    }
    advance();
    foundHtmlComment = true;
    return skipSingleLineComment();
  }

  private TokenType scanString() {
    int quote = c0;
    advance();    // Consume quote
    try (LiteralScope literal = startLiteral()) {
      while (true) {
        if (c0 == quote) {
          literal.complete();
          advance();
          return STRING;
        }
        if (c0 == END_OF_INPUT || CharPredicates.isLineTerminator(c0)) {
          reportScannerError(new Location(scanTarget.begPos, sourcePos()), MessageTemplate.UNTERMINATED_STRING);
          return ILLEGAL;
        }
        if (c0 == '\\') {
          advance();
          if (c0 == END_OF_INPUT) {
            reportScannerError(new Location(scanTarget.begPos, sourcePos()), MessageTemplate.UNTERMINATED_STRING);
            return ILLEGAL;
          }
          if (!scanEscape(false, false)) {
            return ILLEGAL;
          }
        }
        else {
          addLiteralCharAdvance();
        }
      }
    }
  }

  /**
   * Scan an escape sequence and add the character it denotes to the literal.
   * The '\' has already been consumed.
   * @param captureRaw  true if characters consumed should also go to the raw literal
   * @param inTemplate  true if scanning a template literal
   * @return false if escape sequence is invalid (error will have been reported)
   */
  private boolean scanEscape(boolean captureRaw, boolean inTemplate) {
    int c           = c0;
    int escapeStart = sourcePos() - 1;    // Position of '\'
    advance(captureRaw, true);

    // Skip escaped newlines (line continuations)
    if (!inTemplate && CharPredicates.isLineTerminator(c)) {
      // Allow CR+LF newlines in multiline string literals
      if (c == '\r' && c0 == '\n') {
        advance(captureRaw, true);
      }
      return true;
    }

    switch (c) {
      case '\'':
      case '"':
      case '\\':
        break;
      case 'b': c = '\b'; break;
      case 'f': c = '\f'; break;
      case 'n': c = '\n'; break;
      case 'r': c = '\r'; break;
      case 't': c = '\t'; break;
      case 'v': c = 0x0B; break;
      case 'u': {
        c = scanUnicodeEscape(captureRaw, escapeStart);
        if (c < 0) {
          return false;
        }
        break;
      }
      case 'x': {
        c = scanHexNumber(captureRaw, 2, escapeStart, false);
        if (c < 0) {
          return false;
        }
        break;
      }
      case '0': case '1': case '2': case '3':
      case '4': case '5': case '6': case '7':
        if (inTemplate) {
          // Only '\0' not followed by a digit is allowed in a template
          if (c != '0' || CharPredicates.isDecimalDigit(c0)) {
            reportScannerError(new Location(escapeStart, sourcePos()), MessageTemplate.TEMPLATE_OCTAL_LITERAL);
            return false;
          }
          c = 0;
          break;
        }
        c = scanOctalEscape(captureRaw, c, 2, escapeStart);
        break;
      case '8':
      case '9':
        if (inTemplate) {
          reportScannerError(new Location(escapeStart, sourcePos()), MessageTemplate.TEMPLATE_OCTAL_LITERAL);
          return false;
        }
        break;
    }

    // Any other escaped character stands for itself
    addLiteralChar(c);
    return true;
  }

  /**
   * Legacy octal escape. Also accepts '\0'. Position of any escape other than '\0' is
   * remembered so that it can be reported later if code turns out to be strict.
   */
  private int scanOctalEscape(boolean captureRaw, int c, int length, int escapeStart) {
    int x = c - '0';
    int i = 0;
    for (; i < length; i++) {
      int d = c0 - '0';
      if (d < 0 || d > 7) {
        break;
      }
      int nx = x * 8 + d;
      if (nx >= 256) {
        break;
      }
      x = nx;
      advance(captureRaw, true);
    }
    if (c != '0' || i > 0) {
      octalPos = new Location(escapeStart, sourcePos());
    }
    return x;
  }

  /**
   * Accepts both \\uXXXX and \\u{X...}. The '\' and 'u' have already been consumed.
   * @return the code point or -1 if invalid
   */
  private int scanUnicodeEscape(boolean captureRaw, int escapeStart) {
    if (c0 == '{') {
      advance(captureRaw, true);
      int cp = scanUnlimitedLengthHexNumber(captureRaw, MAX_UNICODE_CHAR, escapeStart);
      if (cp < 0 || c0 != '}') {
        int pos = sourcePos();
        reportScannerError(new Location(pos, pos + 1), MessageTemplate.INVALID_UNICODE_ESCAPE_SEQUENCE);
        return -1;
      }
      advance(captureRaw, true);
      return cp;
    }
    return scanHexNumber(captureRaw, 4, escapeStart, true);
  }

  private int scanHexNumber(boolean captureRaw, int expectedLength, int escapeStart, boolean unicode) {
    int x = 0;
    for (int i = 0; i < expectedLength; i++) {
      int d = CharPredicates.hexValue(c0);
      if (d < 0) {
        reportScannerError(new Location(escapeStart, escapeStart + expectedLength + 2),
                           unicode ? MessageTemplate.INVALID_UNICODE_ESCAPE_SEQUENCE
                                   : MessageTemplate.INVALID_HEX_ESCAPE_SEQUENCE);
        return -1;
      }
      x = x * 16 + d;
      advance(captureRaw, true);
    }
    return x;
  }

  /**
   * Scan any number of hex digits as long as value does not exceed maxValue.
   * Leading zeros mean that the number of digits is not bounded.
   */
  private int scanUnlimitedLengthHexNumber(boolean captureRaw, int maxValue, int escapeStart) {
    int d = CharPredicates.hexValue(c0);
    if (d < 0) {
      return -1;
    }
    int x = 0;
    while (d >= 0) {
      x = x * 16 + d;
      if (x > maxValue) {
        reportScannerError(new Location(escapeStart, sourcePos() + 1), MessageTemplate.UNDEFINED_UNICODE_CODE_POINT);
        return -1;
      }
      advance(captureRaw, true);
      d = CharPredicates.hexValue(c0);
    }
    return x;
  }

  private TokenType scanTemplateStart() {
    advance();    // Consume '`'
    return scanTemplateSpan();
  }

  /**
   * Scan template characters up to and including the '${' that starts a substitution
   * (giving TEMPLATE_SPAN) or the closing '`' (giving TEMPLATE_TAIL). The cooked text
   * goes to the literal and the source text as written goes to the raw literal.
   * In both of them CR and CRLF are turned into LF.
   */
  private TokenType scanTemplateSpan() {
    TokenType result = TEMPLATE_SPAN;
    try (LiteralScope literal = startLiteral()) {
      startRawLiteral();
      while (true) {
        int c = c0;
        if (c == END_OF_INPUT) {
          return unterminatedTemplate();
        }
        advance(true, true);
        if (c == '`') {
          reduceRawLiteralLength(1);
          result = TEMPLATE_TAIL;
          break;
        }
        if (c == '$' && c0 == '{') {
          advance();      // Consume '{'
          reduceRawLiteralLength(1);
          break;
        }
        if (c == '\\') {
          if (c0 == END_OF_INPUT) {
            return unterminatedTemplate();
          }
          if (CharPredicates.isLineTerminator(c0)) {
            // Line continuation contributes nothing to the cooked value
            int lastChar = c0;
            advance(true, true);
            if (lastChar == '\r') {
              normaliseCarriageReturn();
            }
          }
          else
          if (!scanEscape(true, true)) {
            return ILLEGAL;
          }
          continue;
        }
        if (c == '\r') {
          normaliseCarriageReturn();
          c = '\n';
        }
        addLiteralChar(c);
      }
      literal.complete();
    }
    return result;
  }

  /**
   * Replace the CR just added to the raw literal (and any following LF) with a single LF
   */
  private void normaliseCarriageReturn() {
    reduceRawLiteralLength(1);
    if (c0 == '\n') {
      advance(true, true);
    }
    else {
      addRawLiteralChar('\n');
    }
  }

  private TokenType unterminatedTemplate() {
    reportScannerError(new Location(scanTarget.begPos, sourcePos()), MessageTemplate.UNTERMINATED_TEMPLATE);
    return ILLEGAL;
  }

  private boolean unterminatedRegExp() {
    reportScannerError(new Location(next.begPos, sourcePos()), MessageTemplate.UNTERMINATED_REG_EXP);
    next.type   = ILLEGAL;
    next.endPos = sourcePos();
    return false;
  }

  private enum NumberKind { DECIMAL, DECIMAL_WITH_LEADING_ZERO, HEX, OCTAL, IMPLICIT_OCTAL, BINARY }

  /**
   * Scan a numeric literal. Decimal integers that fit in an SMI are returned as SMI
   * tokens with the value already computed.
   * @param seenPeriod  true if we have already consumed a '.' that starts the number
   */
  private TokenType scanNumber(boolean seenPeriod) {
    NumberKind kind     = NumberKind.DECIMAL;
    boolean    atStart  = !seenPeriod;
    int        startPos = seenPeriod ? sourcePos() - 1 : sourcePos();

    try (LiteralScope literal = startLiteral()) {
      if (seenPeriod) {
        // We know there is at least one digit
        addLiteralChar('.');
        scanDecimalDigits();
      }
      else {
        // If first digit is '0' we need to check for hex, octal and binary
        if (c0 == '0') {
          addLiteralCharAdvance();
          if (c0 == 'x' || c0 == 'X') {
            kind = NumberKind.HEX;
            if (!scanPrefixedDigits(CharPredicates::isHexDigit)) {
              return malformedNumber(startPos);
            }
          }
          else
          if (c0 == 'o' || c0 == 'O') {
            kind = NumberKind.OCTAL;
            if (!scanPrefixedDigits(CharPredicates::isOctalDigit)) {
              return malformedNumber(startPos);
            }
          }
          else
          if (c0 == 'b' || c0 == 'B') {
            kind = NumberKind.BINARY;
            if (!scanPrefixedDigits(CharPredicates::isBinaryDigit)) {
              return malformedNumber(startPos);
            }
          }
          else
          if (CharPredicates.isOctalDigit(c0)) {
            // Legacy octal unless we find an 8 or 9
            kind = NumberKind.IMPLICIT_OCTAL;
            while (true) {
              if (c0 == '8' || c0 == '9') {
                atStart = false;
                kind    = NumberKind.DECIMAL_WITH_LEADING_ZERO;
                break;
              }
              if (!CharPredicates.isOctalDigit(c0)) {
                octalPos = new Location(startPos, sourcePos());
                break;
              }
              addLiteralCharAdvance();
            }
          }
          else
          if (c0 == '8' || c0 == '9') {
            kind = NumberKind.DECIMAL_WITH_LEADING_ZERO;
          }
        }

        if (kind == NumberKind.DECIMAL || kind == NumberKind.DECIMAL_WITH_LEADING_ZERO) {
          if (atStart) {
            long value = 0;
            while (CharPredicates.isDecimalDigit(c0)) {
              value = 10 * value + (c0 - '0');
              addLiteralCharAdvance();
            }
            // Length check must come first since value may have overflowed
            if (scanTarget.literalChars.length() <= 10 && value <= MAX_SMI_VALUE &&
                c0 != '.' && c0 != 'e' && c0 != 'E' && !CharPredicates.isIdentifierStart(c0)) {
              scanTarget.smiValue = (int) value;
              literal.complete();
              if (kind == NumberKind.DECIMAL_WITH_LEADING_ZERO) {
                decimalWithLeadingZeroPos = new Location(startPos, sourcePos());
              }
              return SMI;
            }
          }
          scanDecimalDigits();
          if (c0 == '.') {
            addLiteralCharAdvance();
            scanDecimalDigits();
          }
        }
      }

      // Optional exponent
      if (c0 == 'e' || c0 == 'E') {
        if (kind != NumberKind.DECIMAL && kind != NumberKind.DECIMAL_WITH_LEADING_ZERO) {
          return malformedNumber(startPos);
        }
        addLiteralCharAdvance();
        if (c0 == '+' || c0 == '-') {
          addLiteralCharAdvance();
        }
        if (!CharPredicates.isDecimalDigit(c0)) {
          return malformedNumber(startPos);
        }
        scanDecimalDigits();
      }

      // Numeric literal must not be immediately followed by a digit or identifier start
      if (CharPredicates.isDecimalDigit(c0) || CharPredicates.isIdentifierStart(c0)) {
        return malformedNumber(startPos);
      }

      literal.complete();
    }
    if (kind == NumberKind.DECIMAL_WITH_LEADING_ZERO) {
      decimalWithLeadingZeroPos = new Location(startPos, sourcePos());
    }
    return NUMBER;
  }

  private void scanDecimalDigits() {
    while (CharPredicates.isDecimalDigit(c0)) {
      addLiteralCharAdvance();
    }
  }

  /**
   * Add radix prefix character ('x', 'o', 'b') and the digits that follow it
   * @return false if there are no digits after the prefix
   */
  private boolean scanPrefixedDigits(IntPredicate isDigit) {
    addLiteralCharAdvance();
    if (!isDigit.test(c0)) {
      return false;
    }
    while (isDigit.test(c0)) {
      addLiteralCharAdvance();
    }
    return true;
  }

  private TokenType malformedNumber(int startPos) {
    reportScannerError(new Location(startPos, sourcePos()), MessageTemplate.MALFORMED_NUMERIC_LITERAL);
    return ILLEGAL;
  }

  private TokenType scanIdentifierOrKeyword() {
    boolean escaped = false;
    try (LiteralScope literal = startLiteral()) {
      if (c0 == '\\') {
        escaped = true;
        int c = scanIdentifierUnicodeEscape();
        // Only allow legal identifier start characters
        if (c < 0 || c == '\\' || !CharPredicates.isIdentifierStart(c)) {
          return invalidIdentifierEscape();
        }
        addLiteralChar(c);
      }
      else {
        addLiteralCharAdvance();
      }

      while (true) {
        if (c0 == '\\') {
          escaped = true;
          int c = scanIdentifierUnicodeEscape();
          if (c < 0 || c == '\\' || !CharPredicates.isIdentifierPart(c)) {
            return invalidIdentifierEscape();
          }
          addLiteralChar(c);
        }
        else
        if (c0 != END_OF_INPUT && CharPredicates.isIdentifierPart(c0)) {
          addLiteralCharAdvance();
        }
        else {
          break;
        }
      }

      TokenType type = keywordOrIdentifier(scanTarget.literalChars);
      literal.complete();
      if (escaped && type != IDENTIFIER) {
        // Keywords spelt with escapes are not keywords but the parser needs to know
        return type.is(FUTURE_STRICT_RESERVED_WORD, LET, STATIC, YIELD) ? ESCAPED_STRICT_RESERVED_WORD
                                                                         : ESCAPED_KEYWORD;
      }
      return type;
    }
  }

  /**
   * Decode '\\uXXXX' or '\\u{X...}' in an identifier. c0 is the '\'.
   * @return the code point or -1 if not a valid escape
   */
  private int scanIdentifierUnicodeEscape() {
    int escapeStart = sourcePos();
    advance();
    if (c0 != 'u') {
      return -1;
    }
    advance();
    return scanUnicodeEscape(false, escapeStart);
  }

  private TokenType invalidIdentifierEscape() {
    reportScannerError(new Location(scanTarget.begPos, sourcePos()), MessageTemplate.INVALID_UNICODE_ESCAPE_SEQUENCE);
    return ILLEGAL;
  }

  private static TokenType keywordOrIdentifier(LiteralBuffer literal) {
    if (!literal.isOneByte() || literal.length() < 2) {
      return IDENTIFIER;
    }
    char first = literal.charAt(0);
    if (first >= KEYWORD_LOOKUP.length) {
      return IDENTIFIER;
    }
    for (Keyword keyword: KEYWORD_LOOKUP[first]) {
      if (literal.isContextualKeyword(keyword.text)) {
        return keyword.type;
      }
    }
    return IDENTIFIER;
  }

  //////////////////////////////////////////////////////////////////////

  // = Low level support

  /**
   * Position in the source of c0
   */
  private int sourcePos() {
    return source.pos() - (c0 > Character.MAX_VALUE ? 2 : 1);
  }

  private void advance() {
    advance(false, true);
  }

  /**
   * Move to next code point
   * @param captureRaw      add c0 to the raw literal before moving on
   * @param checkSurrogate  combine a lead surrogate with the trail surrogate that follows it
   */
  private void advance(boolean captureRaw, boolean checkSurrogate) {
    if (captureRaw && c0 != END_OF_INPUT) {
      addRawLiteralChar(c0);
    }
    c0 = source.advance();
    if (checkSurrogate) {
      handleLeadSurrogate();
    }
  }

  private void handleLeadSurrogate() {
    if (c0 != END_OF_INPUT && Character.isHighSurrogate((char) c0)) {
      int c1 = source.advance();
      if (c1 != END_OF_INPUT && Character.isLowSurrogate((char) c1)) {
        c0 = Character.toCodePoint((char) c0, (char) c1);
      }
      else {
        source.pushBack(c1);
      }
    }
  }

  /**
   * Put c0 back into the stream and make ch the lookahead again
   */
  private void pushBack(int ch) {
    if (c0 > Character.MAX_VALUE) {
      source.pushBack(Character.lowSurrogate(c0));
      source.pushBack(Character.highSurrogate(c0));
    }
    else {
      source.pushBack(c0);
    }
    c0 = ch;
  }

  private TokenType select(TokenType token) {
    advance();
    return token;
  }

  private TokenType select(int nextChar, TokenType then, TokenType otherwise) {
    advance();
    if (c0 == nextChar) {
      advance();
      return then;
    }
    return otherwise;
  }

  private void checkInitialized() {
    if (source == null) {
      throw new IllegalStateException("Internal error: Scanner has not been initialized");
    }
  }

  private void reportScannerError(Location location, MessageTemplate error) {
    if (hasError()) {
      return;
    }
    scannerError         = error;
    scannerErrorLocation = location;
    if (LOGGER.isLoggable(Level.FINE)) {
      LOGGER.fine("Scanner error " + error + " at " + location);
    }
  }

  private static LiteralBuffer literalOf(TokenDesc desc) {
    if (desc.literalChars == null) {
      throw new IllegalStateException("Internal error: token " + desc.type + " has no literal");
    }
    return desc.literalChars;
  }

  private static boolean literalContainsEscapes(TokenDesc desc) {
    if (desc.literalChars == null) {
      return false;
    }
    int sourceLength = desc.endPos - desc.begPos;
    if (desc.type == STRING) {
      sourceLength -= 2;    // Quotes
    }
    return desc.literalChars.length() != sourceLength;
  }

  //////////////////////////////////////////////////////////////////////

  // = Literal buffers

  /**
   * Handle for a literal being scanned. Unless complete() is called before the
   * scope is closed the literal is dropped from the token being scanned so that
   * partial content from a failed scan is never visible.
   */
  private class LiteralScope implements AutoCloseable {
    private boolean complete;

    void complete() {
      complete = true;
    }

    @Override
    public void close() {
      if (!complete) {
        dropLiteral();
      }
    }
  }

  private LiteralScope startLiteral() {
    scanTarget.literalChars = freeBuffer(literalBuffers);
    literalScope.complete = false;
    return literalScope;
  }

  private void startRawLiteral() {
    scanTarget.rawLiteralChars = freeBuffer(rawLiteralBuffers);
  }

  private void dropLiteral() {
    scanTarget.literalChars    = null;
    scanTarget.rawLiteralChars = null;
  }

  /**
   * Find a buffer not in use by any live token other than the one being scanned
   */
  private LiteralBuffer freeBuffer(LiteralBuffer[] pool) {
    for (LiteralBuffer buffer: pool) {
      if (!isInUse(buffer)) {
        buffer.reset();
        return buffer;
      }
    }
    throw new IllegalStateException("Internal error: no free literal buffer");
  }

  private boolean isInUse(LiteralBuffer buffer) {
    return current.references(buffer) ||
           (scanTarget != next && next.references(buffer)) ||
           (scanTarget != nextNext && nextNext.isValid() && nextNext.references(buffer));
  }

  private void addLiteralChar(int c) {
    scanTarget.literalChars.addChar(c);
  }

  private void addLiteralCharAdvance() {
    addLiteralChar(c0);
    advance();
  }

  private void addRawLiteralChar(int c) {
    scanTarget.rawLiteralChars.addChar(c);
  }

  private void reduceRawLiteralLength(int delta) {
    scanTarget.rawLiteralChars.reduceLength(delta);
  }

  //////////////////////////////////////////////////////////////////////

  // = INIT

  private static class Keyword {
    final String    text;
    final TokenType type;
    Keyword(String text, TokenType type) {
      this.text = text;
      this.type = type;
    }
  }

  // Words that are only reserved in strict mode code
  private static final List<String> FUTURE_STRICT_RESERVED_WORDS = List.of("implements", "interface", "package", "private", "protected", "public");

  //
  // Keywords keyed on first letter. Every keyword is lower case ASCII.
  //
  private static final List<Keyword>[] KEYWORD_LOOKUP = IntStream.range(0, 128)
                                                                 .mapToObj(i -> new ArrayList<Keyword>())
                                                                 .collect(Collectors.toList())
                                                                 .toArray(new List[0]);

  //
  // Tokens that consist of a single character which is not the start of any longer
  // token. These can be returned without any further checks.
  //
  private static final TokenType[] ONE_CHAR_TOKENS = new TokenType[128];

  static {
    Stream.concat(Arrays.stream(TokenType.values())
                        .filter(TokenType::isKeyword)
                        .map(type -> new Keyword(type.asString, type)),
                  FUTURE_STRICT_RESERVED_WORDS.stream()
                                              .map(word -> new Keyword(word, FUTURE_STRICT_RESERVED_WORD)))
          .forEach(keyword -> KEYWORD_LOOKUP[keyword.text.charAt(0)].add(keyword));

    List<String> punctuators = Arrays.stream(TokenType.values())
                                     .filter(type -> type.asString != null && !type.isKeyword())
                                     .map(type -> type.asString)
                                     .collect(Collectors.toList());
    punctuators.stream()
               .filter(p -> p.length() == 1)
               .filter(p -> punctuators.stream().noneMatch(other -> other.length() > 1 && other.charAt(0) == p.charAt(0)))
               .forEach(p -> ONE_CHAR_TOKENS[p.charAt(0)] = Arrays.stream(TokenType.values())
                                                                  .filter(type -> p.equals(type.asString))
                                                                  .findFirst()
                                                                  .orElseThrow());
  }
}
