package org.snowlite.engine.sql;

import java.util.ArrayList;
import java.util.List;

/**
 * SQL Lexer with SavePoint backtracking.
 *
 * Features:
 * - SavePoint for backtracking: mark(), reset()
 * - FNV-1a hash for O(1) keyword lookup
 * - Source positions on every token, so callers can rebuild the original text
 *   (whitespace and comments live in the gaps between tokens)
 * - Never rejects a character: anything unrecognised becomes {@link Token#OTHER}
 *
 * The only input it refuses is an unterminated string or quoted identifier.
 */
public final class Lexer {

    private final String text;
    private int pos;
    private char ch;

    // Current token state
    private Token token;
    private String stringVal;
    private long hash;
    private int tokenPos;

    public Lexer(String sql) {
        this.text = sql;
        this.pos = 0;
        this.ch = pos < text.length() ? text.charAt(pos) : '\0';
        nextToken(); // Prime the lexer
    }

    /**
     * A scanned token together with its exact source span.
     *
     * @param token The token type
     * @param text  The raw source text of the token (quotes included)
     * @param start Start offset (inclusive)
     * @param end   End offset (exclusive)
     */
    public record Lexeme(Token token, String text, int start, int end) {

        public boolean is(Token other) {
            return token == other;
        }

        /**
         * True when this is a word whose text equals {@code word}, ignoring case.
         */
        public boolean isWord(String word) {
            return token.isWord() && text.equalsIgnoreCase(word);
        }
    }

    /**
     * Scans the whole input into a flat token list (EOF excluded).
     *
     * @throws SQLParseException on an unterminated string or quoted identifier
     */
    public static List<Lexeme> tokenize(String sql) {
        Lexer lexer = new Lexer(sql);
        List<Lexeme> out = new ArrayList<>();
        while (lexer.token() != Token.EOF) {
            out.add(new Lexeme(lexer.token(), sql.substring(lexer.tokenPos(), lexer.pos), lexer.tokenPos(), lexer.pos));
            lexer.nextToken();
        }
        return out;
    }

    // ==================== SavePoint for Backtracking ====================

    public record SavePoint(int pos, Token token, String stringVal, long hash, int tokenPos) {}

    public SavePoint mark() {
        return new SavePoint(pos, token, stringVal, hash, tokenPos);
    }

    public void reset(SavePoint sp) {
        this.pos = sp.pos;
        this.token = sp.token;
        this.stringVal = sp.stringVal;
        this.hash = sp.hash;
        this.tokenPos = sp.tokenPos;
        this.ch = pos < text.length() ? text.charAt(pos) : '\0';
    }

    // ==================== Token Access ====================

    public Token token() {
        return token;
    }

    public String stringVal() {
        return stringVal;
    }

    public long hash() {
        return hash;
    }

    public int tokenPos() {
        return tokenPos;
    }

    /**
     * Offset just past the current token.
     */
    public int tokenEnd() {
        return pos;
    }

    public String info() {
        return "pos " + tokenPos + ": " + token + (stringVal != null ? "(" + stringVal + ")" : "");
    }

    // ==================== Scanning ====================

    public void nextToken() {
        skipWhitespaceAndComments();

        tokenPos = pos;
        stringVal = null;
        hash = 0;

        if (pos >= text.length()) {
            token = Token.EOF;
            return;
        }

        // Identifier or keyword
        if (isIdentifierStart(ch)) {
            scanIdentifier();
            return;
        }

        // Quoted identifier: "name"
        if (ch == '"') {
            scanQuotedIdentifier();
            return;
        }

        // String literal: 'value'
        if (ch == '\'') {
            scanString();
            return;
        }

        // Number
        if (isDigit(ch)) {
            scanNumber();
            return;
        }

        // Operators and punctuation
        scanOperator();
    }

    private void scanIdentifier() {
        int start = pos;
        long h = Token.FNV_OFFSET;

        while (isIdentifierPart(ch)) {
            char c = ch;
            if (c >= 'A' && c <= 'Z') {
                c = (char) (c + 32); // lowercase for hash
            }
            h ^= c;
            h *= Token.FNV_PRIME;
            advance();
        }

        stringVal = text.substring(start, pos);
        hash = h;

        Token kw = Token.keyword(h);
        token = (kw != null && kw.name().equalsIgnoreCase(stringVal)) ? kw : Token.IDENTIFIER;
    }

    private void scanQuotedIdentifier() {
        int open = pos;
        advance(); // skip opening "
        StringBuilder sb = new StringBuilder();

        while (true) {
            if (pos >= text.length()) {
                throw new SQLParseException("Unterminated quoted identifier", open);
            }
            if (ch == '"') {
                if (peek() == '"') {
                    sb.append('"');
                    advance();
                    advance();
                    continue;
                }
                break;
            }
            sb.append(ch);
            advance();
        }

        advance(); // skip closing "
        stringVal = sb.toString();
        token = Token.QUOTED_IDENTIFIER;
    }

    private void scanString() {
        int open = pos;
        advance(); // skip opening '
        StringBuilder sb = new StringBuilder();

        while (true) {
            if (pos >= text.length()) {
                throw new SQLParseException("Unterminated string literal", open);
            }
            if (ch == '\'') {
                if (peek() == '\'') {
                    sb.append('\'');
                    advance();
                    advance();
                    continue;
                }
                break;
            }
            if (ch == '\\' && pos + 1 < text.length()) {
                // backslash escapes are legal in the warehouse dialect
                sb.append(ch);
                advance();
            }
            sb.append(ch);
            advance();
        }

        advance(); // skip closing '
        stringVal = sb.toString();
        token = Token.STRING;
    }

    private void scanNumber() {
        int start = pos;
        boolean isDecimal = false;

        while (isDigit(ch)) advance();

        if (ch == '.' && isDigit(peek())) {
            isDecimal = true;
            advance(); // .
            while (isDigit(ch)) advance();
        }

        // Scientific notation: 1e10, 1E-5
        if ((ch == 'e' || ch == 'E') && (isDigit(peek()) || peek() == '+' || peek() == '-')) {
            isDecimal = true;
            advance();
            if (ch == '+' || ch == '-') advance();
            while (isDigit(ch)) advance();
        }

        stringVal = text.substring(start, pos);
        token = isDecimal ? Token.DECIMAL : Token.INTEGER;
    }

    private void scanOperator() {
        switch (ch) {
            case '(' -> { advance(); token = Token.LPAREN; }
            case ')' -> { advance(); token = Token.RPAREN; }
            case '[' -> { advance(); token = Token.LBRACKET; }
            case ']' -> { advance(); token = Token.RBRACKET; }
            case '{' -> { advance(); token = Token.LBRACE; }
            case '}' -> { advance(); token = Token.RBRACE; }
            case ',' -> { advance(); token = Token.COMMA; }
            case ';' -> { advance(); token = Token.SEMICOLON; }
            case '.' -> { advance(); token = Token.DOT; }
            case '+' -> { advance(); token = Token.PLUS; }
            case '-' -> { advance(); token = Token.MINUS; }
            case '*' -> { advance(); token = Token.STAR; }
            case '/' -> { advance(); token = Token.SLASH; }
            case '%' -> { advance(); token = Token.PERCENT; }
            case '=' -> {
                advance();
                if (ch == '>') { advance(); token = Token.ARROW; }
                else { token = Token.EQ; }
            }
            case '<' -> {
                advance();
                if (ch == '=') { advance(); token = Token.LE; }
                else if (ch == '>') { advance(); token = Token.NE; }
                else { token = Token.LT; }
            }
            case '>' -> {
                advance();
                if (ch == '=') { advance(); token = Token.GE; }
                else { token = Token.GT; }
            }
            case '!' -> {
                advance();
                if (ch == '=') { advance(); token = Token.NE; }
                else { token = Token.OTHER; }
            }
            case '|' -> {
                advance();
                if (ch == '|') { advance(); token = Token.CONCAT; }
                else { token = Token.OTHER; }
            }
            case ':' -> {
                advance();
                if (ch == ':') { advance(); token = Token.DOUBLE_COLON; }
                else { token = Token.COLON; }
            }
            default -> { advance(); token = Token.OTHER; }
        }
    }

    // ==================== Helpers ====================

    private void advance() {
        pos++;
        ch = pos < text.length() ? text.charAt(pos) : '\0';
    }

    private char peek() {
        return pos + 1 < text.length() ? text.charAt(pos + 1) : '\0';
    }

    private void skipWhitespaceAndComments() {
        while (true) {
            while (pos < text.length() && Character.isWhitespace(ch)) advance();

            if (ch == '-' && peek() == '-') {
                skipLineComment();
            } else if (ch == '/' && peek() == '*') {
                skipBlockComment();
            } else {
                break;
            }
        }
    }

    private void skipLineComment() {
        while (pos < text.length() && ch != '\n') advance();
        if (ch == '\n') advance();
    }

    private void skipBlockComment() {
        advance(); // /
        advance(); // *
        while (pos < text.length()) {
            if (ch == '*' && peek() == '/') {
                advance();
                advance();
                break;
            }
            advance();
        }
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9') || c == '$';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
