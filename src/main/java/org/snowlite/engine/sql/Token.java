package org.snowlite.engine.sql;

/**
 * SQL token types with pre-computed hash codes for O(1) keyword lookup.
 *
 * The keyword set is deliberately small: the translator only needs to recognise
 * the words that change how a neighbouring token is read (type positions, window
 * clauses, collation and regex operators). Every other word is an IDENTIFIER.
 */
public enum Token {
    // Literals
    EOF,
    IDENTIFIER,
    QUOTED_IDENTIFIER,  // "identifier"
    STRING,             // 'string'
    INTEGER,            // 123
    DECIMAL,            // 45.67

    // Keywords
    SELECT, FROM, WHERE, AS, AND, OR, NOT, NULL, TRUE, FALSE, IS, IN,
    CASE, WHEN, THEN, ELSE, END,
    CAST, TRY_CAST, INTERVAL,
    OVER, PARTITION, ORDER, BY,
    COLLATE, RLIKE, LIKE, ILIKE,

    // Operators - Comparison
    EQ,         // =
    NE,         // <> or !=
    LT,         // <
    LE,         // <=
    GT,         // >
    GE,         // >=

    // Operators - Arithmetic
    PLUS,       // +
    MINUS,      // -
    STAR,       // *
    SLASH,      // /
    PERCENT,    // %

    // Operators - Other
    CONCAT,     // ||
    DOUBLE_COLON, // :: (cast)
    ARROW,      // => (named argument)
    DOT,        // .
    COMMA,      // ,
    SEMICOLON,  // ;
    COLON,      // :

    // Brackets
    LPAREN,     // (
    RPAREN,     // )
    LBRACKET,   // [
    RBRACKET,   // ]
    LBRACE,     // {
    RBRACE,     // }

    // Anything the scanner has no better name for
    OTHER,
    ;

    /**
     * FNV-1a 64-bit hash constant (prime).
     */
    public static final long FNV_PRIME = 0x100000001b3L;
    public static final long FNV_OFFSET = 0xcbf29ce484222325L;

    /**
     * Pre-computed hash code for this token (lowercase).
     */
    private final long hash;

    Token() {
        this.hash = fnv1a64(this.name().toLowerCase());
    }

    public long hash() {
        return hash;
    }

    /**
     * FNV-1a 64-bit hash (case-insensitive via lowercase).
     */
    public static long fnv1a64(String s) {
        long h = FNV_OFFSET;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c >= 'A' && c <= 'Z') {
                c = (char) (c + 32); // lowercase
            }
            h ^= c;
            h *= FNV_PRIME;
        }
        return h;
    }

    /**
     * Lookup keyword by hash. Returns null if not a keyword.
     */
    public static Token keyword(long hash) {
        for (Token t : KEYWORDS) {
            if (t.hash == hash) return t;
        }
        return null;
    }

    private static final Token[] KEYWORDS = {
        SELECT, FROM, WHERE, AS, AND, OR, NOT, NULL, TRUE, FALSE, IS, IN,
        CASE, WHEN, THEN, ELSE, END,
        CAST, TRY_CAST, INTERVAL,
        OVER, PARTITION, ORDER, BY,
        COLLATE, RLIKE, LIKE, ILIKE
    };

    public boolean isKeyword() {
        return ordinal() >= SELECT.ordinal() && ordinal() <= ILIKE.ordinal();
    }

    /**
     * True for tokens that spell a word: identifiers and keywords.
     */
    public boolean isWord() {
        return this == IDENTIFIER || isKeyword();
    }
}
