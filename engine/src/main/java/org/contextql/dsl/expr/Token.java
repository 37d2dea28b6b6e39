package org.contextql.dsl.expr;

/**
 * Token types of the context expression language with pre-computed hash codes
 * for O(1) keyword lookup.
 */
public enum Token {
    // Literals
    EOF,
    IDENTIFIER,
    QUOTED_IDENTIFIER,  // "identifier"
    STRING,             // 'string'
    INTEGER,            // 123
    DECIMAL,            // 45.67
    PARAMETER,          // {name}

    // Keywords
    AS, DISTINCT,
    AND, OR, NOT, IN, BETWEEN, LIKE, ILIKE, IS, NULL, TRUE, FALSE,
    CASE, WHEN, THEN, ELSE, END,
    CAST,
    SELECT, FROM, WHERE,

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
    DOUBLE_COLON, // ::
    DOT,        // .
    COMMA,      // ,

    // Brackets
    LPAREN,     // (
    RPAREN,     // )
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
                c = (char) (c + 32);
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
        AS, DISTINCT,
        AND, OR, NOT, IN, BETWEEN, LIKE, ILIKE, IS, NULL, TRUE, FALSE,
        CASE, WHEN, THEN, ELSE, END,
        CAST,
        SELECT, FROM, WHERE
    };

    public boolean isKeyword() {
        return ordinal() >= AS.ordinal() && ordinal() <= WHERE.ordinal();
    }

    /**
     * Statement keywords never allowed inside a context expression.
     */
    public boolean isStatementKeyword() {
        return this == SELECT || this == FROM || this == WHERE;
    }

    public boolean isComparisonOp() {
        return this == EQ || this == NE || this == LT || this == LE || this == GT || this == GE;
    }
}
