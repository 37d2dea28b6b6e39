package org.contextql.dsl.expr;

/**
 * Lexer for metric expressions and filter/rule conditions, with SavePoint
 * backtracking.
 *
 * Features:
 * - SavePoint for backtracking: mark(), reset()
 * - FNV-1a hash for O(1) keyword lookup
 * - Quoted identifiers, {@code ::} casts
 * - {@code {name}} filter parameter placeholders
 *
 * Every token records its start and end offsets so callers can rewrite the
 * source text in place.
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
    private int tokenEnd;

    public Lexer(String text) {
        this.text = text;
        this.pos = 0;
        this.ch = pos < text.length() ? text.charAt(pos) : '\0';
        nextToken();
    }

    // ==================== SavePoint for Backtracking ====================

    public record SavePoint(int pos, Token token, String stringVal, long hash, int tokenPos, int tokenEnd) {}

    public SavePoint mark() {
        return new SavePoint(pos, token, stringVal, hash, tokenPos, tokenEnd);
    }

    public void reset(SavePoint sp) {
        this.pos = sp.pos;
        this.token = sp.token;
        this.stringVal = sp.stringVal;
        this.hash = sp.hash;
        this.tokenPos = sp.tokenPos;
        this.tokenEnd = sp.tokenEnd;
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
     * @return Offset just past the current token
     */
    public int tokenEnd() {
        return tokenEnd;
    }

    public String text() {
        return text;
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

        if (ch == '\0') {
            token = Token.EOF;
        } else if (isIdentifierStart(ch)) {
            scanIdentifier();
        } else if (ch == '"') {
            scanQuotedIdentifier();
        } else if (ch == '\'') {
            scanString();
        } else if (ch == '{') {
            scanParameter();
        } else if (isDigit(ch)) {
            scanNumber();
        } else {
            scanOperator();
        }
        tokenEnd = pos;
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
        token = (kw != null) ? kw : Token.IDENTIFIER;
    }

    private void scanQuotedIdentifier() {
        int open = pos;
        advance(); // skip opening "
        StringBuilder sb = new StringBuilder();

        while (ch != '\0') {
            if (ch == '"') {
                if (peek() == '"') {
                    sb.append('"');
                    advance();
                    advance();
                } else {
                    break;
                }
            } else {
                sb.append(ch);
                advance();
            }
        }

        if (ch != '"') {
            throw new ExpressionParseException("Unterminated quoted identifier", open);
        }
        advance(); // skip closing "
        stringVal = sb.toString();
        token = Token.QUOTED_IDENTIFIER;
    }

    private void scanString() {
        int open = pos;
        advance(); // skip opening '
        StringBuilder sb = new StringBuilder();

        while (ch != '\0') {
            if (ch == '\'') {
                if (peek() == '\'') {
                    sb.append('\'');
                    advance();
                    advance();
                } else {
                    break;
                }
            } else {
                sb.append(ch);
                advance();
            }
        }

        if (ch != '\'') {
            throw new ExpressionParseException("Unterminated string literal", open);
        }
        advance(); // skip closing '
        stringVal = sb.toString();
        token = Token.STRING;
    }

    private void scanParameter() {
        int open = pos;
        advance(); // {
        while (ch == ' ') advance();
        if (!isIdentifierStart(ch)) {
            throw new ExpressionParseException("Expected parameter name after {", pos);
        }
        int start = pos;
        while (isIdentifierPart(ch)) advance();
        stringVal = text.substring(start, pos);
        while (ch == ' ') advance();
        if (ch != '}') {
            throw new ExpressionParseException("Unterminated parameter placeholder", open);
        }
        advance(); // }
        token = Token.PARAMETER;
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
        if (ch == 'e' || ch == 'E') {
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
            case ',' -> { advance(); token = Token.COMMA; }
            case '.' -> { advance(); token = Token.DOT; }
            case '+' -> { advance(); token = Token.PLUS; }
            case '-' -> { advance(); token = Token.MINUS; }
            case '*' -> { advance(); token = Token.STAR; }
            case '/' -> { advance(); token = Token.SLASH; }
            case '%' -> { advance(); token = Token.PERCENT; }
            case '=' -> {
                advance();
                if (ch == '=') advance(); // tolerate ==
                token = Token.EQ;
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
                else throw new ExpressionParseException("Expected = after !", pos);
            }
            case '|' -> {
                advance();
                if (ch == '|') { advance(); token = Token.CONCAT; }
                else throw new ExpressionParseException("Expected | after |", pos);
            }
            case ':' -> {
                advance();
                if (ch == ':') { advance(); token = Token.DOUBLE_COLON; }
                else throw new ExpressionParseException("Expected : after :", pos);
            }
            case ';' -> throw new ExpressionParseException("Statement separators are not allowed", pos);
            default -> throw new ExpressionParseException("Unexpected character: " + ch, pos);
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
            while (Character.isWhitespace(ch)) advance();

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
        while (ch != '\0' && ch != '\n') advance();
        if (ch == '\n') advance();
    }

    private void skipBlockComment() {
        int open = pos;
        advance(); // /
        advance(); // *
        while (ch != '\0') {
            if (ch == '*' && peek() == '/') {
                advance();
                advance();
                return;
            }
            advance();
        }
        throw new ExpressionParseException("Unterminated block comment", open);
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
