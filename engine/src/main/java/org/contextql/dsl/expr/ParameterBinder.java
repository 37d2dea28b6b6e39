package org.contextql.dsl.expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites {@code {name}} placeholders in a condition into positional
 * {@code ?} markers, keeping the rest of the text untouched.
 *
 * String literals and quoted identifiers are tokenized, so braces inside them
 * are never mistaken for placeholders.
 */
public final class ParameterBinder {

    private ParameterBinder() {
    }

    /**
     * A condition with its placeholders replaced.
     *
     * @param text       The rewritten condition
     * @param parameters Placeholder names, one entry per {@code ?} in order
     */
    public record BoundCondition(String text, List<String> parameters) {
        public BoundCondition {
            parameters = List.copyOf(parameters);
        }
    }

    public static BoundCondition bind(String condition) {
        Lexer lexer = new Lexer(condition);
        StringBuilder sb = new StringBuilder(condition.length());
        List<String> parameters = new ArrayList<>();
        int copied = 0;
        while (lexer.token() != Token.EOF) {
            if (lexer.token() == Token.PARAMETER) {
                sb.append(condition, copied, lexer.tokenPos()).append('?');
                parameters.add(lexer.stringVal());
                copied = lexer.tokenEnd();
            }
            lexer.nextToken();
        }
        sb.append(condition, copied, condition.length());
        return new BoundCondition(sb.toString(), parameters);
    }
}
