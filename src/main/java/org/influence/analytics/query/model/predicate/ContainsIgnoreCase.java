package org.influence.analytics.query.model.predicate;

import java.util.List;

/**
 * Case-insensitive substring match of a free-text term against a string expression,
 * or against any element when the expression is an array.
 */
public final class ContainsIgnoreCase implements Predicate {

    private final String expression;
    private final String term;
    private final boolean arrayElements;

    private ContainsIgnoreCase(String expression, String term, boolean arrayElements) {
        this.expression = expression;
        this.term = term;
        this.arrayElements = arrayElements;
    }

    public static ContainsIgnoreCase inText(String expression, String term) {
        return new ContainsIgnoreCase(expression, term, false);
    }

    public static ContainsIgnoreCase inAnyElement(String arrayColumn, String term) {
        return new ContainsIgnoreCase(arrayColumn, term, true);
    }

    /**
     * ILIKE pattern matching {@code term} anywhere, with LIKE wildcards in the term escaped.
     */
    public static String containsPattern(String term) {
        StringBuilder pattern = new StringBuilder(term.length() + 2).append('%');
        for (char ch : term.toCharArray()) {
            if (ch == '%' || ch == '_' || ch == '\\') {
                pattern.append('\\');
            }
            pattern.append(ch);
        }
        return pattern.append('%').toString();
    }

    @Override
    public void render(StringBuilder sql, List<Object> params) {
        if (arrayElements) {
            sql.append("arrayExists(x -> x ILIKE ?, ").append(expression).append(')');
        } else {
            sql.append(expression).append(" ILIKE ?");
        }
        params.add(containsPattern(term));
    }
}
