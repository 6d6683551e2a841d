package org.influence.analytics.query.model.predicate;

import java.util.List;

public final class Comparison implements Predicate {

    public enum Operator {
        EQ("="), NE("!="), GT(">"), GE(">="), LT("<"), LE("<=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    private final String expression;
    private final Operator operator;
    private final Object value;

    public Comparison(String expression, Operator operator, Object value) {
        this.expression = expression;
        this.operator = operator;
        this.value = value;
    }

    @Override
    public void render(StringBuilder sql, List<Object> params) {
        sql.append(expression).append(' ').append(operator.getSymbol()).append(" ?");
        params.add(value);
    }
}
