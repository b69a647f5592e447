package io.marketlens.domain.market;

/**
 * Field predicate understood by the ledger daemon's listing calls.
 */
public record OrderFilter(String field, String op, Object value) {

    public static OrderFilter eq(String field, Object value) {
        return new OrderFilter(field, "==", value);
    }

    public static OrderFilter ne(String field, Object value) {
        return new OrderFilter(field, "!=", value);
    }

    public static OrderFilter gte(String field, Object value) {
        return new OrderFilter(field, ">=", value);
    }

    public static OrderFilter lte(String field, Object value) {
        return new OrderFilter(field, "<=", value);
    }
}
