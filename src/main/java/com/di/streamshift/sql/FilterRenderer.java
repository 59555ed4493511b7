package com.di.streamshift.sql;

import com.di.streamshift.filter.Filter;
import com.di.streamshift.schema.TableSchema;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Renders filter trees as WHERE-clause predicates. A tree renders completely or not at all;
 * filters that do not render are left for the engine to apply after reading.
 */
public final class FilterRenderer {

    private static final char LIKE_ESCAPE = '!';

    private FilterRenderer() {}

    /**
     * WHERE clause ANDing every filter that renders, or an empty string when none does.
     */
    public static String whereClause(TableSchema schema, List<Filter> filters) {
        StringJoiner predicates = new StringJoiner(" AND ");
        predicates.setEmptyValue("");
        for (Filter f : filters) {
            render(schema, f).ifPresent(predicates::add);
        }
        String joined = predicates.toString();
        return joined.isEmpty() ? "" : "WHERE " + joined;
    }

    /** Filters from {@code filters} that {@link #render} cannot express. */
    public static List<Filter> unhandled(TableSchema schema, List<Filter> filters) {
        List<Filter> out = new ArrayList<>();
        for (Filter f : filters) {
            if (render(schema, f).isEmpty()) {
                out.add(f);
            }
        }
        return out;
    }

    public static Optional<String> render(TableSchema schema, Filter filter) {
        return Optional.ofNullable(renderOrNull(schema, filter));
    }

    private static String renderOrNull(TableSchema schema, Filter filter) {
        for (String ref : filter.references()) {
            if (schema.indexOf(ref) < 0) {
                return null;
            }
        }
        if (filter instanceof Filter.EqualTo f) {
            return comparison(f.column(), "=", f.value());
        } else if (filter instanceof Filter.NotEqualTo f) {
            return comparison(f.column(), "<>", f.value());
        } else if (filter instanceof Filter.GreaterThan f) {
            return comparison(f.column(), ">", f.value());
        } else if (filter instanceof Filter.GreaterThanOrEqual f) {
            return comparison(f.column(), ">=", f.value());
        } else if (filter instanceof Filter.LessThan f) {
            return comparison(f.column(), "<", f.value());
        } else if (filter instanceof Filter.LessThanOrEqual f) {
            return comparison(f.column(), "<=", f.value());
        } else if (filter instanceof Filter.IsNull f) {
            return SqlText.quoteIdentifier(f.column()) + " IS NULL";
        } else if (filter instanceof Filter.IsNotNull f) {
            return SqlText.quoteIdentifier(f.column()) + " IS NOT NULL";
        } else if (filter instanceof Filter.In f) {
            return in(f);
        } else if (filter instanceof Filter.StringStartsWith f) {
            return like(f.column(), "", f.value(), "%");
        } else if (filter instanceof Filter.StringEndsWith f) {
            return like(f.column(), "%", f.value(), "");
        } else if (filter instanceof Filter.StringContains f) {
            return like(f.column(), "%", f.value(), "%");
        } else if (filter instanceof Filter.And f) {
            return binary(schema, f.left(), "AND", f.right());
        } else if (filter instanceof Filter.Or f) {
            return binary(schema, f.left(), "OR", f.right());
        } else if (filter instanceof Filter.Not f) {
            String child = renderOrNull(schema, f.child());
            return child == null ? null : "(NOT " + child + ")";
        }
        return null;
    }

    private static String comparison(String column, String op, Object value) {
        String literal = value == null ? null : SqlText.literal(value);
        return literal == null ? null : SqlText.quoteIdentifier(column) + " " + op + " " + literal;
    }

    private static String in(Filter.In f) {
        if (f.values().isEmpty()) {
            return null;
        }
        StringJoiner list = new StringJoiner(", ", "(", ")");
        for (Object v : f.values()) {
            String literal = v == null ? null : SqlText.literal(v);
            if (literal == null) {
                return null;
            }
            list.add(literal);
        }
        return SqlText.quoteIdentifier(f.column()) + " IN " + list;
    }

    private static String like(String column, String prefix, String value, String suffix) {
        if (value == null) {
            return null;
        }
        return SqlText.quoteIdentifier(column) + " LIKE " + SqlText.quoteLiteral(prefix + escapeLike(value) + suffix)
                + " ESCAPE '" + LIKE_ESCAPE + "'";
    }

    private static String binary(TableSchema schema, Filter left, String op, Filter right) {
        String l = renderOrNull(schema, left);
        String r = renderOrNull(schema, right);
        return l == null || r == null ? null : "(" + l + " " + op + " " + r + ")";
    }

    private static String escapeLike(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 4);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == LIKE_ESCAPE || c == '%' || c == '_') {
                sb.append(LIKE_ESCAPE);
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
