package com.di.streamshift.filter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Predicate tree handed down by the engine with a scan request. Leaves reference a column
 * by name and carry literal operands typed as the engine produced them.
 */
public interface Filter {

    /** Column names referenced anywhere in this predicate. */
    List<String> references();

    record EqualTo(String column, Object value) implements Filter {
        public List<String> references() { return List.of(column); }
    }

    record NotEqualTo(String column, Object value) implements Filter {
        public List<String> references() { return List.of(column); }
    }

    record GreaterThan(String column, Object value) implements Filter {
        public List<String> references() { return List.of(column); }
    }

    record GreaterThanOrEqual(String column, Object value) implements Filter {
        public List<String> references() { return List.of(column); }
    }

    record LessThan(String column, Object value) implements Filter {
        public List<String> references() { return List.of(column); }
    }

    record LessThanOrEqual(String column, Object value) implements Filter {
        public List<String> references() { return List.of(column); }
    }

    record IsNull(String column) implements Filter {
        public List<String> references() { return List.of(column); }
    }

    record IsNotNull(String column) implements Filter {
        public List<String> references() { return List.of(column); }
    }

    record In(String column, List<Object> values) implements Filter {
        public In {
            values = Collections.unmodifiableList(new ArrayList<>(values));
        }
        public List<String> references() { return List.of(column); }
    }

    record StringStartsWith(String column, String value) implements Filter {
        public List<String> references() { return List.of(column); }
    }

    record StringEndsWith(String column, String value) implements Filter {
        public List<String> references() { return List.of(column); }
    }

    record StringContains(String column, String value) implements Filter {
        public List<String> references() { return List.of(column); }
    }

    record And(Filter left, Filter right) implements Filter {
        public And {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
        public List<String> references() { return concat(left, right); }
    }

    record Or(Filter left, Filter right) implements Filter {
        public Or {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
        public List<String> references() { return concat(left, right); }
    }

    record Not(Filter child) implements Filter {
        public Not {
            Objects.requireNonNull(child, "child");
        }
        public List<String> references() { return child.references(); }
    }

    private static List<String> concat(Filter a, Filter b) {
        List<String> out = new ArrayList<>(a.references());
        out.addAll(b.references());
        return out;
    }
}
