package com.asiainfo.semantic.core.filter;

import com.asiainfo.semantic.core.model.ColumnType;
import com.asiainfo.semantic.core.model.Values;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 谓词工厂与实现：等值、集合、区间、空值匹配、无过滤、合取
 */
public final class Predicates {

    private Predicates() {}

    public static ColumnPredicate all() {
        return All.INSTANCE;
    }

    public static ColumnPredicate eq(Object value) {
        return in(Collections.singletonList(value));
    }

    public static ColumnPredicate in(Object... values) {
        return in(Arrays.asList(values));
    }

    public static ColumnPredicate in(Collection<?> values) {
        Set<Object> set = new LinkedHashSet<>();
        for (Object v : values) {
            if (v != null) set.add(Values.normalize(v));
        }
        return new In(Collections.unmodifiableSet(set));
    }

    public static ColumnPredicate isNull() {
        return IsNull.INSTANCE;
    }

    public static ColumnPredicate between(Object lower, Object upper) {
        return new Range(Values.normalize(lower), true, Values.normalize(upper), true);
    }

    public static ColumnPredicate atLeast(Object lower) {
        return new Range(Values.normalize(lower), true, null, false);
    }

    public static ColumnPredicate greaterThan(Object lower) {
        return new Range(Values.normalize(lower), false, null, false);
    }

    public static ColumnPredicate atMost(Object upper) {
        return new Range(null, false, Values.normalize(upper), true);
    }

    public static ColumnPredicate lessThan(Object upper) {
        return new Range(null, false, Values.normalize(upper), false);
    }

    /**
     * 无过滤
     */
    public static final class All implements ColumnPredicate {
        static final All INSTANCE = new All();

        private All() {}

        @Override
        public boolean test(Object value) {
            return true;
        }

        @Override
        public ColumnPredicate intersect(ColumnPredicate other) {
            return other;
        }

        @Override
        public String toString() {
            return "ALL";
        }
    }

    /**
     * 集合成员（等值是单元素集合）；空值永不匹配
     */
    public record In(Set<Object> values) implements ColumnPredicate {

        @Override
        public boolean test(Object value) {
            return value != null && values.contains(Values.normalize(value));
        }

        @Override
        public ColumnPredicate intersect(ColumnPredicate other) {
            if (other instanceof All) return this;
            Set<Object> kept = new LinkedHashSet<>();
            for (Object v : values) {
                if (other.test(v)) kept.add(v);
            }
            return new In(Collections.unmodifiableSet(kept));
        }

        @Override
        public boolean isUnsatisfiable() {
            return values.isEmpty();
        }

        @Override
        public ColumnPredicate coerce(ColumnType type) {
            List<Object> converted = new ArrayList<>(values.size());
            for (Object v : values) converted.add(type.coerce(v));
            return Predicates.in(converted);
        }

        @Override
        public String toString() {
            if (values.size() == 1) return "= " + values.iterator().next();
            return "IN " + values.stream().map(String::valueOf).collect(Collectors.joining(", ", "{", "}"));
        }
    }

    /**
     * 仅匹配空值（分组时用于承载孤儿行与空外键）
     */
    public static final class IsNull implements ColumnPredicate {
        static final IsNull INSTANCE = new IsNull();

        private IsNull() {}

        @Override
        public boolean test(Object value) {
            return value == null;
        }

        @Override
        public ColumnPredicate intersect(ColumnPredicate other) {
            return other.test(null) ? this : Predicates.in(List.of());
        }

        @Override
        public String toString() {
            return "IS NULL";
        }
    }

    /**
     * 区间，边界为 null 表示无界；空值永不匹配
     */
    public record Range(Object lower, boolean lowerInclusive, Object upper, boolean upperInclusive)
            implements ColumnPredicate {

        @Override
        public boolean test(Object value) {
            if (value == null) return false;
            if (lower != null) {
                int c = Values.compare(value, lower);
                if (c < 0 || (c == 0 && !lowerInclusive)) return false;
            }
            if (upper != null) {
                int c = Values.compare(value, upper);
                if (c > 0 || (c == 0 && !upperInclusive)) return false;
            }
            return true;
        }

        @Override
        public ColumnPredicate intersect(ColumnPredicate other) {
            if (other instanceof All) return this;
            if (other instanceof In || other instanceof IsNull) return other.intersect(this);
            if (other instanceof Range) {
                Range r = (Range) other;
                Object lo = lower;
                boolean loInc = lowerInclusive;
                if (r.lower != null) {
                    int c = lo == null ? -1 : Values.compare(lo, r.lower);
                    if (c < 0) {
                        lo = r.lower;
                        loInc = r.lowerInclusive;
                    } else if (c == 0) {
                        loInc = loInc && r.lowerInclusive;
                    }
                }
                Object hi = upper;
                boolean hiInc = upperInclusive;
                if (r.upper != null) {
                    int c = hi == null ? 1 : Values.compare(hi, r.upper);
                    if (c > 0) {
                        hi = r.upper;
                        hiInc = r.upperInclusive;
                    } else if (c == 0) {
                        hiInc = hiInc && r.upperInclusive;
                    }
                }
                return new Range(lo, loInc, hi, hiInc);
            }
            return And.of(this, other);
        }

        @Override
        public boolean isUnsatisfiable() {
            if (lower == null || upper == null) return false;
            int c = Values.compare(lower, upper);
            return c > 0 || (c == 0 && !(lowerInclusive && upperInclusive));
        }

        @Override
        public ColumnPredicate coerce(ColumnType type) {
            return new Range(type.coerce(lower), lowerInclusive, type.coerce(upper), upperInclusive);
        }

        @Override
        public String toString() {
            String lo = lower == null ? "(-inf" : (lowerInclusive ? "[" : "(") + lower;
            String hi = upper == null ? "+inf)" : upper + (upperInclusive ? "]" : ")");
            return lo + ", " + hi;
        }
    }

    /**
     * 合取（无法合并成单一谓词时使用）
     */
    public record And(List<ColumnPredicate> parts) implements ColumnPredicate {

        static ColumnPredicate of(ColumnPredicate a, ColumnPredicate b) {
            List<ColumnPredicate> parts = new ArrayList<>();
            for (ColumnPredicate p : List.of(a, b)) {
                if (p instanceof And) {
                    parts.addAll(((And) p).parts);
                } else {
                    parts.add(p);
                }
            }
            return new And(List.copyOf(parts));
        }

        @Override
        public boolean test(Object value) {
            for (ColumnPredicate p : parts) {
                if (!p.test(value)) return false;
            }
            return true;
        }

        @Override
        public ColumnPredicate intersect(ColumnPredicate other) {
            if (other instanceof All) return this;
            if (other instanceof In || other instanceof IsNull) return other.intersect(this);
            return of(this, other);
        }

        @Override
        public boolean isUnsatisfiable() {
            return parts.stream().anyMatch(ColumnPredicate::isUnsatisfiable);
        }

        @Override
        public ColumnPredicate coerce(ColumnType type) {
            List<ColumnPredicate> converted = new ArrayList<>(parts.size());
            for (ColumnPredicate p : parts) converted.add(p.coerce(type));
            return new And(List.copyOf(converted));
        }

        @Override
        public String toString() {
            return parts.stream().map(String::valueOf).collect(Collectors.joining(" AND "));
        }
    }
}
