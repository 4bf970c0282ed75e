/* (C)2026 */
package com.ammann.funnel.model;

import com.ammann.funnel.enumeration.PropertyOperator;
import com.ammann.funnel.enumeration.PropertySource;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Leaf property filter comparing one property against a value.
 *
 * <p>Missing properties never match except for {@link PropertyOperator#IS_NOT_SET},
 * {@link PropertyOperator#IS_NOT} and {@link PropertyOperator#NOT_ICONTAINS}. Numeric
 * operators compare as doubles and fail on values that do not parse. An invalid regular
 * expression matches nothing.
 *
 * @param key       property name
 * @param operator  comparison operator
 * @param value     expected value (ignored by IS_SET / IS_NOT_SET)
 * @param source    where the property is read from
 * @param groupType group type for {@link PropertySource#GROUP} filters
 */
public record PropertyFilter(
        String key,
        PropertyOperator operator,
        Object value,
        PropertySource source,
        String groupType) implements PropertyFilterExpr {

    public PropertyFilter {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(operator, "operator");
        source = source == null ? PropertySource.EVENT : source;
    }

    /**
     * Event property filter.
     */
    public static PropertyFilter event(String key, PropertyOperator operator, Object value) {
        return new PropertyFilter(key, operator, value, PropertySource.EVENT, null);
    }

    /**
     * Actor property filter.
     */
    public static PropertyFilter actor(String key, PropertyOperator operator, Object value) {
        return new PropertyFilter(key, operator, value, PropertySource.ACTOR, null);
    }

    @Override
    public boolean test(Event event, ActorEvents actor) {
        Object actual = switch (source) {
            case EVENT -> event == null ? null : event.property(key);
            case ACTOR -> actor == null ? null : actor.properties().get(key);
            case GROUP -> actor == null ? null : actor.groupProperty(groupType, key);
        };

        return switch (operator) {
            case IS_SET -> actual != null;
            case IS_NOT_SET -> actual == null;
            case EXACT -> actual != null && stringify(actual).equals(stringify(value));
            case IS_NOT -> actual == null || !stringify(actual).equals(stringify(value));
            case ICONTAINS -> actual != null && containsIgnoreCase(actual);
            case NOT_ICONTAINS -> actual == null || !containsIgnoreCase(actual);
            case REGEX -> actual != null && regexFind(actual);
            case NOT_REGEX -> actual != null && !regexFind(actual);
            case GT, GTE, LT, LTE -> compareNumeric(actual);
        };
    }

    private boolean containsIgnoreCase(Object actual) {
        return stringify(actual).toLowerCase(Locale.ROOT)
                .contains(stringify(value).toLowerCase(Locale.ROOT));
    }

    private boolean regexFind(Object actual) {
        try {
            return Pattern.compile(stringify(value)).matcher(stringify(actual)).find();
        } catch (PatternSyntaxException e) {
            return false;
        }
    }

    private boolean compareNumeric(Object actual) {
        Double left = toDouble(actual);
        Double right = toDouble(value);
        if (left == null || right == null) {
            return false;
        }
        int cmp = Double.compare(left, right);
        return switch (operator) {
            case GT -> cmp > 0;
            case GTE -> cmp >= 0;
            case LT -> cmp < 0;
            case LTE -> cmp <= 0;
            default -> false;
        };
    }

    private static Double toDouble(Object raw) {
        if (raw instanceof Number number) {
            return number.doubleValue();
        }
        if (raw == null) {
            return null;
        }
        try {
            return Double.parseDouble(raw.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String stringify(Object raw) {
        if (raw == null) {
            return "";
        }
        if (raw instanceof Double d && d == Math.rint(d) && !Double.isInfinite(d)) {
            return Long.toString(d.longValue());
        }
        return raw.toString();
    }
}
