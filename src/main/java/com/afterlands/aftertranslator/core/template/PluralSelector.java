package com.afterlands.aftertranslator.core.template;

import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Selects the branch of a pluralized template for a count.
 *
 * <p>Guards are tried in declaration order and the first match wins. When
 * nothing matches, or the count is not an integral value that fits in a
 * {@code long}, the default branch is returned. Selection never fails.</p>
 */
public class PluralSelector {

    private static final Pattern INTEGER_PATTERN = Pattern.compile("[+-]?\\d+");
    private static final int MAX_LONG_DIGITS = 19;

    /**
     * Selects a branch.
     *
     * @param template Parsed template
     * @param count Count value (any type)
     * @return Selected branch text
     */
    @NotNull
    public CompiledText select(@NotNull ParsedTemplate template, @NotNull Object count) {
        OptionalLong value = toLong(count);
        if (value.isEmpty()) {
            return template.defaultText();
        }
        return select(template, value.getAsLong());
    }

    /**
     * Selects a branch for an integral count.
     */
    @NotNull
    public CompiledText select(@NotNull ParsedTemplate template, long count) {
        for (PluralBranch branch : template.branches()) {
            if (branch.guard().matches(count)) {
                return branch.text();
            }
        }
        return template.defaultText();
    }

    /**
     * Converts a count to a {@code long}.
     *
     * @param count Count value
     * @return Exact integral value, or empty if there is none
     */
    @NotNull
    public static OptionalLong toLong(@NotNull Object count) {
        if (count instanceof Long || count instanceof Integer || count instanceof Short || count instanceof Byte
                || count instanceof AtomicInteger || count instanceof AtomicLong) {
            return OptionalLong.of(((Number) count).longValue());
        }
        if (count instanceof Double || count instanceof Float) {
            double d = ((Number) count).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d) || d != Math.rint(d)) {
                return OptionalLong.empty();
            }
            // 2^63 is exactly representable, Long.MAX_VALUE is not
            if (d < -0x1p63 || d >= 0x1p63) {
                return OptionalLong.empty();
            }
            return OptionalLong.of((long) d);
        }
        if (count instanceof BigInteger integer) {
            return fromBigInteger(integer);
        }
        if (count instanceof BigDecimal decimal) {
            if (decimal.signum() == 0) {
                return OptionalLong.of(0);
            }
            // Integer digits; more than a long holds, e.g. 1e30000000
            if (decimal.precision() - decimal.scale() > MAX_LONG_DIGITS) {
                return OptionalLong.empty();
            }
            if (decimal.stripTrailingZeros().scale() > 0) {
                return OptionalLong.empty();
            }
            return fromBigInteger(decimal.toBigInteger());
        }
        if (count instanceof CharSequence text) {
            String trimmed = text.toString().trim();
            if (!INTEGER_PATTERN.matcher(trimmed).matches() || significantDigits(trimmed) > MAX_LONG_DIGITS) {
                return OptionalLong.empty();
            }
            return fromBigInteger(new BigInteger(trimmed));
        }
        return OptionalLong.empty();
    }

    private static int significantDigits(String integer) {
        int start = integer.charAt(0) == '+' || integer.charAt(0) == '-' ? 1 : 0;
        while (start < integer.length() - 1 && integer.charAt(start) == '0') {
            start++;
        }
        return integer.length() - start;
    }

    private static OptionalLong fromBigInteger(BigInteger value) {
        if (value.bitLength() >= Long.SIZE) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(value.longValue());
    }
}
