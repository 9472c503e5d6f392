package com.afterlands.aftertranslator.core.template;

import com.afterlands.aftertranslator.api.model.Context;
import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Compiles branch text into {@link CompiledText} and renders values.
 *
 * <h3>Supported Syntax:</h3>
 * <ul>
 *     <li>{@code {name}} - Named value</li>
 *     <li>{@code {}} - Next positional value (insertion order)</li>
 *     <li>{@code {N}} - N-th value (zero based)</li>
 *     <li>{@code {?}} - Plural count</li>
 *     <li>{@code {{}} / {@code }}} - Literal brace</li>
 * </ul>
 *
 * <p>Whitespace inside braces is ignored. Tokens without a value, and
 * braces that do not form a token, are kept verbatim.</p>
 *
 * <p>Values are formatted without locale: integers in decimal, floating
 * point in plain notation without trailing zeros, anything else through
 * {@link String#valueOf(Object)}.</p>
 */
public class Interpolator {

    private static final int MAX_INDEX_DIGITS = 9;

    /**
     * Compiles text into parts and tokens.
     *
     * @param text Branch text
     * @return Compiled text
     */
    @NotNull
    public CompiledText compile(@NotNull String text) {
        List<String> parts = new ArrayList<>();
        List<CompiledText.Token> tokens = new ArrayList<>();

        StringBuilder literal = new StringBuilder();
        int nextPositional = 0;
        int length = text.length();
        int i = 0;

        while (i < length) {
            char c = text.charAt(i);

            if (c == '}') {
                literal.append('}');
                // "}}" is an escape, a lone "}" is kept as-is
                i += (i + 1 < length && text.charAt(i + 1) == '}') ? 2 : 1;
                continue;
            }

            if (c != '{') {
                literal.append(c);
                i++;
                continue;
            }

            if (i + 1 < length && text.charAt(i + 1) == '{') {
                literal.append('{');
                i += 2;
                continue;
            }

            int close = findTokenEnd(text, i + 1);
            if (close < 0) {
                // Unbalanced, keep the brace
                literal.append('{');
                i++;
                continue;
            }

            String raw = text.substring(i, close + 1);
            String content = text.substring(i + 1, close).trim();

            CompiledText.Token token;
            if (content.isEmpty()) {
                token = CompiledText.Token.positional(nextPositional++, raw);
            } else if (content.equals("?")) {
                token = CompiledText.Token.count(raw);
            } else if (isIndex(content)) {
                token = CompiledText.Token.positional(Integer.parseInt(content), raw);
            } else {
                token = CompiledText.Token.named(content, raw);
            }

            parts.add(literal.toString());
            literal.setLength(0);
            tokens.add(token);
            i = close + 1;
        }

        parts.add(literal.toString());
        return new CompiledText(text, parts, tokens);
    }

    /**
     * Compiles and renders in one step.
     *
     * @param text Branch text
     * @param context Values
     * @return Rendered text
     */
    @NotNull
    public String interpolate(@NotNull String text, @NotNull Context context) {
        return compile(text).render(context);
    }

    /**
     * Formats a value for display.
     *
     * @param value Value
     * @return Display text
     */
    @NotNull
    public static String format(@NotNull Object value) {
        if (value instanceof Double d) {
            return formatDecimal(d);
        }
        if (value instanceof Float f) {
            if (f.isNaN() || f.isInfinite()) {
                return String.valueOf(f);
            }
            return new BigDecimal(Float.toString(f)).stripTrailingZeros().toPlainString();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().toPlainString();
        }
        return String.valueOf(value);
    }

    private static String formatDecimal(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return String.valueOf(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /**
     * Finds the closing brace of a token starting after {@code from}.
     *
     * @return Index of '}', or -1 if another '{' or the end comes first
     */
    private static int findTokenEnd(String text, int from) {
        for (int j = from; j < text.length(); j++) {
            char c = text.charAt(j);
            if (c == '}') {
                return j;
            }
            if (c == '{') {
                return -1;
            }
        }
        return -1;
    }

    private static boolean isIndex(String content) {
        if (content.length() > MAX_INDEX_DIGITS) {
            return false;
        }
        for (int j = 0; j < content.length(); j++) {
            char c = content.charAt(j);
            // ASCII only, other scripts' digits make a name
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
