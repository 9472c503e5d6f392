package com.afterlands.aftertranslator.core.template;

import com.afterlands.aftertranslator.api.exception.TemplateException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.text.BreakIterator;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parses raw catalogue templates into {@link ParsedTemplate}.
 *
 * <p>A template is pluralized when it contains a single {@code |}. Branches
 * are split on grapheme clusters, so a {@code |} that is part of a
 * combining sequence never splits. {@code ||} is a literal {@code |}.</p>
 *
 * <pre>
 * {0} no apples | {1} one apple | {2..4} a few apples | {?} apples
 * </pre>
 *
 * <p>Every branch but the last must start with a guard; the last branch is
 * the default and must not.</p>
 */
public class TemplateParser {

    private static final String SEPARATOR = "|";
    private static final String RANGE = "..";

    private final Interpolator interpolator;

    public TemplateParser(@NotNull Interpolator interpolator) {
        this.interpolator = Objects.requireNonNull(interpolator, "interpolator cannot be null");
    }

    public TemplateParser() {
        this(new Interpolator());
    }

    /**
     * Parses a template.
     *
     * @param template Raw template
     * @return Parsed template
     * @throws TemplateException If a guard is malformed or the default branch is missing
     */
    @NotNull
    public ParsedTemplate parse(@NotNull String template) throws TemplateException {
        Objects.requireNonNull(template, "template cannot be null");

        List<String> segments = splitBranches(template);
        if (segments.size() == 1) {
            String text = unescape(segments.get(0));
            return new ParsedTemplate(template, List.of(), interpolator.compile(text));
        }

        List<PluralBranch> branches = new ArrayList<>(segments.size() - 1);
        for (int i = 0; i < segments.size() - 1; i++) {
            String segment = segments.get(i);
            int close = guardEnd(template, segment);
            PluralGuard guard = parseGuard(template, segment, segment.substring(1, close));
            String text = unescape(segment.substring(close + 1).trim());
            branches.add(new PluralBranch(guard, interpolator.compile(text)));
        }

        String last = segments.get(segments.size() - 1);
        if (startsWithGuard(last)) {
            throw new TemplateException(template,
                    "expected a default branch without a guard but found '" + last + "'");
        }

        return new ParsedTemplate(template, branches, interpolator.compile(unescape(last)));
    }

    /**
     * Parses a guard without braces, e.g. {@code 1, 2} or {@code 2..5}.
     *
     * @param template Template, for error reporting
     * @param segment Branch holding the guard, for error reporting
     * @param rule Guard content
     * @return Guard
     * @throws TemplateException If the guard is malformed
     */
    @NotNull
    PluralGuard parseGuard(@NotNull String template, @NotNull String segment, @NotNull String rule)
            throws TemplateException {
        int separator = rule.indexOf(RANGE);
        if (separator < 0) {
            List<Long> values = new ArrayList<>();
            for (String part : rule.split(",", -1)) {
                values.add(parseValue(template, part, "value '" + part.trim() + "' in match rule for '" + segment + "'"));
            }
            return new PluralGuard.Match(values);
        }

        String left = rule.substring(0, separator);
        String right = rule.substring(separator + RANGE.length());

        if (left.isBlank()) {
            return new PluralGuard.RangeTo(parseValue(template, right, "'to' value in range-to rule for '" + segment + "'"));
        }
        if (right.isBlank()) {
            return new PluralGuard.RangeFrom(parseValue(template, left, "'from' value in range-from rule for '" + segment + "'"));
        }

        long from = parseValue(template, left, "'from' value in range rule for '" + segment + "'");
        long to = parseValue(template, right, "'to' value in range rule for '" + segment + "'");
        if (from > to) {
            throw new TemplateException(template,
                    "failed to parse range rule for '" + segment + "', 'from' is greater than 'to'");
        }
        return new PluralGuard.Range(from, to);
    }

    /**
     * Splits a template into trimmed branches.
     *
     * <p>In a run of pipes, pairs are literal and an odd pipe left over
     * ends the branch.</p>
     *
     * @param template Raw template
     * @return Branches, escapes unresolved
     */
    @NotNull
    List<String> splitBranches(@NotNull String template) {
        String trimmed = template.trim();
        List<String> segments = new ArrayList<>();
        if (!trimmed.contains(SEPARATOR)) {
            segments.add(trimmed);
            return segments;
        }

        BreakIterator graphemes = BreakIterator.getCharacterInstance();
        graphemes.setText(trimmed);
        BreakIterator lookahead = BreakIterator.getCharacterInstance();
        lookahead.setText(trimmed);

        int start = 0;
        int run = 0;
        int begin = graphemes.first();
        for (int end = graphemes.next(); end != BreakIterator.DONE; begin = end, end = graphemes.next()) {
            if (!SEPARATOR.equals(trimmed.substring(begin, end))) {
                run = 0;
                continue;
            }

            run++;
            boolean endOfRun = end == trimmed.length() || !trimmed.startsWith(SEPARATOR, end)
                    || !isGraphemeBoundary(lookahead, trimmed.length(), end + 1);
            if (endOfRun && run % 2 != 0) {
                segments.add(trimmed.substring(start, begin).trim());
                start = end;
            }
        }
        segments.add(trimmed.substring(start).trim());
        return segments;
    }

    private static boolean isGraphemeBoundary(BreakIterator graphemes, int length, int offset) {
        if (offset >= length) {
            return true;
        }
        return graphemes.isBoundary(offset);
    }

    private static int guardEnd(String template, String segment) throws TemplateException {
        if (!segment.startsWith("{")) {
            throw new TemplateException(template,
                    "failed to parse rule for '" + segment + "', expected '{' but string was terminated");
        }
        int close = segment.indexOf('}');
        if (close < 0) {
            throw new TemplateException(template,
                    "failed to parse rule for '" + segment + "', expected '}' but string was terminated");
        }
        return close;
    }

    private boolean startsWithGuard(String segment) {
        if (!segment.startsWith("{")) {
            return false;
        }
        int close = segment.indexOf('}');
        if (close < 0) {
            return false;
        }
        return tryParseGuard(segment.substring(1, close)) != null;
    }

    @Nullable
    private PluralGuard tryParseGuard(String rule) {
        String content = rule.trim();
        if (content.isEmpty() || !content.matches("[0-9+\\-,. ]+")) {
            return null;
        }
        try {
            return parseGuard(rule, rule, rule);
        } catch (TemplateException e) {
            // Looks numeric but is no guard, e.g. "{1.5}"
            return null;
        }
    }

    private static long parseValue(String template, String value, String what) throws TemplateException {
        String trimmed = value.trim();
        try {
            return Long.parseLong(trimmed);
        } catch (NumberFormatException e) {
            throw new TemplateException(template, "failed to parse " + what + ", invalid number '" + trimmed + "'");
        }
    }

    private static String unescape(String text) {
        return text.replace("||", "|");
    }
}
