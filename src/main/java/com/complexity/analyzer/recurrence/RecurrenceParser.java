package com.complexity.analyzer.recurrence;

import com.complexity.analyzer.model.ComplexityMeasure;
import com.complexity.analyzer.model.Recurrence;
import com.complexity.analyzer.model.RecursiveTerm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads recurrences written as text, e.g. {@code T(n) = 2*T(n/2) + n} or
 * {@code T(n) = T(n-1) + T(n-2) + 1}. Whitespace is ignored.
 */
public class RecurrenceParser {

    private static final Logger logger = LoggerFactory.getLogger(RecurrenceParser.class);

    private static final Pattern TERM = Pattern.compile("(\\d*)\\*?T\\(n([/-])(\\d+)\\)");
    private static final Pattern LOG_FACTOR =
            Pattern.compile("(?:\\(log(?:_\\d+)?n\\)\\^(\\d+)|log(?:_\\d+)?n)$");
    private static final Pattern POLY_FACTOR = Pattern.compile("\\d*n(?:\\^(.+))?");
    private static final String LEFT_SIDE = "T(n)=";

    /**
     * @param text the recurrence
     * @return the typed recurrence, or empty if the text is not in a supported shape
     */
    public Optional<Recurrence> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String compact = text.replaceAll("\\s+", "");
        if (!compact.startsWith(LEFT_SIDE)) {
            logger.debug("Not a recurrence: {}", text);
            return Optional.empty();
        }

        List<RecursiveTerm> terms = new ArrayList<>();
        ComplexityMeasure localCost = null;
        for (String part : splitTopLevel(compact.substring(LEFT_SIDE.length()))) {
            Matcher term = TERM.matcher(part);
            if (term.matches()) {
                int coefficient = term.group(1).isEmpty() ? 1 : toInt(term.group(1));
                int amount = toInt(term.group(3));
                if (coefficient < 1 || amount < 1 || (term.group(2).equals("/") && amount < 2)) {
                    return Optional.empty();
                }
                terms.add(term.group(2).equals("/")
                        ? RecursiveTerm.divide(coefficient, amount)
                        : RecursiveTerm.subtract(coefficient, amount));
                continue;
            }
            Optional<ComplexityMeasure> cost = parseCost(part);
            if (cost.isEmpty()) {
                logger.debug("Unsupported f(n) '{}' in {}", part, text);
                return Optional.empty();
            }
            localCost = localCost == null ? cost.get() : localCost.maxWith(cost.get());
        }

        if (terms.isEmpty() && localCost == null) {
            return Optional.empty();
        }
        return Optional.of(new Recurrence(terms, localCost == null ? ComplexityMeasure.CONSTANT : localCost));
    }

    /**
     * Parses a non-recursive cost such as {@code 1}, {@code n^2}, {@code log n} or {@code n log n}.
     * A malformed polynomial exponent is read as degree 1.
     */
    public Optional<ComplexityMeasure> parseCost(String text) {
        String cost = text.replaceAll("\\s+", "").replace("*", "").toLowerCase(Locale.ROOT);
        if (cost.isEmpty()) {
            return Optional.empty();
        }

        int logPower = 0;
        Matcher log = LOG_FACTOR.matcher(cost);
        if (log.find()) {
            logPower = log.group(1) == null ? 1 : toInt(log.group(1));
            if (logPower < 0) {
                return Optional.empty();
            }
            cost = cost.substring(0, log.start());
        }

        if (cost.isEmpty() || cost.matches("\\d+")) {
            return Optional.of(ComplexityMeasure.of(0, logPower));
        }
        Matcher poly = POLY_FACTOR.matcher(cost);
        if (!poly.matches()) {
            return Optional.empty();
        }
        int degree = 1;
        String exponent = poly.group(1);
        if (exponent != null) {
            String digits = exponent.replace("(", "").replace(")", "");
            if (digits.matches("\\d+") && toInt(digits) >= 0) {
                degree = toInt(digits);
            }
        }
        return Optional.of(ComplexityMeasure.of(degree, logPower));
    }

    /**
     * @return the value of a digit run, or -1 if it does not fit an int
     */
    static int toInt(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            logger.debug("Number out of range: {}", digits);
            return -1;
        }
    }

    private static List<String> splitTopLevel(String expression) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == '+' && depth == 0) {
                parts.add(expression.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(expression.substring(start));
        return parts;
    }
}
