package com.processdoc.analyzer.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.processdoc.analyzer.model.Rule;

/**
 * Turns a conditional expression into an ordered decision table.
 *
 * Two shapes are recognized:
 * <ul>
 *   <li>{@code IIF(cond, then, else)}, where {@code else} may itself be an IIF call; the chain
 *       becomes one rule per condition plus a default rule.</li>
 *   <li>{@code CASE WHEN cond THEN value ... [ELSE value] END}; an ELSE clause becomes a rule
 *       with condition {@code ELSE}.</li>
 * </ul>
 *
 * Splitting is driven by parentheses and keywords only. Quotes are not tracked, so a comma or
 * keyword inside a string literal can make an expression unrecognizable; such input yields an
 * empty result and callers show the raw text. A result is either complete or empty, never
 * partial.
 *
 * Stateless and thread-safe.
 */
public class ExpressionFlattener {
    private static final Logger log = LoggerFactory.getLogger(ExpressionFlattener.class);

    private static final Pattern IIF_CALL = Pattern.compile("IIF\\s*\\(", Pattern.CASE_INSENSITIVE);
    private static final Pattern IIF_START = Pattern.compile("^\\s*IIF\\s*\\(", Pattern.CASE_INSENSITIVE);
    private static final Pattern CASE_START = Pattern.compile("^CASE\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern CASE_END = Pattern.compile("\\s*\\bEND\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHEN_CLAUSE = Pattern.compile(
            "^WHEN\\s+(.+?)\\s+THEN\\s+(.+?)\\s*(?=\\bWHEN\\s|\\bELSE\\s|$)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern ELSE_CLAUSE = Pattern.compile("^ELSE\\s+(.+)$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final int IIF_ARGUMENTS = 3;

    public Optional<List<Rule>> flatten(String expression) {
        if (expression == null || expression.isBlank()) {
            return Optional.empty();
        }
        String trimmed = expression.trim();
        List<Rule> rules;
        if (CASE_START.matcher(trimmed).find()) {
            rules = flattenCase(trimmed);
        } else if (IIF_CALL.matcher(trimmed).find()) {
            rules = flattenIif(trimmed);
        } else {
            return Optional.empty();
        }
        if (rules == null || rules.isEmpty()) {
            log.debug("Expression not flattened: {}", trimmed);
            return Optional.empty();
        }
        return Optional.of(List.copyOf(rules));
    }

    public boolean isConditional(String expression) {
        return flatten(expression).isPresent();
    }

    private List<Rule> flattenIif(String text) {
        List<Rule> rules = new ArrayList<>();
        return appendIifChain(text, rules) ? rules : null;
    }

    /**
     * Appends the rules of one IIF call and, recursively, of the IIF in its else branch.
     * Nothing is appended when the call is malformed.
     */
    private boolean appendIifChain(String text, List<Rule> rules) {
        List<String> arguments = splitIifArguments(text);
        if (arguments == null || arguments.size() != IIF_ARGUMENTS) {
            return false;
        }
        rules.add(Rule.of(arguments.get(0), arguments.get(1)));

        String otherwise = arguments.get(2);
        if (IIF_START.matcher(otherwise).find() && appendIifChain(otherwise, rules)) {
            return true;
        }
        rules.add(Rule.otherwise(otherwise));
        return true;
    }

    /**
     * Arguments of the IIF call that must make up the whole text, split at top-level commas.
     * Returns null when the text is not a single, closed IIF call.
     */
    static List<String> splitIifArguments(String text) {
        Matcher start = IIF_START.matcher(text);
        if (!start.find()) {
            return null;
        }
        List<String> arguments = new ArrayList<>();
        int depth = 1;
        int argumentStart = start.end();
        for (int i = argumentStart; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    arguments.add(text.substring(argumentStart, i).trim());
                    return text.substring(i + 1).isBlank() ? arguments : null;
                }
            } else if (c == ',' && depth == 1) {
                arguments.add(text.substring(argumentStart, i).trim());
                argumentStart = i + 1;
            }
        }
        return null;
    }

    private List<Rule> flattenCase(String text) {
        String remaining = CASE_START.matcher(text).replaceFirst("");
        remaining = CASE_END.matcher(remaining).replaceFirst("").trim();

        List<Rule> rules = new ArrayList<>();
        Matcher when = WHEN_CLAUSE.matcher(remaining);
        while (when.find()) {
            rules.add(Rule.of(when.group(1).trim(), when.group(2).trim()));
            remaining = remaining.substring(when.end()).trim();
            when = WHEN_CLAUSE.matcher(remaining);
        }
        if (rules.isEmpty()) {
            return null;
        }
        if (remaining.isEmpty()) {
            return rules;
        }
        Matcher otherwise = ELSE_CLAUSE.matcher(remaining);
        if (!otherwise.matches()) {
            return null;
        }
        rules.add(Rule.of(Rule.ELSE_CONDITION, otherwise.group(1).trim()));
        return rules;
    }
}
