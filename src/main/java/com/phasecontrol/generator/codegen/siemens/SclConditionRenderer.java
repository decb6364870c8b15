package com.phasecontrol.generator.codegen.siemens;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.phasecontrol.generator.codegen.model.ConditionLiteral;
import com.phasecontrol.generator.codegen.model.ConditionSpec;
import com.phasecontrol.generator.codegen.util.StepNaming;

/**
 * Renders a custom condition as an SCL boolean expression by substituting each label
 * in the DSL text with its literal. OR/AND keywords are valid SCL and stay as written.
 *
 * Substitution is a single left-to-right pass over whole-word labels, so text put in
 * for one label is never matched again. Labels with no literal stay as written.
 */
public class SclConditionRenderer {

    public static final String ALWAYS = "TRUE";

    // Alternation order: X10 must be tried before X1.
    private static final Comparator<String> LONGEST_LABEL_FIRST = Comparator
            .comparingLong(SclConditionRenderer::labelNumber)
            .thenComparingInt(String::length)
            .reversed();

    /**
     * @return the substituted expression, or {@code TRUE} when there is no custom
     *         condition (the enclosing step IF already gates the assignment)
     */
    public String render(ConditionSpec spec) {
        if (spec == null || spec.getLiterals().isEmpty()) {
            return ALWAYS;
        }

        Map<String, String> byLabel = new LinkedHashMap<>();
        for (ConditionLiteral literal : spec.getLiterals()) {
            String tag = StepNaming.toSiemensTag(literal.getTag());
            byLabel.put(literal.getLabel(), literal.isNegated() ? "NOT " + tag : tag);
        }

        Matcher matcher = labelPattern(byLabel.keySet()).matcher(spec.getExpression());
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(result, Matcher.quoteReplacement(byLabel.get(matcher.group(1))));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static Pattern labelPattern(Collection<String> labels) {
        String alternation = labels.stream()
                .sorted(LONGEST_LABEL_FIRST)
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return Pattern.compile("(?<!\\w)(" + alternation + ")(?!\\w)");
    }

    private static long labelNumber(String label) {
        String digits = label.replaceAll("\\D", "");
        if (digits.isEmpty() || digits.length() > 18) {
            return -1;
        }
        return Long.parseLong(digits);
    }
}
