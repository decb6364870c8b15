package com.phasecontrol.generator.codegen.condition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.phasecontrol.generator.codegen.model.CompiledCondition;
import com.phasecontrol.generator.codegen.model.ConditionLiteral;
import com.phasecontrol.generator.codegen.model.ConditionSpec;
import com.phasecontrol.generator.codegen.model.LiteralRef;

/**
 * Compiles the precondition DSL into a {@link CompiledCondition}.
 *
 * The grammar is one level of OR over AND-chains of labels:
 *
 * <pre>
 * expression  := conjunction ( " OR " conjunction )*
 * conjunction := ["("] label ( " AND " label )* [")"]
 * </pre>
 *
 * Parentheses only group a conjunction; deeper nesting is not supported.
 */
public class ConditionCompiler {
    private static final Logger log = LoggerFactory.getLogger(ConditionCompiler.class);

    public static final String DEFAULT_LABEL = "X1";

    private static final String OR = " OR ";
    private static final String AND = " AND ";
    private static final Pattern OR_SPLIT = Pattern.compile(Pattern.quote(OR));
    private static final Pattern AND_SPLIT = Pattern.compile(Pattern.quote(AND));

    /**
     * @param spec        custom condition, or null
     * @param fallbackTag tag gated on when no custom condition applies (the step's
     *                    activity flag)
     */
    public CompiledCondition compile(ConditionSpec spec, String fallbackTag) {
        LiteralRef fallback = LiteralRef.of(fallbackTag, false);
        if (spec == null || spec.getLiterals().isEmpty()) {
            return CompiledCondition.single(fallback);
        }

        Map<String, LiteralRef> byLabel = new LinkedHashMap<>();
        for (ConditionLiteral literal : spec.getLiterals()) {
            byLabel.put(literal.getLabel(), LiteralRef.of(literal.getTag(), literal.isNegated()));
        }

        String expression = spec.getExpression().strip();
        if (expression.equals(DEFAULT_LABEL) && spec.getLiterals().size() == 1) {
            return CompiledCondition.single(byLabel.getOrDefault(DEFAULT_LABEL, fallback));
        }

        List<List<LiteralRef>> disjuncts = new ArrayList<>();
        if (expression.contains(OR)) {
            for (String part : OR_SPLIT.split(expression, -1)) {
                disjuncts.add(compileConjunction(stripParentheses(part), byLabel, spec));
            }
        } else {
            disjuncts.add(compileConjunction(expression, byLabel, spec));
        }
        return CompiledCondition.of(disjuncts);
    }

    private List<LiteralRef> compileConjunction(String conjunction, Map<String, LiteralRef> byLabel,
            ConditionSpec spec) {
        List<LiteralRef> chain = new ArrayList<>();
        for (String term : AND_SPLIT.split(conjunction, -1)) {
            String label = stripParentheses(term);
            LiteralRef literal = byLabel.get(label);
            if (literal == null) {
                log.warn("Label '{}' in condition '{}' has no literal; dropping it", label, spec.getExpression());
                continue;
            }
            chain.add(literal);
        }
        return chain;
    }

    private static String stripParentheses(String text) {
        return text.replace("(", "").replace(")", "").strip();
    }
}
