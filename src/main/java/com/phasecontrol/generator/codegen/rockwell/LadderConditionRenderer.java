package com.phasecontrol.generator.codegen.rockwell;

import java.util.ArrayList;
import java.util.List;

import com.phasecontrol.generator.codegen.model.CompiledCondition;
import com.phasecontrol.generator.codegen.model.LiteralRef;

/**
 * Renders a {@link CompiledCondition} as ladder instructions.
 *
 * A single disjunct is a plain XIC/XIO chain. Several disjuncts become one branch
 * each between {@code BST}, {@code NXB} and {@code BND} markers.
 */
public class LadderConditionRenderer {

    static final String BRANCH_START = "BST";
    static final String NEXT_BRANCH = "NXB";
    static final String BRANCH_END = "BND";

    /**
     * Mnemonic form, e.g. {@code BST XIC A NXB XIO B BND}.
     */
    public String toMnemonic(CompiledCondition condition) {
        return String.join(" ", tokens(condition, false));
    }

    /**
     * Rung-text form used inside the L5X routine, e.g. {@code [XIC(A) ,XIO(B) ]}.
     */
    public String toRungText(CompiledCondition condition) {
        return String.join(" ", tokens(condition, true))
                .replace(BRANCH_START + " ", "[")
                .replace(" " + NEXT_BRANCH + " ", " ,")
                .replace(" " + BRANCH_END, " ]");
    }

    private List<String> tokens(CompiledCondition condition, boolean callForm) {
        List<String> tokens = new ArrayList<>();
        List<List<LiteralRef>> disjuncts = condition.getDisjuncts();
        if (!condition.isBranched()) {
            disjuncts.forEach(chain -> appendChain(tokens, chain, callForm));
            return tokens;
        }
        tokens.add(BRANCH_START);
        for (int i = 0; i < disjuncts.size(); i++) {
            if (i > 0) {
                tokens.add(NEXT_BRANCH);
            }
            appendChain(tokens, disjuncts.get(i), callForm);
        }
        tokens.add(BRANCH_END);
        return tokens;
    }

    private static void appendChain(List<String> tokens, List<LiteralRef> chain, boolean callForm) {
        for (LiteralRef literal : chain) {
            String instruction = literal.isNegated() ? "XIO" : "XIC";
            tokens.add(callForm
                    ? instruction + "(" + literal.getTag() + ")"
                    : instruction + " " + literal.getTag());
        }
    }
}
