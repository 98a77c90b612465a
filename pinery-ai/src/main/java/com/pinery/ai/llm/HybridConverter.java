package com.pinery.ai.llm;

import com.pinery.ai.AiException;
import com.pinery.converter.ConversionException;
import com.pinery.converter.ConverterException;
import com.pinery.converter.RuleBasedConverter;
import com.pinery.converter.codegen.GeneratedCode;
import com.pinery.core.script.PineAst;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Rule-based conversion backed by the LLM collaborator.
 *
 * The rule-based result always wins when there is one; verification issues only become warnings.
 * When the rule-based path fails outright, its best-effort draft is sent to the LLM for patching
 * and the returned candidate is used only if it passes the same validation as rule-based output.
 */
public class HybridConverter {

    private static final Logger log = LoggerFactory.getLogger(HybridConverter.class);

    public static final int DEFAULT_MAX_RETRIES = 2;

    private final RuleBasedConverter ruleBased;
    private final LlmConverter llm;
    private final boolean verifyRuleBased;
    private final int maxRetries;
    private final boolean acceptUnverifiedDraft;

    public HybridConverter(RuleBasedConverter ruleBased, LlmConverter llm) {
        this(ruleBased, llm, false, DEFAULT_MAX_RETRIES, false);
    }

    /**
     * @param verifyRuleBased       ask the LLM to review successful rule-based output
     * @param maxRetries            LLM calls allowed when patching a failed conversion
     * @param acceptUnverifiedDraft fall back to a syntactically valid but ineligible rule-based draft
     *                              when the LLM cannot help; the result is flagged in its warnings
     */
    public HybridConverter(RuleBasedConverter ruleBased, LlmConverter llm, boolean verifyRuleBased,
                           int maxRetries, boolean acceptUnverifiedDraft) {
        this.ruleBased = ruleBased;
        this.llm = llm;
        this.verifyRuleBased = verifyRuleBased;
        this.maxRetries = maxRetries;
        this.acceptUnverifiedDraft = acceptUnverifiedDraft;
    }

    /**
     * How the code was produced and what the LLM calls cost.
     */
    public record HybridResult(GeneratedCode code, boolean ruleBasedSucceeded, boolean llmUsed,
                               CostEstimate cost, Duration elapsed) {
    }

    /**
     * @throws ConversionException when neither path produced valid code; the rule-based failure is attached as suppressed
     */
    public HybridResult convert(PineAst ast) throws ConversionException {
        long start = System.nanoTime();
        log.info("Hybrid conversion of '{}'", ast.scriptName());

        ConverterException ruleError;
        try {
            GeneratedCode code = ruleBased.generate(ast);
            if (!verifyRuleBased) {
                return new HybridResult(code, true, false, CostEstimate.zero(), since(start));
            }
            return verified(ast, code, start);
        } catch (ConverterException e) {
            ruleError = e;
            log.info("Rule-based path failed for '{}': {}", ast.scriptName(), e.getMessage());
        }

        GeneratedCode draft = null;
        String draftCode = ruleError instanceof ConversionException failed ? failed.getDraft() : null;
        if (draftCode == null) {
            try {
                draft = ruleBased.draft(ast);
                draftCode = draft.fullCode();
            } catch (ConversionException e) {
                ruleError.addSuppressed(e);
            }
        }

        try {
            LlmConverter.LlmResult result = llm.convert(ast, draftCode, maxRetries);
            GeneratedCode code = result.code().withWarnings(
                List.of("Rule-based conversion failed: " + ruleError.getMessage()));
            return new HybridResult(code, false, true, result.cost(), since(start));
        } catch (AiException e) {
            if (acceptUnverifiedDraft && draft != null && draft.isSuccess()) {
                log.warn("LLM patching failed for '{}', accepting the unverified rule-based draft", ast.scriptName());
                GeneratedCode code = draft.withWarnings(List.of(
                    "UNVERIFIED: rule-based draft used outside its eligibility (" + ruleError.getMessage() + ")",
                    "LLM patching failed: " + e.getMessage()));
                return new HybridResult(code, false, true, CostEstimate.zero(), since(start));
            }
            ConversionException failure = new ConversionException(
                "Rule-based and LLM conversion both failed for '" + ast.scriptName() + "': " + e.getMessage(), e);
            failure.addSuppressed(ruleError);
            throw failure;
        }
    }

    private HybridResult verified(PineAst ast, GeneratedCode code, long start) {
        List<String> notes = new ArrayList<>();
        CostEstimate cost = CostEstimate.zero();
        try {
            LlmConverter.VerificationResult verification = llm.verify(ast, code.fullCode());
            cost = verification.cost();
            if (!verification.verdict().correct()) {
                log.warn("LLM verification of '{}' found {} issue(s)", ast.scriptName(),
                    verification.verdict().issues().size());
                for (String issue : verification.verdict().issues()) {
                    notes.add("LLM verification: " + issue);
                }
            }
        } catch (AiException e) {
            log.warn("LLM verification of '{}' unavailable: {}", ast.scriptName(), e.getMessage());
            notes.add("LLM verification unavailable: " + e.getMessage());
        }
        return new HybridResult(code.withWarnings(notes), true, true, cost, since(start));
    }

    private static Duration since(long start) {
        return Duration.ofNanos(System.nanoTime() - start);
    }
}
