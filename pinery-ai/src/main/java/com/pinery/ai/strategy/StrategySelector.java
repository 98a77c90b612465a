package com.pinery.ai.strategy;

import com.pinery.ai.AiClient;
import com.pinery.ai.AiConfig;
import com.pinery.ai.AiException;
import com.pinery.ai.AiProfile;
import com.pinery.ai.LlmClient;
import com.pinery.ai.llm.CostEstimator;
import com.pinery.ai.llm.HybridConverter;
import com.pinery.ai.llm.LlmConverter;
import com.pinery.ai.llm.LlmResponseParser;
import com.pinery.converter.ConverterException;
import com.pinery.converter.RuleBasedConverter;
import com.pinery.converter.codegen.GeneratedCode;
import com.pinery.converter.validation.ValidationResult;
import com.pinery.core.config.PineryConfig;
import com.pinery.core.script.PineAst;
import com.pinery.core.script.ScriptParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Routes each script to the cheapest conversion tier likely to succeed.
 *
 * The band comes from the complexity validator. A failed tier hands over to the next one in its
 * fallback chain, and the first accepted result is cached by source hash. Without an LLM client
 * only the rule-based tier can succeed.
 */
public class StrategySelector {

    private static final Logger log = LoggerFactory.getLogger(StrategySelector.class);

    static final double COST_OPTIMIZATION_CEILING = 0.8;

    private final AiConfig.SelectorSettings settings;
    private final RuleBasedConverter ruleBased;
    private final ScriptParser parser;
    private final LlmConverter llm;
    private final HybridConverter hybrid;
    private final ConversionCache cache;

    public StrategySelector(AiConfig.SelectorSettings settings, RuleBasedConverter ruleBased, ScriptParser parser,
                            LlmClient client, ConversionCache cache, CostEstimator costs) {
        this(settings, ruleBased, parser, client, cache, costs, Duration.ofSeconds(1));
    }

    /**
     * @param client     LLM collaborator, or null to run rule-based only
     * @param cache      accepted results, or null to disable caching
     * @param retryDelay base pause before re-sending after a transport failure
     */
    public StrategySelector(AiConfig.SelectorSettings settings, RuleBasedConverter ruleBased, ScriptParser parser,
                            LlmClient client, ConversionCache cache, CostEstimator costs, Duration retryDelay) {
        this.settings = settings;
        this.ruleBased = ruleBased;
        this.parser = parser;
        this.cache = cache;
        if (client != null) {
            this.llm = new LlmConverter(client, costs, Math.max(1, settings.getLlmMaxRetries()), retryDelay);
            this.hybrid = new HybridConverter(ruleBased, llm, settings.isVerifyRuleBased(),
                Math.max(1, settings.getHybridMaxRetries()), settings.isAcceptUnverifiedDraft());
        } else {
            this.llm = null;
            this.hybrid = null;
        }
    }

    /**
     * Selector wired from configuration: the default profile's client and prices, and a cache
     * persisted in the configured directory.
     */
    public static StrategySelector fromConfig(AiConfig config, PineryConfig pinery) {
        AiConfig.SelectorSettings settings = config.getSelector();
        AiProfile profile = config.getDefaultProfile();
        LlmClient client = profile != null ? new AiClient(profile) : null;
        CostEstimator costs = profile != null ? CostEstimator.forProfile(profile) : new CostEstimator(0.0, 0.0);
        Path directory = settings.getCacheDirectory() != null ? Path.of(settings.getCacheDirectory()) : null;
        ConversionCache cache = new ConversionCache(settings.getCacheTtlDays(), directory, Clock.systemUTC());
        return new StrategySelector(settings, new RuleBasedConverter(pinery), new ScriptParser(pinery),
            client, cache, costs);
    }

    public AiConfig.SelectorSettings settings() {
        return settings;
    }

    public boolean hasLlm() {
        return llm != null;
    }

    // ===== Selection =====

    public StrategyDecision selectStrategy(PineAst ast) {
        ValidationResult validation = ruleBased.canConvert(ast);
        double score = validation.complexityScore();
        ConversionStrategy band = ConversionStrategy.of(validation.recommendation());

        StrategyDecision decision;
        switch (band) {
            case RULE_BASED -> decision = StrategyDecision.of(band, 0.95, "Low complexity (" + score(score) + ")");
            case HYBRID -> {
                if (score < ruleBased.validator().maxComplexity()) {
                    decision = StrategyDecision.of(band, 0.80, "Low complexity (" + score(score)
                        + ") but not eligible for rule-based conversion: " + String.join(", ", validation.unsupportedFeatures()));
                } else {
                    decision = StrategyDecision.of(band, 0.85, "Medium complexity (" + score(score) + ")");
                }
            }
            default -> {
                if (settings.isCostOptimization() && score < COST_OPTIMIZATION_CEILING) {
                    decision = StrategyDecision.of(ConversionStrategy.HYBRID, 0.70,
                        "High complexity (" + score(score) + ") (cost optimization)");
                } else {
                    decision = StrategyDecision.of(ConversionStrategy.LLM_ONLY, 0.90,
                        "High complexity (" + score(score) + ")");
                }
            }
        }
        log.info("Selected {} for '{}' (confidence {}): {}", decision.strategy().id(), ast.scriptName(),
            String.format(Locale.ROOT, "%.2f", decision.confidence()), decision.reason());
        return decision;
    }

    /**
     * Decision for a source script without converting it.
     */
    public StrategyDecision recommend(String source) {
        return selectStrategy(parser.parse(source));
    }

    /**
     * Tiers tried in order, starting with the chosen one.
     */
    public static List<ConversionStrategy> fallbackChain(ConversionStrategy start) {
        return switch (start) {
            case RULE_BASED -> List.of(ConversionStrategy.RULE_BASED, ConversionStrategy.HYBRID, ConversionStrategy.LLM_ONLY);
            case HYBRID -> List.of(ConversionStrategy.HYBRID, ConversionStrategy.LLM_ONLY);
            case LLM_ONLY -> List.of(ConversionStrategy.LLM_ONLY, ConversionStrategy.HYBRID, ConversionStrategy.RULE_BASED);
        };
    }

    // ===== Conversion =====

    /**
     * Convert with the selected tier, falling back along its chain.
     *
     * @throws ConversionFailedException when every tier failed; each tier's error is attached as suppressed
     */
    public ConversionOutcome convert(String source) throws ConversionFailedException {
        long start = System.nanoTime();
        if (cache != null) {
            Optional<CacheEntry> hit = cache.get(source);
            if (hit.isPresent()) {
                return fromCache(hit.get(), start);
            }
        }
        PineAst ast = parser.parse(source);
        StrategyDecision decision = selectStrategy(ast);
        return run(source, ast, decision, fallbackChain(decision.strategy()), start);
    }

    /**
     * Convert with one tier only, bypassing the cache lookup.
     */
    public ConversionOutcome convert(String source, ConversionStrategy forced) throws ConversionFailedException {
        long start = System.nanoTime();
        PineAst ast = parser.parse(source);
        log.info("Conversion of '{}' forced to {}", ast.scriptName(), forced.id());
        return run(source, ast, StrategyDecision.forced(forced), List.of(forced), start);
    }

    private ConversionOutcome run(String source, PineAst ast, StrategyDecision decision,
                                  List<ConversionStrategy> chain, long start) throws ConversionFailedException {
        List<String> notes = new ArrayList<>();
        List<Exception> failures = new ArrayList<>();
        for (ConversionStrategy strategy : chain) {
            TierResult result;
            try {
                result = attempt(strategy, ast);
            } catch (ConverterException | AiException e) {
                log.warn("{} conversion of '{}' failed: {}", strategy.id(), ast.scriptName(), e.getMessage());
                notes.add(strategy.id() + " failed: " + e.getMessage());
                failures.add(e);
                continue;
            }

            GeneratedCode code = result.code();
            if (cache != null && !unverified(code)) {
                cache.put(source, code, strategy, result.costUsd());
            }
            List<String> warnings = new ArrayList<>(code.warnings());
            warnings.addAll(notes);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            log.info("Converted '{}' with {} in {} ms (${})", ast.scriptName(), strategy.id(), elapsed.toMillis(),
                String.format(Locale.ROOT, "%.4f", result.costUsd()));
            return new ConversionOutcome(code, strategy, decision, result.costUsd(), elapsed, false, warnings);
        }

        List<String> ids = chain.stream().map(ConversionStrategy::id).toList();
        ConversionFailedException failure = new ConversionFailedException(
            "All conversion strategies failed for '" + ast.scriptName() + "' (tried " + String.join(", ", ids) + ")",
            chain);
        failures.forEach(failure::addSuppressed);
        log.error(failure.getMessage());
        throw failure;
    }

    private TierResult attempt(ConversionStrategy strategy, PineAst ast) throws ConverterException, AiException {
        switch (strategy) {
            case RULE_BASED:
                return new TierResult(ruleBased.generate(ast), 0.0);
            case HYBRID: {
                HybridConverter.HybridResult result = requireLlm(hybrid).convert(ast);
                return new TierResult(result.code(), result.cost().costUsd());
            }
            default: {
                LlmConverter.LlmResult result = requireLlm(llm).convert(ast);
                return new TierResult(result.code(), result.cost().costUsd());
            }
        }
    }

    private static <T> T requireLlm(T converter) throws AiException {
        if (converter == null) {
            throw new AiException(AiException.ErrorType.NOT_FOUND, "No LLM collaborator configured");
        }
        return converter;
    }

    private static boolean unverified(GeneratedCode code) {
        return code.warnings().stream().anyMatch(w -> w.startsWith("UNVERIFIED"));
    }

    private ConversionOutcome fromCache(CacheEntry entry, long start) {
        ConversionStrategy strategy = ConversionStrategy.fromId(entry.strategyUsed());
        List<String> warnings = List.of("Served from cache (converted with " + strategy.id() + " at " + entry.createdAt() + ")");
        GeneratedCode code = new GeneratedCode(entry.code(), entry.className(),
            LlmResponseParser.extractImports(entry.code()), Map.of(), entry.indicatorsUsed(), warnings, List.of());
        log.info("Cache hit for {} ({})", entry.className(), strategy.id());
        return new ConversionOutcome(code, strategy, StrategyDecision.of(strategy, 1.0, "Cached result"),
            0.0, Duration.ofNanos(System.nanoTime() - start), true, warnings);
    }

    private static String score(double score) {
        return String.format(Locale.ROOT, "%.3f", score);
    }

    private record TierResult(GeneratedCode code, double costUsd) {
    }
}
