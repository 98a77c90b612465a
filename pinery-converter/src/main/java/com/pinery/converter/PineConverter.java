package com.pinery.converter;

import com.pinery.converter.codegen.GeneratedCode;
import com.pinery.converter.validation.ValidationResult;
import com.pinery.core.config.PineryConfig;
import com.pinery.core.script.PineAst;
import com.pinery.core.script.ScriptParser;

/**
 * Source-text entry point: parse a Pine script and convert it with the rule-based path.
 */
public class PineConverter {

    private final ScriptParser parser;
    private final RuleBasedConverter converter;

    public PineConverter() {
        this(PineryConfig.defaults());
    }

    public PineConverter(PineryConfig config) {
        this(new ScriptParser(config), new RuleBasedConverter(config));
    }

    public PineConverter(ScriptParser parser, RuleBasedConverter converter) {
        this.parser = parser;
        this.converter = converter;
    }

    public PineAst parse(String source) {
        return parser.parse(source);
    }

    public ValidationResult canConvert(String source) {
        return converter.canConvert(parse(source));
    }

    public GeneratedCode convert(String source) throws ConverterException {
        return converter.generate(parse(source));
    }

    public RuleBasedConverter converter() {
        return converter;
    }
}
