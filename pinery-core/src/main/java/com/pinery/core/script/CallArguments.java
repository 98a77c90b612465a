package com.pinery.core.script;

import com.pinery.core.dsl.Token;
import com.pinery.core.dsl.TokenType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Arguments of one call, split at top-level commas into positional and named groups.
 * Values are kept as normalized source text.
 */
final class CallArguments {

    private final List<String> positional = new ArrayList<>();
    private final Map<String, String> named = new LinkedHashMap<>();
    private final int closeIndex;

    private CallArguments(int closeIndex) {
        this.closeIndex = closeIndex;
    }

    /**
     * Parse the argument list whose "(" sits at {@code openIndex}. An unclosed list runs to the end of the slice.
     */
    static CallArguments parse(List<Token> tokens, int openIndex) {
        int close = TokenText.matchingClose(tokens, openIndex);
        int end = close < 0 ? tokens.size() : close;
        CallArguments result = new CallArguments(close);
        if (openIndex + 1 > end) {
            return result;
        }
        for (List<Token> part : TokenText.splitTopLevel(tokens.subList(openIndex + 1, end))) {
            if (part.isEmpty()) {
                continue;
            }
            if (part.size() > 2 && TokenText.isName(part.get(0)) && part.get(1).is(TokenType.OPERATOR, "=")) {
                result.named.put(part.get(0).value(), TokenText.join(part.subList(2, part.size())));
            } else {
                result.positional.add(TokenText.join(part));
            }
        }
        return result;
    }

    /**
     * Index of the closing parenthesis in the parsed slice, -1 when unclosed.
     */
    int closeIndex() {
        return closeIndex;
    }

    String positional(int index) {
        return index < positional.size() ? positional.get(index) : null;
    }

    String named(String name) {
        return named.get(name);
    }

    /**
     * Named value if present, otherwise the positional one.
     */
    String get(String name, int position) {
        String value = named.get(name);
        return value != null ? value : positional(position);
    }

    Map<String, String> namedArguments() {
        return named;
    }

    int positionalCount() {
        return positional.size();
    }
}
