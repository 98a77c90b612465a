package com.pinery.ai;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * LLM client answering from a queue of canned responses and failures. Records every prompt.
 */
public class ScriptedLlmClient implements LlmClient {

    /**
     * Minimal module that passes the output contract.
     */
    public static final String VALID_MODULE = """
        import pandas as pd


        class Converted:
            def generate_signal(self, current_price, candles=None, current_position=None):
                return {"action": "hold", "confidence": 0.5, "reason": "No signal"}
        """;

    public static final String VALID_ANSWER = "```python\n" + VALID_MODULE + "```";

    public static final String INVALID_ANSWER = "```python\ndef run(price):\n    return 1\n```";

    private final Deque<Object> answers = new ArrayDeque<>();
    private final List<String> prompts = Collections.synchronizedList(new ArrayList<>());

    public ScriptedLlmClient(Object... answers) {
        for (Object answer : answers) {
            this.answers.add(answer);
        }
    }

    /**
     * Queue a response text or an {@link AiException} to throw.
     */
    public synchronized ScriptedLlmClient then(Object answer) {
        answers.add(answer);
        return this;
    }

    @Override
    public synchronized String submit(String prompt) throws AiException {
        prompts.add(prompt);
        Object next = answers.isEmpty()
            ? new AiException(AiException.ErrorType.UNKNOWN, "No scripted answer left")
            : answers.removeFirst();
        if (next instanceof AiException e) {
            throw e;
        }
        return (String) next;
    }

    public List<String> prompts() {
        return prompts;
    }

    public static AiException timeout() {
        return new AiException(AiException.ErrorType.TIMEOUT, "timed out");
    }

    public static AiException noKey() {
        return new AiException(AiException.ErrorType.API_KEY_MISSING, "no key");
    }
}
