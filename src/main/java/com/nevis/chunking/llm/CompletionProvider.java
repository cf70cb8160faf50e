package com.nevis.chunking.llm;

import com.nevis.chunking.exception.LlmFatalException;
import com.nevis.chunking.exception.LlmTransientException;

public interface CompletionProvider {

    /**
     * Sends one prompt and returns the reply text.
     *
     * @throws LlmTransientException when another attempt may succeed
     * @throws LlmFatalException when retrying cannot help
     */
    Completion complete(String prompt);
}
