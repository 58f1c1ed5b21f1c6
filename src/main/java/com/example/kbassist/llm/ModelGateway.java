package com.example.kbassist.llm;

/**
 * Remote embedding and text generation capability. Calls may block for a long time or fail;
 * callers bound them with {@link BoundedModelClient}.
 */
public interface ModelGateway {

    /** Embeds {@code text} into a vector of the configured index dimension. */
    float[] embed(String text);

    /**
     * Completes {@code prompt}. {@code context} is the retrieved text the prompt was built from;
     * implementations send it along only when the prompt does not already embed it.
     */
    String generate(String prompt, String context);
}
