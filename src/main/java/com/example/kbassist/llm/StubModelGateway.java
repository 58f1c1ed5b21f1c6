package com.example.kbassist.llm;

/** Offline stand-in used when no model provider is configured. */
public class StubModelGateway implements ModelGateway {

    static final String STUB_ANSWER = "This is a stub response. Configure a real LLM provider for actual answers.";

    private final int dimension;

    public StubModelGateway(int dimension) {
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        return new float[dimension];
    }

    @Override
    public String generate(String prompt, String context) {
        return STUB_ANSWER;
    }
}
