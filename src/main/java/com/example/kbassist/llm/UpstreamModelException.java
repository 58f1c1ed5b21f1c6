package com.example.kbassist.llm;

import com.example.kbassist.model.QueryStage;

/** An embed or generate call failed or ran past its timeout. */
public class UpstreamModelException extends RuntimeException {

    private final QueryStage stage;

    public UpstreamModelException(QueryStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public QueryStage getStage() {
        return stage;
    }
}
