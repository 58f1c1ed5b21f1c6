package com.example.kbassist.llm;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public class LangChain4jModelGateway implements ModelGateway {

    private final EmbeddingModel embeddingModel;
    private final ChatModel chatModel;

    @Override
    public float[] embed(String text) {
        Embedding embedding = embeddingModel.embed(text).content();
        return embedding.vector();
    }

    @Override
    public String generate(String prompt, String context) {
        String message = prompt;
        if (context != null && !context.isBlank() && !prompt.contains(context)) {
            message = context + "\n\n" + prompt;
        }
        log.debug("Sending prompt of {} chars to chat model", message.length());
        return chatModel.chat(message);
    }
}
