package com.example.kbassist.llm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.Test;

class LangChain4jModelGatewayTest {

  private final EmbeddingModel embeddingModel = mock(EmbeddingModel.class);
  private final ChatModel chatModel = mock(ChatModel.class);
  private final LangChain4jModelGateway gateway = new LangChain4jModelGateway(embeddingModel, chatModel);

  @Test
  void embedReturnsTheModelVector() {
    when(embeddingModel.embed("refunds")).thenReturn(Response.from(Embedding.from(new float[] {0.5f, -1f})));

    assertThat(gateway.embed("refunds")).containsExactly(0.5f, -1f);
  }

  @Test
  void promptThatAlreadyHoldsTheContextIsSentAsIs() {
    String prompt = "Context:\n[Fragment f1]: text\n\nQuestion: q";
    when(chatModel.chat(prompt)).thenReturn("answer");

    assertThat(gateway.generate(prompt, "[Fragment f1]: text")).isEqualTo("answer");
    verify(chatModel).chat(prompt);
  }

  @Test
  void missingContextIsPrepended() {
    when(chatModel.chat("ctx\n\nQuestion: q")).thenReturn("answer");

    assertThat(gateway.generate("Question: q", "ctx")).isEqualTo("answer");
  }
}
