package com.example.kbassist;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.kbassist.index.LangChain4jVectorIndex;
import com.example.kbassist.index.VectorIndex;
import com.example.kbassist.llm.ModelGateway;
import com.example.kbassist.llm.StubModelGateway;
import com.example.kbassist.model.InteractionStatus;
import com.example.kbassist.model.QueryResult;
import com.example.kbassist.service.InteractionLog;
import com.example.kbassist.service.JpaInteractionLog;
import com.example.kbassist.service.QueryOrchestrator;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.test.web.reactive.server.WebTestClient;

@SpringBootTest
@AutoConfigureWebTestClient
class KbAssistApplicationTests {

  @Autowired
  ModelGateway modelGateway;

  @Autowired
  VectorIndex vectorIndex;

  @Autowired
  InteractionLog interactionLog;

  @Autowired
  QueryOrchestrator orchestrator;

  @Autowired
  WebTestClient webTestClient;

  @Test
  void contextLoadsWithDefaultBackends() {
    assertThat(modelGateway).isInstanceOf(StubModelGateway.class);
    assertThat(vectorIndex).isInstanceOf(LangChain4jVectorIndex.class);
    assertThat(vectorIndex.dimension()).isEqualTo(384);
    assertThat(interactionLog).isInstanceOf(JpaInteractionLog.class);
  }

  @Test
  void questionAgainstEmptyKnowledgeBaseIsRecordedAsUnknown() {
    QueryResult result = orchestrator.execute("empty-kb", "Is anyone there?").block();

    assertThat(result.getStatus()).isEqualTo(InteractionStatus.UNKNOWN);
    assertThat(interactionLog.get(result.getInteractionId())).isPresent();
  }

  @Test
  void healthEndpointAnswers() {
    webTestClient.get().uri("/api/v1/health")
        .exchange()
        .expectStatus().isOk()
        .expectBody().jsonPath("$.status").isEqualTo("healthy");
  }

  @Test
  void invalidQueryPayloadIsRejected() {
    webTestClient.post().uri("/api/v1/query")
        .bodyValue(Map.of("knowledgeBaseId", "kb-1", "question", " "))
        .exchange()
        .expectStatus().isBadRequest()
        .expectBody().jsonPath("$.errors[0]").value(message -> assertThat(message.toString()).contains("question"));
  }
}
