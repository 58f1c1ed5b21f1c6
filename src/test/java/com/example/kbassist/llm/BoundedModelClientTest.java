package com.example.kbassist.llm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.kbassist.config.KbAssistProperties;
import com.example.kbassist.model.QueryStage;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class BoundedModelClientTest {

  private static KbAssistProperties properties(Duration timeout) {
    KbAssistProperties properties = new KbAssistProperties();
    properties.getModel().setTimeout(timeout);
    return properties;
  }

  @Test
  void passesResultsThrough() {
    BoundedModelClient client = new BoundedModelClient(new StubModelGateway(4), properties(Duration.ofSeconds(1)));

    assertThat(client.embed("hello").block()).hasSize(4).containsOnly(0f);
    assertThat(client.generate("prompt", "context").block()).isEqualTo(StubModelGateway.STUB_ANSWER);
  }

  @Test
  void failuresCarryTheStage() {
    ModelGateway broken = new ModelGateway() {
      @Override
      public float[] embed(String text) {
        throw new IllegalStateException("401 unauthorized");
      }

      @Override
      public String generate(String prompt, String context) {
        throw new IllegalStateException("rate limited");
      }
    };
    BoundedModelClient client = new BoundedModelClient(broken, properties(Duration.ofSeconds(1)));

    assertThatThrownBy(() -> client.embed("x").block())
        .isInstanceOfSatisfying(UpstreamModelException.class, ex -> {
          assertThat(ex.getStage()).isEqualTo(QueryStage.EMBEDDING);
          assertThat(ex.getMessage()).contains("401 unauthorized");
        });
    assertThatThrownBy(() -> client.generate("p", "c").block())
        .isInstanceOfSatisfying(UpstreamModelException.class,
            ex -> assertThat(ex.getStage()).isEqualTo(QueryStage.GENERATING));
  }

  @Test
  void slowCallsTimeOut() {
    ModelGateway slow = new StubModelGateway(2) {
      @Override
      public String generate(String prompt, String context) {
        try {
          Thread.sleep(2_000);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
        return "late";
      }
    };
    BoundedModelClient client = new BoundedModelClient(slow, properties(Duration.ofMillis(100)));

    assertThatThrownBy(() -> client.generate("p", "c").block())
        .isInstanceOf(UpstreamModelException.class)
        .hasMessageContaining("timed out after 100 ms");
  }
}
