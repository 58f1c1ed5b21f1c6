package com.example.kbassist.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.kbassist.model.Citation;
import com.example.kbassist.model.Interaction;
import com.example.kbassist.model.InteractionStatus;
import java.time.Instant;
import org.junit.jupiter.api.Test;

public class InMemoryInteractionLogTest {

  private final InMemoryInteractionLog log = new InMemoryInteractionLog();

  public static Interaction interaction(String id, String kbId, InteractionStatus status, Instant at) {
    Interaction.InteractionBuilder builder = Interaction.builder()
        .id(id)
        .knowledgeBaseId(kbId)
        .question("question " + id)
        .status(status)
        .createdAt(at);
    if (status == InteractionStatus.ANSWERED) {
      builder.answer("answer " + id).citation(new Citation("doc.pdf", 1, "frag-" + id, 0.0));
    }
    return builder.build();
  }

  @Test
  void savedInteractionsCanBeFetchedById() {
    Interaction saved = log.save(interaction("i1", "kb", InteractionStatus.ANSWERED, Instant.now()));

    assertThat(log.get("i1")).contains(saved);
    assertThat(log.get("missing")).isEmpty();
  }

  @Test
  void interactionsAreNeverOverwritten() {
    log.save(interaction("i1", "kb", InteractionStatus.UNKNOWN, Instant.now()));

    assertThatThrownBy(() -> log.save(interaction("i1", "kb", InteractionStatus.ANSWERED, Instant.now())))
        .isInstanceOf(InteractionLogException.class);
    assertThat(log.get("i1")).get().extracting(Interaction::getStatus).isEqualTo(InteractionStatus.UNKNOWN);
  }

  @Test
  void listIsMostRecentFirstWithPaging() {
    Instant base = Instant.parse("2024-05-01T10:00:00Z");
    log.save(interaction("old", "kb-1", InteractionStatus.UNKNOWN, base));
    log.save(interaction("new", "kb-1", InteractionStatus.ANSWERED, base.plusSeconds(60)));
    log.save(interaction("mid", "kb-2", InteractionStatus.ERROR, base.plusSeconds(30)));

    assertThat(log.list(null, 10, 0)).extracting(Interaction::getId).containsExactly("new", "mid", "old");
    assertThat(log.list(null, 1, 1)).extracting(Interaction::getId).containsExactly("mid");
    assertThat(log.list("kb-1", 10, 0)).extracting(Interaction::getId).containsExactly("new", "old");
    assertThat(log.list("kb-1", 10, 5)).isEmpty();
  }

  @Test
  void sameTimestampFallsBackToInsertionOrder() {
    Instant at = Instant.parse("2024-05-01T10:00:00Z");
    log.save(interaction("first", "kb", InteractionStatus.UNKNOWN, at));
    log.save(interaction("second", "kb", InteractionStatus.UNKNOWN, at));

    assertThat(log.list("kb", 10, 0)).extracting(Interaction::getId).containsExactly("second", "first");
  }

  @Test
  void countsEveryStatus() {
    log.save(interaction("a", "kb-1", InteractionStatus.ANSWERED, Instant.now()));
    log.save(interaction("b", "kb-1", InteractionStatus.ANSWERED, Instant.now()));
    log.save(interaction("c", "kb-2", InteractionStatus.UNKNOWN, Instant.now()));

    assertThat(log.countByStatus(null))
        .containsEntry(InteractionStatus.ANSWERED, 2L)
        .containsEntry(InteractionStatus.UNKNOWN, 1L)
        .containsEntry(InteractionStatus.ERROR, 0L);
    assertThat(log.countByStatus("kb-2"))
        .containsEntry(InteractionStatus.ANSWERED, 0L)
        .containsEntry(InteractionStatus.UNKNOWN, 1L)
        .containsEntry(InteractionStatus.ERROR, 0L);
  }
}
