package com.example.kbassist.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.kbassist.config.KbAssistProperties;
import com.example.kbassist.index.ExhaustiveVectorIndex;
import com.example.kbassist.index.VectorIndex;
import com.example.kbassist.llm.BoundedModelClient;
import com.example.kbassist.llm.ModelGateway;
import com.example.kbassist.llm.UpstreamModelException;
import com.example.kbassist.model.Fragment;
import com.example.kbassist.model.FragmentMetadata;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DocumentIndexingServiceTest {

  private ModelGateway gateway;
  private VectorIndex index;
  private DocumentIndexingService service;

  @BeforeEach
  void setUp() {
    gateway = mock(ModelGateway.class);
    when(gateway.embed(anyString())).thenReturn(new float[] {1, 0, 0});
    index = new ExhaustiveVectorIndex(3);
    KbAssistProperties properties = new KbAssistProperties();
    properties.getChunking().setMaxWords(4);
    properties.getChunking().setOverlapWords(1);
    service = new DocumentIndexingService(
        new TextChunker(), new BoundedModelClient(gateway, properties), index, properties);
  }

  @Test
  void indexesEveryChunkUnderTheKnowledgeBase() {
    Integer stored = service.index("kb-1", "doc-1", "guide.pdf", 3, "one two three four five six seven eight nine ten")
        .block();

    assertThat(stored).isEqualTo(3);
    List<Fragment> found = index.search(new float[] {1, 0, 0}, "kb-1", 10);
    assertThat(found).hasSize(3);
    assertThat(found).extracting(Fragment::getText)
        .containsExactly("one two three four", "four five six seven", "seven eight nine ten");
    assertThat(found).allSatisfy(fragment -> {
      assertThat(fragment.getId()).isNotBlank();
      assertThat(fragment.getDocumentId()).isEqualTo("doc-1");
      assertThat(fragment.getKnowledgeBaseId()).isEqualTo("kb-1");
      assertThat(fragment.getSourceDocument()).isEqualTo("guide.pdf");
      assertThat(fragment.getPage()).isEqualTo(3);
      assertThat(fragment.getMetadata()).containsEntry(FragmentMetadata.KNOWLEDGE_BASE_ID, "kb-1");
    });
    assertThat(found).extracting(Fragment::getId).doesNotHaveDuplicates();
    verify(gateway).embed(eq("four five six seven"));
  }

  @Test
  void blankTextIndexesNothing() {
    assertThat(service.index("kb-1", "doc-1", "empty.txt", null, "   ").block()).isZero();
    verify(gateway, never()).embed(anyString());
    assertThat(index.size()).isZero();
  }

  @Test
  void embeddingFailureLeavesTheIndexUntouched() {
    when(gateway.embed("four five six seven")).thenThrow(new IllegalStateException("quota exceeded"));

    assertThatThrownBy(() -> service.index("kb-1", "doc-1", "a.txt", null, "one two three four five six seven eight")
        .block())
        .isInstanceOf(UpstreamModelException.class);
    assertThat(index.size()).isZero();
  }

  @Test
  void removesByDocumentAndByKnowledgeBase() {
    service.index("kb-1", "doc-1", "a.txt", null, "alpha beta").block();
    service.index("kb-1", "doc-2", "b.txt", null, "gamma delta").block();
    service.index("kb-2", "doc-3", "c.txt", null, "epsilon zeta").block();

    assertThat(service.removeDocument("doc-1")).isEqualTo(1);
    assertThat(service.removeKnowledgeBase("kb-1")).isEqualTo(1);
    assertThat(index.size()).isEqualTo(1);
    assertThat(index.search(new float[] {1, 0, 0}, "kb-2", 5)).extracting(Fragment::getDocumentId)
        .containsExactly("doc-3");
  }

  @Test
  void requiresIds() {
    assertThatThrownBy(() -> service.index(" ", "doc-1", "a.txt", null, "text").block())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> service.removeDocument(null)).isInstanceOf(IllegalArgumentException.class);
  }
}
