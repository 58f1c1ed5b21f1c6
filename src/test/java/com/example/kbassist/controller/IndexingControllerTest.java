package com.example.kbassist.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.kbassist.index.VectorDimensionException;
import com.example.kbassist.ingest.DocumentIndexingService;
import com.example.kbassist.request.IndexTextRequest;
import com.example.kbassist.response.IndexingResponse;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;
import reactor.core.publisher.Mono;

class IndexingControllerTest {

  private final DocumentIndexingService service = mock(DocumentIndexingService.class);
  private final IndexingController controller = new IndexingController(service);

  @Test
  void indexingAnswersCreated() {
    when(service.index("kb-1", "doc-1", "guide.pdf", 4, "some text")).thenReturn(Mono.just(2));

    ResponseEntity<IndexingResponse> response =
        controller.indexText("kb-1", "doc-1", new IndexTextRequest("guide.pdf", 4, "some text")).block();

    assertThat(response.getStatusCode().value()).isEqualTo(201);
    assertThat(response.getBody()).isEqualTo(new IndexingResponse("doc-1", "kb-1", 2));
  }

  @Test
  void deletesAnswerNoContent() {
    assertThat(controller.deleteDocument("kb-1", "doc-1").block().getStatusCode().value()).isEqualTo(204);
    assertThat(controller.deleteKnowledgeBase("kb-1").block().getStatusCode().value()).isEqualTo(204);

    verify(service).removeDocument("doc-1");
    verify(service).removeKnowledgeBase("kb-1");
  }

  @Test
  void badArgumentsAreClientErrorsButDimensionMismatchIsNot() {
    GlobalExceptionHandler handler = new GlobalExceptionHandler();

    ResponseEntity<Map<String, Object>> badRequest =
        handler.handleIllegalArgument(new IllegalArgumentException("knowledgeBaseId is required"));
    ResponseEntity<Map<String, Object>> serverError =
        handler.handleDimensionMismatch(new VectorDimensionException("query vector", 384, 1536));

    assertThat(badRequest.getStatusCode().value()).isEqualTo(400);
    assertThat(badRequest.getBody()).containsEntry("errors", List.of("knowledgeBaseId is required"));
    assertThat(serverError.getStatusCode().value()).isEqualTo(500);
  }
}
