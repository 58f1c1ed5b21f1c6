package com.example.kbassist.controller;

import com.example.kbassist.index.VectorDimensionException;
import com.example.kbassist.llm.UpstreamModelException;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(WebExchangeBindException ex) {
        List<String> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(err -> err.getField() + ": " + err.getDefaultMessage())
                .toList();
        return ResponseEntity.badRequest().body(Map.of("errors", errors));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(Map.of("errors", List.of(String.valueOf(ex.getMessage()))));
    }

    @ExceptionHandler(VectorDimensionException.class)
    public ResponseEntity<Map<String, Object>> handleDimensionMismatch(VectorDimensionException ex) {
        log.error("Embedding dimension does not match the vector index", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("errors", List.of(ex.getMessage())));
    }

    /** Only the indexing path lets model failures through; queries turn them into results. */
    @ExceptionHandler(UpstreamModelException.class)
    public ResponseEntity<Map<String, Object>> handleUpstream(UpstreamModelException ex) {
        log.warn("Model call failed at {}: {}", ex.getStage(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(Map.of("errors", List.of(ex.getMessage())));
    }
}
