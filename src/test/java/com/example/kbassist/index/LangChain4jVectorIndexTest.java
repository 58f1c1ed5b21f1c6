package com.example.kbassist.index;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class LangChain4jVectorIndexTest extends VectorIndexContractTest {

  @Override
  VectorIndex newIndex(int dimension) {
    return new LangChain4jVectorIndex(dimension);
  }

  @Test
  void everyEffectiveWritePublishesANewGeneration() {
    LangChain4jVectorIndex lc4j = (LangChain4jVectorIndex) index;
    assertThat(lc4j.generation()).isZero();

    lc4j.store(List.of(fragment("a", "d1", "kb", 1, 0, 0)));
    assertThat(lc4j.generation()).isEqualTo(1);

    lc4j.deleteByDocument("missing");
    assertThat(lc4j.generation()).isEqualTo(1);

    lc4j.deleteByDocument("d1");
    assertThat(lc4j.generation()).isEqualTo(2);
    assertThat(lc4j.size()).isZero();
  }

  @Test
  void rankingUsesEuclideanDistanceNotCosine() {
    index.store(List.of(
        fragment("same-direction-far", "d1", "kb", 10, 0, 0),
        fragment("other-direction-near", "d1", "kb", 1, 1, 0)));

    assertThat(index.search(new float[] {1, 0, 0}, "kb", 1).get(0).getId()).isEqualTo("other-direction-near");
  }
}
