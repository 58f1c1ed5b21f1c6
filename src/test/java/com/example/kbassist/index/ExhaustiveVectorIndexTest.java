package com.example.kbassist.index;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ExhaustiveVectorIndexTest extends VectorIndexContractTest {

  @Override
  VectorIndex newIndex(int dimension) {
    return new ExhaustiveVectorIndex(dimension);
  }

  @Test
  void dimensionMustBePositive() {
    assertThatThrownBy(() -> new ExhaustiveVectorIndex(0)).isInstanceOf(IllegalArgumentException.class);
  }
}
