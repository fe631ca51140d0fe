package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TraceIdsTest {

  @Test
  void shortIdsAreCompactAndDistinct() {
    final String first = TraceIds.newShortId();
    final String second = TraceIds.newShortId();

    assertThat(first).hasSize(12).doesNotContain("-");
    assertThat(first).isNotEqualTo(second);
  }
}
