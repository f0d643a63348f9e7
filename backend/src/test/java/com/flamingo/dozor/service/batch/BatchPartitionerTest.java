package com.flamingo.dozor.service.batch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.dozor.domain.Batch;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("BatchPartitioner Tests")
class BatchPartitionerTest {

  private final BatchPartitioner partitioner = new BatchPartitioner();

  @Nested
  @DisplayName("Without overlap")
  class WithoutOverlap {

    @Test
    @DisplayName("Should split consecutive numbers into batches of at most batchSize")
    void shouldSplitConsecutiveNumbersBySize() {
      List<Batch> batches = partitioner.partition(List.of(1, 2, 3, 4, 5), 2, false);

      assertThat(batches)
          .extracting(Batch::imageNumbers)
          .containsExactly(List.of(1, 2), List.of(3, 4), List.of(5));
    }

    @Test
    @DisplayName("Should close a batch at a gap in the numbering")
    void shouldCloseBatchAtGap() {
      List<Batch> batches = partitioner.partition(List.of(1, 2, 3, 7, 8, 9), 10, false);

      assertThat(batches)
          .extracting(Batch::imageNumbers)
          .containsExactly(List.of(1, 2, 3), List.of(7, 8, 9));
    }

    @Test
    @DisplayName("Should sort unordered input before grouping")
    void shouldSortInput() {
      List<Batch> batches = partitioner.partition(List.of(4, 2, 3, 1), 10, false);

      assertThat(batches).extracting(Batch::imageNumbers).containsExactly(List.of(1, 2, 3, 4));
    }

    @Test
    @DisplayName("Should give one batch per image when batchSize is 1")
    void shouldGiveSingletonsForBatchSizeOne() {
      List<Batch> batches = partitioner.partition(List.of(1, 2, 3), 1, false);

      assertThat(batches)
          .extracting(Batch::imageNumbers)
          .containsExactly(List.of(1), List.of(2), List.of(3));
    }

    @Test
    @DisplayName("Should cover every image exactly once with consecutive batches")
    void shouldCoverEveryImageOnce() {
      List<Integer> images =
          IntStream.rangeClosed(1, 100)
              .filter(n -> n % 17 != 0)
              .boxed()
              .collect(Collectors.toList());

      List<Batch> batches = partitioner.partition(images, 7, false);

      assertThat(batches.stream().flatMap(b -> b.imageNumbers().stream()).toList())
          .containsExactlyElementsOf(images);
      assertThat(batches).allSatisfy(batch -> {
        assertThat(batch.size()).isBetween(1, 7);
        assertThat(batch.last() - batch.first()).isEqualTo(batch.size() - 1);
      });
    }

    @Test
    @DisplayName("Should return no batches for no images")
    void shouldReturnNoBatchesForEmptyInput() {
      assertThat(partitioner.partition(List.of(), 5, false)).isEmpty();
    }
  }

  @Test
  @DisplayName("Should make every image its own batch in overlap mode")
  void shouldSplitIntoSingletonsInOverlapMode() {
    List<Batch> batches = partitioner.partition(List.of(3, 1, 2, 10), 100, true);

    assertThat(batches)
        .extracting(Batch::imageNumbers)
        .containsExactly(List.of(1), List.of(2), List.of(3), List.of(10));
  }

  @Test
  @DisplayName("Should reject a batch size below 1")
  void shouldRejectInvalidBatchSize() {
    assertThatThrownBy(() -> partitioner.partition(List.of(1), 0, false))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("at least 1");
  }
}
