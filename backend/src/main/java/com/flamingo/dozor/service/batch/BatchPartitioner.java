package com.flamingo.dozor.service.batch;

import com.flamingo.dozor.domain.Batch;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Groups image numbers into the batches handed to one dozor invocation each.
 *
 * <p>Image numbers are walked in ascending order. A batch is closed when the next number breaks
 * the run of consecutive numbers or when the batch already holds {@code batchSize} images. In
 * overlap mode every batch is split into single-image batches, since frames that share rotation
 * range cannot be processed by one invocation.
 */
@Slf4j
@Component
public class BatchPartitioner {

  /**
   * Partitions the image numbers.
   *
   * @param imageNumbers image numbers, in any order, without duplicates
   * @param batchSize maximum number of images per batch, at least 1
   * @param overlapMode whether every image must become its own batch
   * @return batches in ascending image number order; their union is {@code imageNumbers}
   */
  public List<Batch> partition(
      Collection<Integer> imageNumbers, int batchSize, boolean overlapMode) {
    if (batchSize < 1) {
      throw new IllegalArgumentException("Batch size must be at least 1, was " + batchSize);
    }
    List<Integer> sorted = imageNumbers.stream().sorted().toList();

    List<List<Integer>> runs = new ArrayList<>();
    List<Integer> current = new ArrayList<>();
    Integer expectedNext = null;
    int countInBatch = 0;

    for (int imageNo : sorted) {
      if (expectedNext == null) {
        countInBatch = 1;
        expectedNext = imageNo + 1;
        current.add(imageNo);
        if (batchSize == 1) {
          runs.add(current);
          current = new ArrayList<>();
          expectedNext = null;
        }
      } else if (imageNo != expectedNext || countInBatch == batchSize) {
        runs.add(current);
        current = new ArrayList<>();
        current.add(imageNo);
        countInBatch = 1;
        expectedNext = imageNo + 1;
      } else {
        current.add(imageNo);
        expectedNext++;
        countInBatch++;
      }
    }
    if (!current.isEmpty()) {
      runs.add(current);
    }

    List<Batch> batches = new ArrayList<>();
    if (overlapMode) {
      runs.stream().flatMap(List::stream).forEach(imageNo -> batches.add(Batch.of(imageNo)));
    } else {
      runs.forEach(run -> batches.add(new Batch(run)));
    }

    log.debug(
        "Partitioned {} images into {} batches (batchSize={}, overlap={})",
        sorted.size(),
        batches.size(),
        batchSize,
        overlapMode);
    return batches;
  }
}
