package com.flamingo.dozor.domain;

import java.util.List;

/**
 * Image numbers processed by one dozor invocation: a run of consecutive numbers, or a single image
 * in overlap mode.
 *
 * @param imageNumbers ascending image numbers, never empty
 */
public record Batch(List<Integer> imageNumbers) {

  public Batch {
    if (imageNumbers == null || imageNumbers.isEmpty()) {
      throw new IllegalArgumentException("A batch must contain at least one image");
    }
    imageNumbers = List.copyOf(imageNumbers);
  }

  public static Batch of(Integer... imageNumbers) {
    return new Batch(List.of(imageNumbers));
  }

  public int first() {
    return imageNumbers.get(0);
  }

  public int last() {
    return imageNumbers.get(imageNumbers.size() - 1);
  }

  public int size() {
    return imageNumbers.size();
  }
}
