package com.flamingo.dozor.domain;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.TreeMap;

/**
 * Immutable mapping from positive image number to image path. Iteration is always in ascending
 * image number order.
 */
public final class ImageMap {

  private final NavigableMap<Integer, String> images;

  private ImageMap(NavigableMap<Integer, String> images) {
    this.images = Collections.unmodifiableNavigableMap(images);
  }

  public static ImageMap of(Map<Integer, String> images) {
    NavigableMap<Integer, String> copy = new TreeMap<>();
    images.forEach(
        (number, path) -> {
          if (number == null || number <= 0) {
            throw new IllegalArgumentException("Invalid image number: " + number);
          }
          if (path == null) {
            throw new IllegalArgumentException("No path for image " + number);
          }
          copy.put(number, path);
        });
    return new ImageMap(copy);
  }

  public String get(int imageNumber) {
    return images.get(imageNumber);
  }

  public NavigableSet<Integer> imageNumbers() {
    return images.navigableKeySet();
  }

  public int size() {
    return images.size();
  }

  public boolean isEmpty() {
    return images.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ImageMap other && images.equals(other.images);
  }

  @Override
  public int hashCode() {
    return images.hashCode();
  }

  @Override
  public String toString() {
    return "ImageMap" + images;
  }
}
