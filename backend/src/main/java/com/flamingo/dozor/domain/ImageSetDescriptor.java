package com.flamingo.dozor.domain;

import java.util.List;

/**
 * Describes which images a run covers: either an explicit list of paths, or a directory, a file
 * name template with a run of {@code #} or {@code ?} placeholders and an inclusive number range.
 */
public record ImageSetDescriptor(
    List<String> images, String directory, String template, Integer startNo, Integer endNo) {

  public static ImageSetDescriptor ofImages(List<String> images) {
    return new ImageSetDescriptor(images, null, null, null, null);
  }

  public static ImageSetDescriptor ofRange(
      String directory, String template, int startNo, int endNo) {
    return new ImageSetDescriptor(null, directory, template, startNo, endNo);
  }

  public boolean hasExplicitImages() {
    return images != null && !images.isEmpty();
  }

  public boolean hasRange() {
    return directory != null && template != null && startNo != null && endNo != null;
  }
}
