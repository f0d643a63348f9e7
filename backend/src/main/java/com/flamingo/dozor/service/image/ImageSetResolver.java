package com.flamingo.dozor.service.image;

import com.flamingo.dozor.domain.DataCollection;
import com.flamingo.dozor.domain.ImageMap;
import com.flamingo.dozor.domain.ImageSet;
import com.flamingo.dozor.domain.ImageSetDescriptor;
import com.flamingo.dozor.exception.ConfigurationException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Turns an image-source descriptor or a catalog record into the run's {@link ImageSet}. */
@Slf4j
@Component
public class ImageSetResolver {

  /**
   * Resolves an explicit image list, or a directory + template + range.
   *
   * @throws ConfigurationException if the descriptor carries neither form, or the template has no
   *     number placeholder
   */
  public ImageSet resolve(ImageSetDescriptor descriptor) {
    if (descriptor == null) {
      throw new ConfigurationException("No image source given");
    }
    if (descriptor.hasExplicitImages()) {
      return resolveExplicit(descriptor.images());
    }
    if (descriptor.hasRange()) {
      String printfTemplate = ImageFileNames.toPrintfTemplate(descriptor.template());
      return resolveRange(
          descriptor.directory(), printfTemplate, descriptor.startNo(), descriptor.endNo());
    }
    throw new ConfigurationException(
        "Either an image list or a directory, template, startNo and endNo are required");
  }

  /** Resolves the images of a catalog data collection. */
  public ImageSet resolve(DataCollection dataCollection) {
    if (dataCollection.imageDirectory() == null || dataCollection.fileTemplate() == null) {
      throw new ConfigurationException(
          "Data collection " + dataCollection.dataCollectionId() + " has no image location");
    }
    String printfTemplate = ImageFileNames.toPrintfTemplate(dataCollection.fileTemplate());
    int endNo = dataCollection.startImageNumber() + dataCollection.numberOfImages() - 1;
    return resolveRange(
        dataCollection.imageDirectory(),
        printfTemplate,
        dataCollection.startImageNumber(),
        endNo);
  }

  /** Resolves the single image of a sub-wedge. */
  public ImageMap resolveSingle(String imagePath) {
    Map<Integer, String> byNumber = new LinkedHashMap<>();
    addImage(byNumber, imagePath);
    return ImageMap.of(byNumber);
  }

  private ImageSet resolveExplicit(List<String> images) {
    Map<Integer, String> byNumber = new LinkedHashMap<>();
    for (String image : images) {
      addImage(byNumber, image);
    }
    Path first = Path.of(images.get(0));
    String directory = first.getParent() == null ? "" : first.getParent().toString();
    String displayTemplate = first.getFileName().toString().replace("0001", "####");
    log.debug("Resolved {} explicit images in {}", byNumber.size(), directory);
    return new ImageSet(ImageMap.of(byNumber), directory, displayTemplate);
  }

  private ImageSet resolveRange(String directory, String printfTemplate, int startNo, int endNo) {
    if (endNo < startNo) {
      throw new ConfigurationException(
          "Image range is empty: startNo=" + startNo + ", endNo=" + endNo);
    }
    List<String> paths = new ArrayList<>();
    for (int imageIndex = startNo; imageIndex <= endNo; imageIndex++) {
      String imageName = String.format(Locale.ROOT, printfTemplate, imageIndex);
      paths.add(Path.of(directory, imageName).toString());
    }
    Map<Integer, String> byNumber = new LinkedHashMap<>();
    for (String path : paths) {
      addImage(byNumber, path);
    }
    log.debug("Resolved images {}..{} of {} in {}", startNo, endNo, printfTemplate, directory);
    return new ImageSet(
        ImageMap.of(byNumber), directory, ImageFileNames.toDisplayTemplate(printfTemplate));
  }

  private static void addImage(Map<Integer, String> byNumber, String path) {
    int imageNumber = ImageFileNames.getImageNumber(path);
    if (imageNumber <= 0) {
      throw new ConfigurationException("Image numbers start at 1: " + path);
    }
    String previous = byNumber.putIfAbsent(imageNumber, path);
    if (previous != null) {
      throw new ConfigurationException(
          "Images " + previous + " and " + path + " share image number " + imageNumber);
    }
  }
}
