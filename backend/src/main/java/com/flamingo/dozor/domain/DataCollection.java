package com.flamingo.dozor.domain;

/**
 * Data collection record from the external catalog.
 *
 * @param dataCollectionId catalog identifier
 * @param imageDirectory directory holding the images
 * @param fileTemplate printf-style file name template, e.g. {@code mesh_1_%04d.cbf}
 * @param startImageNumber number of the first image
 * @param numberOfImages number of images collected
 * @param overlap angular overlap between consecutive images, or null
 */
public record DataCollection(
    long dataCollectionId,
    String imageDirectory,
    String fileTemplate,
    int startImageNumber,
    int numberOfImages,
    Double overlap) {}
