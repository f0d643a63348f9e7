package com.flamingo.dozor.domain;

/**
 * Resolved images of a run.
 *
 * @param images image number to path
 * @param directory directory of the images, shown in summaries
 * @param displayTemplate file name template with the number shown as {@code ####}
 */
public record ImageSet(ImageMap images, String directory, String displayTemplate) {}
