package com.flamingo.dozor.service.header;

import com.flamingo.dozor.domain.ImageHeader;

/** Reads the acquisition metadata stored in a detector image header. */
public interface ImageHeaderService {

  /**
   * Reads the header of an image. For HDF5 data the path is that of the master file.
   *
   * @throws com.flamingo.dozor.exception.ExternalServiceException if the header cannot be read
   */
  ImageHeader readHeader(String imagePath);
}
