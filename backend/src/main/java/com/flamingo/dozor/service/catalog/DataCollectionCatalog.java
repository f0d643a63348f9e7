package com.flamingo.dozor.service.catalog;

import com.flamingo.dozor.domain.DataCollection;

/** Looks up data collection records in the beamline catalog. */
public interface DataCollectionCatalog {

  /**
   * Fetches a data collection.
   *
   * @throws com.flamingo.dozor.exception.ConfigurationException if the collection is unknown
   * @throws com.flamingo.dozor.exception.ExternalServiceException if the catalog cannot be reached
   */
  DataCollection getDataCollection(long dataCollectionId);
}
