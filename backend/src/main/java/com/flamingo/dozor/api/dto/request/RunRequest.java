package com.flamingo.dozor.api.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a dozor run. The images are given by a catalog data collection id, an explicit
 * image list, or a directory with a template and an image number range.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunRequest {

  @Positive(message = "Data collection id must be positive")
  private Long dataCollectionId;

  /** Directory the quality summary is copied to, under {@code results}. */
  private String processDirectory;

  private List<String> images;

  private String directory;

  /** File name template with the image number as a run of '#' characters. */
  private String template;

  @Min(value = 1, message = "startNo must be at least 1")
  private Integer startNo;

  @Min(value = 1, message = "endNo must be at least 1")
  private Integer endNo;

  private String beamline;

  @Min(value = 1, message = "Batch size must be at least 1")
  private Integer batchSize;

  private Double overlap;

  private Integer wedgeNumber;

  private boolean radiationDamage;

  private boolean submit;

  /** Run the mesh analysis. */
  private boolean mesh;

  /** Attach the spot table of each image to its result. */
  private boolean returnSpotList;

  /** Upload the quality summary to the artifact store. */
  private boolean upload;
}
