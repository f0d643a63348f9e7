package com.flamingo.dozor.api.dto.request;

import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for running one image of each sub-wedge. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubWedgeRequest {

  @NotEmpty(message = "At least one image path is required")
  private List<String> imagePaths;
}
