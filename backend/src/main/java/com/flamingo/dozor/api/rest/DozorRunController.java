package com.flamingo.dozor.api.rest;

import com.flamingo.dozor.api.dto.request.RunRequest;
import com.flamingo.dozor.api.dto.request.SubWedgeRequest;
import com.flamingo.dozor.api.dto.response.RunResponse;
import com.flamingo.dozor.domain.RunResult;
import com.flamingo.dozor.service.orchestration.DozorRunService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for dozor runs. Runs are synchronous; the response carries all results. */
@RestController
@RequestMapping("/api/runs")
@RequiredArgsConstructor
@Slf4j
public class DozorRunController {

  private final DozorRunService dozorRunService;

  /** Runs dozor on a data collection, an image list or an image range. */
  @PostMapping
  public ResponseEntity<RunResponse> run(@Valid @RequestBody RunRequest request) {
    RunResult result = dozorRunService.run(request);
    return ResponseEntity.ok(RunResponse.fromResult(result));
  }

  /** Runs one image per sub-wedge concurrently. */
  @PostMapping("/sub-wedges")
  public ResponseEntity<List<RunResponse>> runSubWedges(
      @Valid @RequestBody SubWedgeRequest request) {
    List<RunResponse> responses =
        dozorRunService.runSubWedges(request.getImagePaths()).stream()
            .map(RunResponse::fromResult)
            .toList();
    log.debug(
        "{} of {} sub-wedges returned results",
        responses.size(),
        request.getImagePaths().size());
    return ResponseEntity.ok(responses);
  }
}
