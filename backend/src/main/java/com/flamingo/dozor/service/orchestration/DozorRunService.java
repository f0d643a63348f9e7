package com.flamingo.dozor.service.orchestration;

import com.flamingo.dozor.api.dto.request.RunRequest;
import com.flamingo.dozor.config.DozorConfig;
import com.flamingo.dozor.domain.Batch;
import com.flamingo.dozor.domain.DataCollection;
import com.flamingo.dozor.domain.ImageMap;
import com.flamingo.dozor.domain.ImageResultRecord;
import com.flamingo.dozor.domain.ImageSet;
import com.flamingo.dozor.domain.ImageSetDescriptor;
import com.flamingo.dozor.domain.RunResult;
import com.flamingo.dozor.service.artifact.QualityIndicatorUploader;
import com.flamingo.dozor.service.batch.BatchPartitioner;
import com.flamingo.dozor.service.catalog.DataCollectionCatalog;
import com.flamingo.dozor.service.execution.ExecutionService;
import com.flamingo.dozor.service.image.ImageSetResolver;
import com.flamingo.dozor.service.parsing.SpotFileReader;
import com.flamingo.dozor.service.plot.QualitySummary;
import com.flamingo.dozor.service.plot.QualitySummaryWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for dozor runs: resolves the images, chooses batch size and overlap handling, runs
 * the batches and writes the quality summary of catalog data collections.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DozorRunService {

  static final String RESULTS_DIRECTORY = "results";
  static final String GNUPLOT_LOG = "gnuplot.log";
  private static final DateTimeFormatter RUN_ID_FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

  private final DozorConfig dozorConfig;
  private final DataCollectionCatalog dataCollectionCatalog;
  private final ImageSetResolver imageSetResolver;
  private final BatchPartitioner batchPartitioner;
  private final BatchOrchestrator batchOrchestrator;
  private final QualitySummaryWriter qualitySummaryWriter;
  private final ExecutionService executionService;
  private final QualityIndicatorUploader qualityIndicatorUploader;
  private final SpotFileReader spotFileReader;

  /**
   * Runs dozor on the images of the request.
   *
   * @throws com.flamingo.dozor.exception.ConfigurationException if the images cannot be resolved
   */
  public RunResult run(RunRequest request) {
    ImageSet imageSet;
    int batchSize;
    double overlap = 0.0;
    boolean overlapMode = false;

    if (request.getDataCollectionId() != null) {
      DataCollection dataCollection =
          dataCollectionCatalog.getDataCollection(request.getDataCollectionId());
      imageSet = imageSetResolver.resolve(dataCollection);
      batchSize = catalogBatchSize(dataCollection);
      if (dataCollection.overlap() != null && Math.abs(dataCollection.overlap()) > 1) {
        overlap = dataCollection.overlap();
        overlapMode = true;
      }
    } else {
      imageSet =
          imageSetResolver.resolve(
              new ImageSetDescriptor(
                  request.getImages(),
                  request.getDirectory(),
                  request.getTemplate(),
                  request.getStartNo(),
                  request.getEndNo()));
      batchSize = requestBatchSize(request);
    }
    if (request.getOverlap() != null) {
      overlap = request.getOverlap();
    }
    if (overlap != 0) {
      overlapMode = true;
    }

    Path runDirectory = newRunDirectory();
    log.info(
        "Starting dozor run in {}: {} images, batch size {}, overlap {}",
        runDirectory,
        imageSet.images().size(),
        batchSize,
        overlap);

    List<Batch> batches =
        batchPartitioner.partition(imageSet.images().imageNumbers(), batchSize, overlapMode);
    RunOptions options =
        RunOptions.builder()
            .workingDirectory(runDirectory)
            .overlap(overlap)
            .overlapMode(overlapMode)
            .beamline(request.getBeamline())
            .wedgeNumber(request.getWedgeNumber())
            .radiationDamage(request.isRadiationDamage())
            .submit(request.isSubmit() || dozorConfig.getExecutor().isSubmit())
            .mesh(request.isMesh())
            .build();
    RunResult result = batchOrchestrator.runAll(imageSet.images(), batches, options);

    if (request.isReturnSpotList()) {
      result = result.withRecords(attachSpotLists(result.records()));
    }
    if (request.getDataCollectionId() != null) {
      result = writeSummary(request, imageSet, runDirectory, result);
    }
    return result;
  }

  /**
   * Runs one image of each sub-wedge at the same time.
   *
   * @param imagePaths one image path per sub-wedge
   * @return results of the sub-wedges that succeeded, in input order
   */
  public List<RunResult> runSubWedges(List<String> imagePaths) {
    List<ImageMap> units = imagePaths.stream().map(imageSetResolver::resolveSingle).toList();
    RunOptions options =
        RunOptions.builder()
            .workingDirectory(newRunDirectory())
            .submit(dozorConfig.getExecutor().isSubmit())
            .build();
    return batchOrchestrator.runConcurrently(units, options);
  }

  int catalogBatchSize(DataCollection dataCollection) {
    Integer configured = dozorConfig.getBatch().getDefaultSize();
    int batchSize = configured != null ? configured : dataCollection.numberOfImages();
    return Math.min(batchSize, dozorConfig.getBatch().getMaxSize());
  }

  int requestBatchSize(RunRequest request) {
    int maxSize = dozorConfig.getBatch().getMaxSize();
    if (request.getBatchSize() != null) {
      return Math.min(request.getBatchSize(), maxSize);
    }
    Integer configured = dozorConfig.getBatch().getDefaultSize();
    return configured != null ? Math.min(configured, maxSize) : maxSize;
  }

  private List<ImageResultRecord> attachSpotLists(List<ImageResultRecord> records) {
    return records.stream()
        .map(
            record ->
                record.getSpotFile() == null
                    ? record
                    : record.toBuilder()
                        .spotList(spotFileReader.read(Path.of(record.getSpotFile())))
                        .build())
        .toList();
  }

  private RunResult writeSummary(
      RunRequest request, ImageSet imageSet, Path runDirectory, RunResult result) {
    long dataCollectionId = request.getDataCollectionId();
    QualitySummary summary;
    try {
      summary =
          qualitySummaryWriter.write(
              runDirectory,
              dataCollectionId,
              imageSet.directory(),
              imageSet.displayTemplate(),
              result.records());
    } catch (UncheckedIOException e) {
      log.warn("Could not write quality summary in {}: {}", runDirectory, e.getMessage());
      return result;
    }

    Path plot = null;
    if (summary.script().isPresent() && dozorConfig.getPlot().isEnabled()) {
      executionService.runCommand(
          List.of(
              dozorConfig.getPlot().getGnuplot(), summary.gnuplotScript().getFileName().toString()),
          runDirectory,
          GNUPLOT_LOG);
      if (Files.exists(summary.plotFile())) {
        plot = summary.plotFile();
      } else {
        log.warn("gnuplot did not produce {}", summary.plotFile());
      }
    }

    if (request.isUpload()) {
      Path processDirectory =
          request.getProcessDirectory() != null
              ? Path.of(request.getProcessDirectory())
              : runDirectory;
      copyToResults(processDirectory, summary.csvFile(), plot);
      qualityIndicatorUploader.upload(dataCollectionId, summary.csvFile(), plot);
    }
    return result.withSummary(summary.csvFile(), plot);
  }

  private void copyToResults(Path processDirectory, Path csvFile, Path plotFile) {
    Path resultsDirectory = processDirectory.resolve(RESULTS_DIRECTORY);
    try {
      Files.createDirectories(resultsDirectory);
      Files.copy(
          csvFile,
          resultsDirectory.resolve(csvFile.getFileName()),
          StandardCopyOption.REPLACE_EXISTING);
      if (plotFile != null) {
        Files.copy(
            plotFile,
            resultsDirectory.resolve(plotFile.getFileName()),
            StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      log.warn("Couldn't copy files to results directory {}: {}", resultsDirectory, e.getMessage());
    }
  }

  private Path newRunDirectory() {
    String runId =
        LocalDateTime.now().format(RUN_ID_FORMAT)
            + "-"
            + UUID.randomUUID().toString().substring(0, 8);
    return Path.of(dozorConfig.getWorkingDirectory()).resolve(runId).toAbsolutePath();
  }
}
