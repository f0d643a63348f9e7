package com.flamingo.dozor.service.orchestration;

import com.flamingo.dozor.domain.Batch;
import com.flamingo.dozor.domain.BatchOutcome;
import com.flamingo.dozor.domain.DecodedLog;
import com.flamingo.dozor.domain.ExecutionResult;
import com.flamingo.dozor.domain.ImageHeader;
import com.flamingo.dozor.domain.ImageMap;
import com.flamingo.dozor.domain.ImageResultRecord;
import com.flamingo.dozor.domain.RunParameters;
import com.flamingo.dozor.domain.RunResult;
import com.flamingo.dozor.domain.plot.PlotDocument;
import com.flamingo.dozor.exception.PlotFormatException;
import com.flamingo.dozor.service.execution.ExecutionRequest;
import com.flamingo.dozor.service.execution.ExecutionService;
import com.flamingo.dozor.service.header.ImageHeaderService;
import com.flamingo.dozor.service.image.ImageFileNames;
import com.flamingo.dozor.service.parsing.PlotFormatDecoder;
import com.flamingo.dozor.service.parsing.ResultDecoder;
import com.flamingo.dozor.service.plot.PlotRenderer;
import com.flamingo.dozor.service.protocol.CommandEncoder;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs dozor over a list of batches: reads the header of each batch's first image, derives the
 * run parameters, writes the command file, executes dozor and decodes its output.
 *
 * <p>A batch that fails at any step contributes no records; the remaining batches still run.
 */
@Service
@Slf4j
public class BatchOrchestrator {

  static final String RADIATION_DAMAGE_PLOT_FILE = "dozor_rd.mtv";
  static final String MESH_RESULT_FILE = "dozor_all";
  static final String MESH_BATCH_PATTERN = "*.all";
  static final int HDF5_FILE_NUMBER = 1;
  static final int SPOT_SIZE = 3;

  private final ImageHeaderService imageHeaderService;
  private final CommandEncoder commandEncoder;
  private final ExecutionService executionService;
  private final ResultDecoder resultDecoder;
  private final PlotFormatDecoder plotFormatDecoder;
  private final PlotRenderer plotRenderer;
  private final MeterRegistry meterRegistry;
  private final Executor subWedgeExecutor;

  public BatchOrchestrator(
      ImageHeaderService imageHeaderService,
      CommandEncoder commandEncoder,
      ExecutionService executionService,
      ResultDecoder resultDecoder,
      PlotFormatDecoder plotFormatDecoder,
      PlotRenderer plotRenderer,
      MeterRegistry meterRegistry,
      @Qualifier("subWedgeExecutor") Executor subWedgeExecutor) {
    this.imageHeaderService = imageHeaderService;
    this.commandEncoder = commandEncoder;
    this.executionService = executionService;
    this.resultDecoder = resultDecoder;
    this.plotFormatDecoder = plotFormatDecoder;
    this.plotRenderer = plotRenderer;
    this.meterRegistry = meterRegistry;
    this.subWedgeExecutor = subWedgeExecutor;
  }

  /**
   * Runs the batches one after the other.
   *
   * @param images all images of the run
   * @param batches batches over {@code images}, in processing order
   * @param options settings shared by all batches
   * @return records of the successful batches in batch order
   */
  @Timed(value = "dozor.run", description = "Time to run all batches of a run")
  public RunResult runAll(ImageMap images, List<Batch> batches, RunOptions options) {
    log.info("Running dozor on {} images in {} batches", images.size(), batches.size());
    return aggregate(runEach(images, batches, options), options);
  }

  /**
   * Runs independent single-image units at the same time, one thread each. Used for sub-wedges,
   * which may reuse image numbers, so every unit gets its own working directory.
   *
   * @param units images of each unit
   * @param options settings shared by all units; each unit works in a numbered subdirectory
   * @return results of the units that produced records, in the order of {@code units} whatever
   *     order they finish in
   */
  @Timed(value = "dozor.run.concurrent", description = "Time to run concurrent sub-wedges")
  public List<RunResult> runConcurrently(List<ImageMap> units, RunOptions options) {
    log.info("Running dozor on {} sub-wedges concurrently", units.size());
    List<CompletableFuture<RunResult>> futures = new ArrayList<>();
    for (int index = 0; index < units.size(); index++) {
      ImageMap unit = units.get(index);
      RunOptions unitOptions =
          options.toBuilder()
              .workingDirectory(
                  options
                      .workingDirectory()
                      .resolve(String.format(Locale.ROOT, "subwedge_%03d", index + 1)))
              .build();
      List<Batch> batches =
          unit.imageNumbers().stream().map(imageNumber -> Batch.of(imageNumber)).toList();
      futures.add(
          CompletableFuture.supplyAsync(
                  () -> aggregate(runEach(unit, batches, unitOptions), unitOptions),
                  subWedgeExecutor)
              .exceptionally(
                  t -> {
                    log.error("Sub-wedge {} failed: {}", unit, t.getMessage(), t);
                    return null;
                  }));
    }
    CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

    List<RunResult> results = new ArrayList<>();
    for (CompletableFuture<RunResult> future : futures) {
      RunResult result = future.join();
      if (result != null && result.failedBatchCount() < result.batchCount()) {
        results.add(result);
      }
    }
    if (results.size() < units.size()) {
      log.warn("{} of {} sub-wedges failed", units.size() - results.size(), units.size());
    }
    return results;
  }

  /** Runs one batch. Never throws; failures are logged and reported in the outcome. */
  public BatchOutcome runBatch(ImageMap images, Batch batch, RunOptions options) {
    Path workingDirectory = batchDirectory(options.workingDirectory(), batch);
    String image = images.get(batch.first());
    String detectorType = null;
    try {
      boolean hdf5 = ImageFileNames.isHdf5(image);
      int imageNumber = ImageFileNames.getImageNumber(image);
      String headerPath =
          hdf5 ? ImageFileNames.getHdf5MasterPath(image, HDF5_FILE_NUMBER) : image;
      ImageHeader header = imageHeaderService.readHeader(headerPath);
      detectorType = header.detectorType();

      int firstImageNumber = hdf5 && options.overlapMode() ? 1 : imageNumber;
      RunParameters params =
          RunParameters.builder()
              .detectorType(detectorType)
              .beamline(options.beamline())
              .exposureTime(header.exposureTime())
              .spotSize(SPOT_SIZE)
              .detectorDistance(header.distance())
              .wavelength(header.wavelength())
              .orgx(header.beamPositionX() / header.pixelSizeX())
              .orgy(header.beamPositionY() / header.pixelSizeY())
              .oscillationRange(header.oscillationWidth())
              .startingAngle(header.rotationAxisStart())
              .firstImageNumber(firstImageNumber)
              .numberImages(batch.size())
              .nameTemplateImage(nameTemplate(image, header, firstImageNumber))
              .wedgeNumber(options.wedgeNumber())
              .overlap(options.overlap())
              .radiationDamage(options.radiationDamage())
              .submit(options.submit())
              .mesh(options.mesh())
              .build();

      ExecutionResult execution =
          executionService.runDozor(
              new ExecutionRequest(
                  commandEncoder.encode(params),
                  workingDirectory,
                  options.submit(),
                  options.mesh(),
                  options.radiationDamage()));
      if (!execution.success()) {
        log.warn(
            "dozor failed for images {}-{} (exit code {}), see {}",
            batch.first(),
            batch.last(),
            execution.exitCode(),
            workingDirectory);
        meterRegistry.counter("dozor.batch.failure").increment();
        return BatchOutcome.failed(batch, detectorType, workingDirectory);
      }

      DecodedLog decodedLog =
          restoreHdf5Number(
              resultDecoder.decode(execution.output(), params, workingDirectory), imageNumber);
      List<Path> plotFiles = renderPlots(workingDirectory);
      Path meshFile = options.mesh() ? joinBatchMeshResults(workingDirectory) : null;
      meterRegistry.counter("dozor.batch.success").increment();
      log.debug(
          "Batch {}-{} produced {} records",
          batch.first(),
          batch.last(),
          decodedLog.records().size());
      return new BatchOutcome(
          batch, true, detectorType, decodedLog, workingDirectory, plotFiles, meshFile);
    } catch (RuntimeException e) {
      log.warn("Batch {}-{} failed: {}", batch.first(), batch.last(), e.getMessage(), e);
      meterRegistry.counter("dozor.batch.failure").increment();
      return BatchOutcome.failed(batch, detectorType, workingDirectory);
    }
  }

  private List<BatchOutcome> runEach(ImageMap images, List<Batch> batches, RunOptions options) {
    List<BatchOutcome> outcomes = new ArrayList<>();
    for (Batch batch : batches) {
      outcomes.add(runBatch(images, batch, options));
    }
    return outcomes;
  }

  /** Working directory of a batch, named after its first and last image numbers. */
  static Path batchDirectory(Path root, Batch batch) {
    return root.resolve(String.format(Locale.ROOT, "%04d_%04d", batch.first(), batch.last()));
  }

  /**
   * Template handed to dozor: the image directory as seen by the header service and the file name
   * with its number replaced by {@code ?} characters.
   */
  static String nameTemplate(String image, ImageHeader header, int firstImageNumber) {
    String prefix = ImageFileNames.getPrefix(image);
    String suffix = ImageFileNames.getSuffix(image);
    String fileTemplate;
    if (ImageFileNames.isHdf5(image)) {
      fileTemplate = prefix + "_" + HDF5_FILE_NUMBER + "_??????." + suffix;
    } else if (firstImageNumber < 10000) {
      fileTemplate = prefix + "_????." + suffix;
    } else {
      fileTemplate = prefix + "_?????." + suffix;
    }
    String headerImage = header.imagePath() != null ? header.imagePath() : image;
    Path directory = Path.of(headerImage).getParent();
    return directory == null ? fileTemplate : directory.resolve(fileTemplate).toString();
  }

  /** A single HDF5 image run with its number reset to 1 reports the image under number 1. */
  private static DecodedLog restoreHdf5Number(DecodedLog decodedLog, int imageNumber) {
    List<ImageResultRecord> records = decodedLog.records();
    if (records.size() == 1
        && records.get(0).getImage().endsWith(".h5")
        && records.get(0).getNumber() != imageNumber) {
      return new DecodedLog(
          List.of(records.get(0).toBuilder().number(imageNumber).build()),
          decodedLog.halfDoseTime());
    }
    return decodedLog;
  }

  private List<Path> renderPlots(Path workingDirectory) {
    Path plotFile = workingDirectory.resolve(RADIATION_DAMAGE_PLOT_FILE);
    if (!Files.exists(plotFile)) {
      return List.of();
    }
    try {
      PlotDocument document =
          plotFormatDecoder.decode(Files.readString(plotFile, StandardCharsets.UTF_8));
      return plotRenderer.render(document, workingDirectory);
    } catch (PlotFormatException e) {
      log.warn("Skipping plots of {}: line {}: {}", plotFile, e.getLineNumber(), e.getMessage());
    } catch (IOException | UncheckedIOException e) {
      log.warn("Skipping plots of {}: {}", plotFile, e.getMessage());
    }
    return List.of();
  }

  /** Joins the {@code *.all} files dozor wrote in mesh mode, in file name order. */
  private Path joinBatchMeshResults(Path workingDirectory) {
    List<Path> parts = new ArrayList<>();
    try (DirectoryStream<Path> stream =
        Files.newDirectoryStream(workingDirectory, MESH_BATCH_PATTERN)) {
      stream.forEach(parts::add);
      Collections.sort(parts);
      return concatenate(workingDirectory.resolve(MESH_RESULT_FILE), parts);
    } catch (IOException e) {
      log.warn("Could not collect mesh results in {}: {}", workingDirectory, e.getMessage());
      return null;
    }
  }

  /** Run-level mesh file: the batch mesh files appended in batch order. */
  private Path joinRunMeshResults(Path runDirectory, List<BatchOutcome> outcomes) {
    List<Path> parts =
        outcomes.stream()
            .filter(BatchOutcome::success)
            .map(BatchOutcome::meshFile)
            .filter(Objects::nonNull)
            .toList();
    try {
      Files.createDirectories(runDirectory);
      return concatenate(runDirectory.resolve(MESH_RESULT_FILE), parts);
    } catch (IOException e) {
      log.warn("Could not write mesh results in {}: {}", runDirectory, e.getMessage());
      return null;
    }
  }

  private static Path concatenate(Path target, List<Path> parts) throws IOException {
    try (OutputStream out = Files.newOutputStream(target)) {
      for (Path part : parts) {
        Files.copy(part, out);
      }
    }
    return target;
  }

  private RunResult aggregate(List<BatchOutcome> outcomes, RunOptions options) {
    List<ImageResultRecord> records = new ArrayList<>();
    List<Path> plotFiles = new ArrayList<>();
    String detectorType = null;
    Double halfDoseTime = null;
    int failed = 0;
    for (BatchOutcome outcome : outcomes) {
      if (outcome.detectorType() != null) {
        detectorType = outcome.detectorType();
      }
      if (!outcome.success()) {
        failed++;
        continue;
      }
      records.addAll(outcome.records());
      plotFiles.addAll(outcome.plotFiles());
      if (outcome.decodedLog().halfDoseTime() != null) {
        halfDoseTime = outcome.decodedLog().halfDoseTime();
      }
    }
    if (failed > 0) {
      log.warn("{} of {} batches failed", failed, outcomes.size());
    }
    log.info("Collected {} image results from {} batches", records.size(), outcomes.size());
    Path meshFile =
        options.mesh() ? joinRunMeshResults(options.workingDirectory(), outcomes) : null;
    return new RunResult(
        records,
        detectorType,
        halfDoseTime,
        outcomes.size(),
        failed,
        plotFiles,
        null,
        null,
        meshFile);
  }
}
