package com.flamingo.dozor.service.orchestration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.dozor.api.dto.request.RunRequest;
import com.flamingo.dozor.config.DozorConfig;
import com.flamingo.dozor.domain.Batch;
import com.flamingo.dozor.domain.DataCollection;
import com.flamingo.dozor.domain.ExecutionResult;
import com.flamingo.dozor.domain.ImageMap;
import com.flamingo.dozor.domain.ImageResultRecord;
import com.flamingo.dozor.domain.RunResult;
import com.flamingo.dozor.exception.ConfigurationException;
import com.flamingo.dozor.service.artifact.QualityIndicatorUploader;
import com.flamingo.dozor.service.batch.BatchPartitioner;
import com.flamingo.dozor.service.catalog.DataCollectionCatalog;
import com.flamingo.dozor.service.execution.ExecutionService;
import com.flamingo.dozor.service.image.ImageSetResolver;
import com.flamingo.dozor.service.parsing.SpotFileReader;
import com.flamingo.dozor.service.plot.QualitySummary;
import com.flamingo.dozor.service.plot.QualitySummaryWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("DozorRunService Tests")
class DozorRunServiceTest {

  @Mock private DataCollectionCatalog dataCollectionCatalog;
  @Mock private BatchOrchestrator batchOrchestrator;
  @Mock private QualitySummaryWriter qualitySummaryWriter;
  @Mock private ExecutionService executionService;
  @Mock private QualityIndicatorUploader qualityIndicatorUploader;
  @Mock private SpotFileReader spotFileReader;

  @TempDir Path tempDir;

  private DozorConfig config;
  private DozorRunService service;

  @BeforeEach
  void setUp() {
    config = new DozorConfig();
    config.setWorkingDirectory(tempDir.resolve("runs").toString());
    service =
        new DozorRunService(
            config,
            dataCollectionCatalog,
            new ImageSetResolver(),
            new BatchPartitioner(),
            batchOrchestrator,
            qualitySummaryWriter,
            executionService,
            qualityIndicatorUploader,
            spotFileReader);
  }

  private static RunResult result(List<ImageResultRecord> records) {
    return new RunResult(records, "pilatus6m", null, 1, 0, List.of(), null, null, null);
  }

  private static ImageResultRecord record(int number) {
    return ImageResultRecord.builder().number(number).image("img" + number).build();
  }

  @SuppressWarnings("unchecked")
  private ArgumentCaptor<List<Batch>> batchesCaptor() {
    return ArgumentCaptor.forClass(List.class);
  }

  @Nested
  @DisplayName("Batch size")
  class BatchSize {

    @Test
    @DisplayName("Should cap a requested batch size at the configured maximum")
    void shouldCapRequestedBatchSize() {
      config.getBatch().setMaxSize(100);

      assertThat(service.requestBatchSize(RunRequest.builder().batchSize(10).build()))
          .isEqualTo(10);
      assertThat(service.requestBatchSize(RunRequest.builder().batchSize(1000).build()))
          .isEqualTo(100);
      assertThat(service.requestBatchSize(RunRequest.builder().build())).isEqualTo(100);
    }

    @Test
    @DisplayName("Should prefer the configured default over the data collection size")
    void shouldChooseCatalogBatchSize() {
      DataCollection dataCollection = new DataCollection(1L, "/d", "m_%04d.cbf", 1, 8000, null);

      assertThat(service.catalogBatchSize(dataCollection)).isEqualTo(5000);

      config.getBatch().setDefaultSize(50);
      assertThat(service.catalogBatchSize(dataCollection)).isEqualTo(50);
    }
  }

  @Test
  @DisplayName("Should run an explicit image list without writing a summary")
  void shouldRunExplicitImages() {
    when(batchOrchestrator.runAll(any(ImageMap.class), anyList(), any(RunOptions.class)))
        .thenReturn(result(List.of(record(1), record(2))));

    RunResult result =
        service.run(
            RunRequest.builder()
                .images(List.of("/data/mesh_1_0001.cbf", "/data/mesh_1_0002.cbf"))
                .batchSize(1)
                .beamline("id23eh2")
                .build());

    ArgumentCaptor<List<Batch>> batches = batchesCaptor();
    ArgumentCaptor<RunOptions> options = ArgumentCaptor.forClass(RunOptions.class);
    verify(batchOrchestrator).runAll(any(ImageMap.class), batches.capture(), options.capture());
    assertThat(batches.getValue()).hasSize(2);
    assertThat(options.getValue().overlapMode()).isFalse();
    assertThat(options.getValue().beamline()).isEqualTo("id23eh2");
    assertThat(options.getValue().workingDirectory()).startsWithRaw(tempDir.resolve("runs"));
    assertThat(result.records()).hasSize(2);
    verifyNoInteractions(qualitySummaryWriter, qualityIndicatorUploader);
  }

  @Test
  @DisplayName("Should switch to single-image batches when the request sets an overlap")
  void shouldUseOverlapModeForRequestOverlap() {
    when(batchOrchestrator.runAll(any(ImageMap.class), anyList(), any(RunOptions.class)))
        .thenReturn(result(List.of()));

    service.run(
        RunRequest.builder()
            .directory("/data")
            .template("mesh_1_####.cbf")
            .startNo(1)
            .endNo(3)
            .overlap(-0.5)
            .build());

    ArgumentCaptor<List<Batch>> batches = batchesCaptor();
    ArgumentCaptor<RunOptions> options = ArgumentCaptor.forClass(RunOptions.class);
    verify(batchOrchestrator).runAll(any(ImageMap.class), batches.capture(), options.capture());
    assertThat(batches.getValue()).extracting(Batch::size).containsOnly(1);
    assertThat(options.getValue().overlapMode()).isTrue();
    assertThat(options.getValue().overlap()).isEqualTo(-0.5);
  }

  @Test
  @DisplayName("Should attach spot tables when asked to")
  void shouldAttachSpotLists() {
    ImageResultRecord withSpots = record(1).toBuilder().spotFile("/run/00001.spot").build();
    when(batchOrchestrator.runAll(any(ImageMap.class), anyList(), any(RunOptions.class)))
        .thenReturn(result(List.of(withSpots, record(2))));
    when(spotFileReader.read(Path.of("/run/00001.spot"))).thenReturn(new double[][] {{1, 2}});

    RunResult result =
        service.run(
            RunRequest.builder()
                .images(List.of("/data/mesh_1_0001.cbf", "/data/mesh_1_0002.cbf"))
                .returnSpotList(true)
                .build());

    assertThat(result.records().get(0).getSpotList()).hasNumberOfRows(1);
    assertThat(result.records().get(1).getSpotList()).isNull();
  }

  @Test
  @DisplayName("Should fail when neither images nor a range are given")
  void shouldRejectRequestWithoutImages() {
    assertThatThrownBy(() -> service.run(RunRequest.builder().build()))
        .isInstanceOf(ConfigurationException.class);
  }

  @Nested
  @DisplayName("Catalog data collections")
  class Catalog {

    private final DataCollection dataCollection =
        new DataCollection(42L, "/data", "mesh_1_%04d.cbf", 1, 4, 2.0);

    @BeforeEach
    void setUp() {
      when(dataCollectionCatalog.getDataCollection(42L)).thenReturn(dataCollection);
      when(batchOrchestrator.runAll(any(ImageMap.class), anyList(), any(RunOptions.class)))
          .thenReturn(result(List.of(record(1))));
    }

    @Test
    @DisplayName("Should use the catalog overlap and write, plot and upload the summary")
    void shouldWriteAndUploadSummary() throws IOException {
      Path csv = Files.writeString(tempDir.resolve("dozor_42.csv"), "csv");
      Path script = Files.writeString(tempDir.resolve("gnuplot.sh"), "plot");
      Path plot = Files.writeString(tempDir.resolve("dozor_42.png"), "png");
      when(qualitySummaryWriter.write(
              any(Path.class), eq(42L), eq("/data"), anyString(), anyList()))
          .thenReturn(new QualitySummary(csv, script, plot));
      when(executionService.runCommand(anyList(), any(Path.class), anyString()))
          .thenReturn(new ExecutionResult(true, "", 0, tempDir));
      Path processDirectory = tempDir.resolve("process");

      RunResult result =
          service.run(
              RunRequest.builder()
                  .dataCollectionId(42L)
                  .processDirectory(processDirectory.toString())
                  .upload(true)
                  .build());

      ArgumentCaptor<RunOptions> options = ArgumentCaptor.forClass(RunOptions.class);
      verify(batchOrchestrator).runAll(any(ImageMap.class), anyList(), options.capture());
      assertThat(options.getValue().overlapMode()).isTrue();
      assertThat(options.getValue().overlap()).isEqualTo(2.0);
      verify(executionService)
          .runCommand(
              eq(List.of("gnuplot", "gnuplot.sh")),
              any(Path.class),
              eq(DozorRunService.GNUPLOT_LOG));
      verify(qualityIndicatorUploader).upload(42L, csv, plot);
      assertThat(processDirectory.resolve("results/dozor_42.csv")).exists();
      assertThat(processDirectory.resolve("results/dozor_42.png")).exists();
      assertThat(result.summaryCsv()).isEqualTo(csv);
      assertThat(result.summaryPlot()).isEqualTo(plot);
    }

    @Test
    @DisplayName("Should skip plotting when no row was complete")
    void shouldSkipPlotWithoutScript() throws IOException {
      Path csv = Files.writeString(tempDir.resolve("dozor_42.csv"), "csv");
      when(qualitySummaryWriter.write(
              any(Path.class), eq(42L), eq("/data"), anyString(), anyList()))
          .thenReturn(new QualitySummary(csv, null, null));

      RunResult result = service.run(RunRequest.builder().dataCollectionId(42L).build());

      verifyNoInteractions(executionService);
      verify(qualityIndicatorUploader, never()).upload(anyLong(), any(), any());
      assertThat(result.summaryCsv()).isEqualTo(csv);
      assertThat(result.summaryPlot()).isNull();
    }
  }
}
