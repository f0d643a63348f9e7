package com.flamingo.dozor.service.orchestration;

import java.nio.file.Path;
import lombok.Builder;

/**
 * Settings shared by all batches of one run.
 *
 * @param workingDirectory root under which each batch gets its own directory
 * @param overlap angular overlap between consecutive images
 * @param overlapMode whether batches are single images because images overlap
 * @param beamline beamline name used to look up the site's bad region, or null
 * @param wedgeNumber wedge number passed to dozor, or null
 * @param radiationDamage run the radiation damage analysis
 * @param submit run dozor through the cluster scheduler
 * @param mesh run the mesh analysis
 */
@Builder(toBuilder = true)
public record RunOptions(
    Path workingDirectory,
    double overlap,
    boolean overlapMode,
    String beamline,
    Integer wedgeNumber,
    boolean radiationDamage,
    boolean submit,
    boolean mesh) {}
