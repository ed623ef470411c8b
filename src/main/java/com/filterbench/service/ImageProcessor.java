package com.filterbench.service;

import com.filterbench.filter.FilterTransforms;
import com.filterbench.filter.RgbFilter;
import com.filterbench.model.FilterResult;
import com.filterbench.model.FilterTask;
import net.coobird.thumbnailator.Thumbnails;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Applies the filter of one {@link FilterTask} and writes the output image.
 *
 * This is the unit of work every execution strategy schedules. It never
 * throws: anything that goes wrong while reading, transforming or writing the
 * image becomes an ERROR result, so a bad file cannot abort its siblings.
 *
 * Each call first waits {@code minLatencyMs}, which gives every task the same
 * latency floor and makes concurrency gains visible on small images.
 * The same class runs inside the worker processes of the process-pool
 * strategy, so it must not depend on the Spring context.
 */
public class ImageProcessor {

    private static final Logger log = LoggerFactory.getLogger(ImageProcessor.class);

    private final FilterTransforms transforms;
    private final RgbFilter rgbFilter = new RgbFilter();
    private final long minLatencyMs;

    public ImageProcessor(FilterTransforms transforms, long minLatencyMs) {
        if (minLatencyMs < 0) {
            throw new IllegalArgumentException("Latency floor must not be negative, got " + minLatencyMs);
        }
        this.transforms = transforms;
        this.minLatencyMs = minLatencyMs;
    }

    public FilterResult execute(FilterTask task) {
        String baseName = task.getSourceFileName();
        try {
            // resolves the path first; an unresolvable one fails here, inside the try
            Path source = task.getSource();
            if (minLatencyMs > 0) {
                Thread.sleep(minLatencyMs);
            }

            Path output = outputPathFor(task);
            Files.createDirectories(output.getParent());

            Thumbnails.of(source.toFile())
                    .scale(1.0)
                    .addFilter(rgbFilter)
                    .addFilter(transforms.forType(task.getFilter()))
                    .toFile(output.toFile());

            log.debug("Wrote {} ({}, {})", output, task.getFilter(), task.getMethodTag());
            return FilterResult.ok(task, output.toString(),
                    "Processed: " + baseName + " (" + task.getMethodTag() + ")");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FilterResult.error(task, "Error in " + baseName + ": interrupted before processing");
        } catch (Exception e) {
            log.warn("Failed to filter {}: {}", baseName, describe(e));
            return FilterResult.error(task, "Error in " + baseName + ": " + describe(e));
        }
    }

    /**
     * Output location for a task: {@code {outputDir}/{basename}_{methodTag}{ext}}.
     * The same task always maps to the same path, so re-running overwrites.
     */
    public static Path outputPathFor(FilterTask task) {
        String fileName = task.getSourceFileName();
        int dot = fileName.lastIndexOf('.');
        String name = dot > 0 ? fileName.substring(0, dot) : fileName;
        String ext = dot > 0 ? fileName.substring(dot) : "";
        return Paths.get(task.getOutputDir()).resolve(name + "_" + task.getMethodTag() + ext);
    }

    public long getMinLatencyMs() {
        return minLatencyMs;
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message != null && !message.isBlank() ? message : e.getClass().getSimpleName();
    }
}
