package com.filterbench.service;

import com.filterbench.config.AppConfig;
import com.filterbench.model.FilterTask;
import com.filterbench.model.FilterType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns user-supplied paths into the list of images to process, and prepares
 * the folder the filtered images go to.
 */
@Service
public class ImageCatalogService {

    private static final Logger log = LoggerFactory.getLogger(ImageCatalogService.class);
    private static final String[] SUPPORTED_EXTENSIONS = { "png", "jpg", "jpeg", "bmp", "gif" };

    private final AppConfig appConfig;

    public ImageCatalogService(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    /**
     * Collects supported images from files and folders (folders are not
     * descended into). Duplicates are dropped; first-seen order is kept.
     */
    public List<Path> collectImages(List<String> paths) {
        Set<Path> images = new LinkedHashSet<>();
        if (paths == null) {
            return new ArrayList<>(images);
        }
        for (String raw : paths) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            Path path = Paths.get(raw.trim()).toAbsolutePath().normalize();
            if (Files.isDirectory(path)) {
                images.addAll(listDirectory(path));
            } else if (Files.isRegularFile(path) && isSupportedImage(path)) {
                images.add(path);
            } else {
                log.debug("Skipping {}: not a supported image", path);
            }
        }
        return new ArrayList<>(images);
    }

    /**
     * Returns true if the file has a supported image extension.
     */
    public boolean isSupportedImage(Path path) {
        if (path == null || path.getFileName() == null)
            return false;
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String ext : SUPPORTED_EXTENSIONS) {
            if (name.endsWith("." + ext))
                return true;
        }
        return false;
    }

    /**
     * Creates the output folder if needed. A blank folder means the configured
     * default.
     */
    public Path prepareOutputDirectory(String outputDir) throws IOException {
        String dir = outputDir != null && !outputDir.isBlank() ? outputDir.trim() : appConfig.getOutputDir();
        Path path = Paths.get(dir).toAbsolutePath().normalize();
        Files.createDirectories(path);
        return path;
    }

    public List<FilterTask> buildTasks(List<Path> images, FilterType filter, Path outputDir, String methodTag) {
        List<FilterTask> tasks = new ArrayList<>(images.size());
        for (Path image : images) {
            tasks.add(new FilterTask(image.toString(), filter, outputDir.toString(), methodTag));
        }
        return tasks;
    }

    private List<Path> listDirectory(Path dir) {
        List<Path> found = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path entry : stream) {
                if (Files.isRegularFile(entry) && isSupportedImage(entry)) {
                    found.add(entry.toAbsolutePath().normalize());
                }
            }
        } catch (IOException e) {
            log.warn("Could not list folder {}: {}", dir, e.getMessage());
        }
        found.sort(null);
        return found;
    }
}
