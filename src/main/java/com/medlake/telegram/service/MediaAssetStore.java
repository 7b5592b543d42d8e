package com.medlake.telegram.service;

import com.medlake.telegram.config.PipelineProperties;
import com.medlake.telegram.model.MediaAssetName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Filesystem store for downloaded media assets. Paths are derived from {@link MediaAssetName}, so a
 * second download of the same photo is answered by the file already on disk.
 */
@Service
public class MediaAssetStore {

    private static final Logger logger = LoggerFactory.getLogger(MediaAssetStore.class);

    static final Set<String> IMAGE_EXTENSIONS = Set.of("jpg", "jpeg", "png", "gif");

    private final Path assetsDir;

    @Autowired
    public MediaAssetStore(PipelineProperties properties) {
        this(Paths.get(properties.getLake().getBasePath()).resolve(properties.getLake().getImagesDir()));
    }

    MediaAssetStore(Path assetsDir) {
        this.assetsDir = assetsDir;
    }

    public Path assetsDir() {
        return assetsDir;
    }

    public Path pathOf(MediaAssetName name) {
        return assetsDir.resolve(name.fileName());
    }

    /**
     * Returns the asset's path, downloading it first when it is not on disk yet.
     *
     * @param download supplies the asset bytes; only called when the file is missing
     */
    public Stored ensurePresent(MediaAssetName name, Supplier<byte[]> download) throws IOException {
        Path target = pathOf(name);
        if (Files.isRegularFile(target)) {
            logger.debug("Media asset {} already present", target);
            return new Stored(target, false);
        }
        byte[] bytes = download.get();
        Files.createDirectories(assetsDir);
        Path temp = Files.createTempFile(assetsDir, "." + name.fileName(), ".part");
        try {
            Files.write(temp, bytes);
            moveIntoPlace(temp, target);
        } catch (FileAlreadyExistsException e) {
            // a concurrent crawl of the same message won the race
            logger.debug("Media asset {} appeared while downloading", target);
            return new Stored(target, false);
        } finally {
            Files.deleteIfExists(temp);
        }
        return new Stored(target, true);
    }

    /**
     * Lists image files in the assets directory, sorted by name. A missing directory has no assets.
     */
    public List<Path> listAssets() throws IOException {
        if (!Files.isDirectory(assetsDir)) {
            logger.info("Media assets directory {} does not exist yet", assetsDir);
            return List.of();
        }
        List<Path> assets = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(assetsDir, MediaAssetStore::isImageFile)) {
            for (Path path : stream) {
                assets.add(path);
            }
        }
        assets.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return assets;
    }

    static boolean isImageFile(Path path) {
        if (!Files.isRegularFile(path)) {
            return false;
        }
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 && IMAGE_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        if (Files.exists(target)) {
            throw new FileAlreadyExistsException(target.toString());
        }
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target);
        }
    }

    /**
     * @param downloaded false when the file was already on disk
     */
    public record Stored(Path path, boolean downloaded) {
    }
}
