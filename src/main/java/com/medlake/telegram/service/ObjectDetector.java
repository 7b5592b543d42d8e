package com.medlake.telegram.service;

import com.medlake.telegram.model.DetectedObject;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Vision model that finds objects in an image.
 */
public interface ObjectDetector {

    /**
     * @return findings with confidence in [0, 1]; empty when nothing was recognised
     * @throws IOException         when the image cannot be read or inference fails
     * @throws ThrottledException  when the provider keeps throttling after retries
     */
    List<DetectedObject> detect(Path image) throws IOException;

    /** Model name recorded next to the results. */
    String modelName();
}
