package io.timelapse4j;

import io.timelapse4j.core.Camera;

import java.util.Map;

/**
 * Supplies the current configuration snapshot, keyed by camera name.
 */
@FunctionalInterface
public interface CameraSource {
    Map<String, Camera> cameras();
}
