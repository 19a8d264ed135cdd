package io.timelapse4j;

import io.timelapse4j.core.Camera;
import io.timelapse4j.core.CaptureException;

import java.nio.file.Path;

/**
 * Grabs one frame from a camera and stores it.
 *
 * <p>Implementations must write every frame to a unique destination, since captures for
 * the same camera may overlap.
 */
@FunctionalInterface
public interface CaptureAction {

    /**
     * @return path of the stored frame
     * @throws CaptureException when the stream cannot be opened, read or written
     */
    Path capture(Camera camera) throws CaptureException;
}
