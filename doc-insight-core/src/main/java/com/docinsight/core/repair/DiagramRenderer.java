package com.docinsight.core.repair;

import java.nio.file.Path;
import java.util.Optional;

/**
 * External renderer turning a validated diagram source into an image.
 */
public interface DiagramRenderer {

    /**
     * Renders a source file into the image directory.
     *
     * @param sourceFile validated diagram source file
     * @param imageDirectory directory the image is written to
     * @return the rendered image, or empty if none was produced
     */
    Optional<Path> render(Path sourceFile, Path imageDirectory);
}
