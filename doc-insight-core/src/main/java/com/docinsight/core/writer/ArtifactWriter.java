package com.docinsight.core.writer;

import com.docinsight.core.model.DiagramType;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Persists a job's narrative and diagrams with all-or-nothing semantics for the narrative.
 *
 * <p>Contract:
 * <ul>
 *   <li>The narrative is prepared first; if that fails nothing is written.</li>
 *   <li>Diagram files follow. A diagram that cannot be written is omitted and reported;
 *       the others are kept.</li>
 *   <li>The narrative is published last. If publishing fails, every diagram file written
 *       for the job is deleted and {@link WriteFailedException} is thrown, so no diagram is
 *       left without its document.</li>
 *   <li>Existing files are overwritten (last write wins).</li>
 * </ul>
 *
 * <p>Writers are only called after all diagram tasks of a job have finished; they are the
 * only component that mutates the output directory.
 */
public interface ArtifactWriter {

    /**
     * Returns unique identifier for this writer (e.g., "filesystem").
     *
     * @return writer identifier
     */
    String getId();

    /**
     * Writes a job's output.
     *
     * @param output files to write
     * @param context output location and settings
     * @return what was written and what was omitted
     * @throws WriteFailedException if the narrative could not be written
     */
    WriteReceipt write(GeneratedOutput output, WriteContext context);

    /**
     * Deletes diagram files of {@code slug} left over from earlier runs for types this run
     * does not produce.
     *
     * @param context output location
     * @param slug kebab-case entity name
     * @param keep types about to be written
     * @return deleted files
     */
    List<Path> removeStaleDiagrams(WriteContext context, String slug, Set<DiagramType> keep);
}
