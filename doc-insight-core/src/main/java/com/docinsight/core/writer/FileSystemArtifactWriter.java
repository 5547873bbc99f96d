package com.docinsight.core.writer;

import com.docinsight.core.model.DiagramType;
import com.docinsight.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Writer that persists a job's files to the filesystem.
 *
 * <p>Every file goes through a sibling temp file and a rename, so readers never see a
 * half-written file. The narrative is staged before any diagram is written and published
 * after the last one; a failed publish deletes the job's diagram files again. When a diagram
 * could not be written, the narrative is recomposed without it before publishing, so the
 * published document never links a missing file.
 *
 * <p><b>Layout:</b>
 * <pre>
 * &lt;outputDirectory&gt;/&lt;EntityName&gt;.md
 * &lt;outputDirectory&gt;/diagrams/&lt;slug&gt;-&lt;type&gt;.puml
 * &lt;outputDirectory&gt;/images/&lt;slug&gt;-&lt;type&gt;.png
 * </pre>
 */
public class FileSystemArtifactWriter implements ArtifactWriter {

    private static final Logger log = LoggerFactory.getLogger(FileSystemArtifactWriter.class);

    /** Directory for diagram sources, relative to the output directory. */
    public static final String DIAGRAMS_DIR = "diagrams";

    /** Directory for rendered images, relative to the output directory. */
    public static final String IMAGES_DIR = "images";

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public WriteReceipt write(GeneratedOutput output, WriteContext context) {
        Path outputDir = context.outputDirectory();
        Path narrativeTarget = outputDir.resolve(output.narrative().relativePath());
        log.info("Writing narrative and {} diagram(s) to {}", output.diagrams().size(), outputDir);

        Path staged;
        try {
            Files.createDirectories(outputDir);
            staged = FileUtils.stage(narrativeTarget, output.narrative().content());
        } catch (IOException e) {
            throw new WriteFailedException("Failed to write narrative " + narrativeTarget + ": " + e.getMessage(), e,
                List.of());
        }

        List<Path> written = new ArrayList<>();
        List<WriteReceipt.WrittenDiagram> diagrams = new ArrayList<>();
        Map<DiagramType, String> omitted = new EnumMap<>(DiagramType.class);
        for (GeneratedOutput.DiagramFiles files : output.diagrams()) {
            writeDiagram(outputDir, files, written, diagrams, omitted);
        }

        try {
            if (!omitted.isEmpty()) {
                staged = restage(staged, narrativeTarget, output, diagrams);
            }
            FileUtils.publish(staged, narrativeTarget);
        } catch (IOException e) {
            FileUtils.deleteQuietly(staged);
            List<Path> rolledBack = rollback(written);
            log.error("Failed to publish narrative {}; rolled back {} diagram file(s)", narrativeTarget,
                rolledBack.size());
            throw new WriteFailedException("Failed to write narrative " + narrativeTarget + ": " + e.getMessage(), e,
                rolledBack);
        }

        log.info("Wrote {} with {} diagram(s), {} omitted", narrativeTarget.getFileName(), diagrams.size(),
            omitted.size());
        return new WriteReceipt(narrativeTarget, diagrams, omitted);
    }

    private static Path restage(Path staged, Path narrativeTarget, GeneratedOutput output,
                                List<WriteReceipt.WrittenDiagram> diagrams) throws IOException {
        Set<DiagramType> written = diagrams.stream().map(WriteReceipt.WrittenDiagram::type)
            .collect(Collectors.toCollection(() -> EnumSet.noneOf(DiagramType.class)));
        log.info("Recomposing {} to reference only the {} diagram(s) written", narrativeTarget.getFileName(),
            written.size());
        FileUtils.deleteQuietly(staged);
        return FileUtils.stage(narrativeTarget, output.narrativeFor().apply(written));
    }

    @Override
    public List<Path> removeStaleDiagrams(WriteContext context, String slug, Set<DiagramType> keep) {
        List<Path> removed = new ArrayList<>();
        for (DiagramType type : DiagramType.values()) {
            if (keep.contains(type)) {
                continue;
            }
            String name = slug + "-" + type.slug();
            for (Path stale : List.of(
                context.outputDirectory().resolve(DIAGRAMS_DIR).resolve(name + ".puml"),
                context.outputDirectory().resolve(IMAGES_DIR).resolve(name + ".png"))) {
                if (FileUtils.deleteQuietly(stale)) {
                    removed.add(stale);
                }
            }
        }
        if (!removed.isEmpty()) {
            log.info("Removed {} stale diagram file(s) for {}", removed.size(), slug);
        }
        return removed;
    }

    private void writeDiagram(Path outputDir, GeneratedOutput.DiagramFiles files, List<Path> written,
                              List<WriteReceipt.WrittenDiagram> diagrams, Map<DiagramType, String> omitted) {
        List<Path> thisDiagram = new ArrayList<>(2);
        try {
            Path source = writeFile(outputDir, files.source());
            thisDiagram.add(source);

            Path image = null;
            if (files.image() != null) {
                image = writeFile(outputDir, files.image());
                thisDiagram.add(image);
            } else {
                Path previousImage = outputDir.resolve(IMAGES_DIR)
                    .resolve(FileUtils.getBaseName(source) + ".png");
                if (FileUtils.deleteQuietly(previousImage)) {
                    log.debug("Removed outdated image {}", previousImage);
                }
            }

            written.addAll(thisDiagram);
            diagrams.add(new WriteReceipt.WrittenDiagram(files.type(), source, image));
        } catch (IOException e) {
            log.warn("Omitting {} diagram: {}", files.type().slug(), e.getMessage());
            thisDiagram.forEach(FileUtils::deleteQuietly);
            omitted.put(files.type(), "write failed: " + e.getMessage());
        }
    }

    private Path writeFile(Path outputDir, GeneratedFile file) throws IOException {
        Path target = outputDir.resolve(file.relativePath());
        if (file.content() != null) {
            FileUtils.writeAtomically(target, file.content());
        } else {
            FileUtils.copyAtomically(file.sourcePath(), target);
        }
        log.debug("Wrote file: {}", file.relativePath());
        return target;
    }

    private static List<Path> rollback(List<Path> written) {
        List<Path> deleted = new ArrayList<>();
        for (Path path : written) {
            if (FileUtils.deleteQuietly(path)) {
                deleted.add(path);
            }
        }
        return deleted;
    }
}
