package com.gearcheck.matching;

import com.gearcheck.AppLogger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Locates and reads script files, feeding them through a {@link ReferenceExtractor}.
 */
public class ScriptSources {

    public static final String SCRIPT_GLOB = "*.lua";

    private final ReferenceExtractor extractor;

    public ScriptSources(ReferenceExtractor extractor) {
        this.extractor = extractor != null ? extractor : new ReferenceExtractor();
    }

    /**
     * Script files under a path: the {@code *.lua} files directly inside a folder, sorted by
     * name, or the path itself when it is a regular file.
     */
    public static List<Path> discover(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString());
        }
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(path)) {
            files.add(path);
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(path, SCRIPT_GLOB)) {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) {
                    files.add(file);
                }
            }
        }
        files.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return files;
    }

    /**
     * Reads one file. Invalid UTF-8 sequences decode to U+FFFD; only I/O failures make the
     * result a failure.
     */
    public ExtractionResult read(Path file) {
        String source = file.getFileName() != null ? file.getFileName().toString() : file.toString();
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            return ExtractionResult.unreadable(source, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        String text = new String(bytes, StandardCharsets.UTF_8);
        return ExtractionResult.of(source, extractor.extract(text));
    }

    public ExtractionBatch readAll(List<Path> files) {
        AppLogger logger = AppLogger.get();
        ExtractionBatch batch = new ExtractionBatch();
        for (Path file : files) {
            ExtractionResult result = read(file);
            if (result.isFailed()) {
                if (logger != null) {
                    logger.warn("Skipping script " + result.getSource() + ": " + result.getErrorDetail());
                }
            } else if (result.isEmpty() && logger != null) {
                logger.info("No item references in " + result.getSource());
            }
            batch.add(result);
        }
        return batch;
    }
}
