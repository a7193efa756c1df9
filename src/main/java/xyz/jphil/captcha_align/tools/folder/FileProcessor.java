package xyz.jphil.captcha_align.tools.folder;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Finds captcha descriptors in a folder (and subfolders if recursive).
 * Result files written by earlier runs are skipped.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public class FileProcessor {

    static final String CAPTCHA_EXTENSION = ".json";
    static final String RESULT_MARKER = ".aligned.";

    private final Path rootFolder;
    private final boolean recursive;

    public List<Path> discoverFiles() throws IOException {
        try (Stream<Path> paths = recursive ?
            Files.walk(rootFolder) : Files.list(rootFolder)) {

            return paths
                .filter(Files::isRegularFile)
                .filter(FileProcessor::isCaptchaFile)
                .sorted()
                .toList();
        }
    }

    static boolean isCaptchaFile(Path file) {
        String name = file.getFileName().toString().toLowerCase();
        return name.endsWith(CAPTCHA_EXTENSION) && !name.contains(RESULT_MARKER);
    }

    /**
     * Output path mirroring the file's location below the root.
     * <p>
     * /source/a/c.json with root /target and suffix .aligned.png gives /target/a/c.json.aligned.png
     */
    public Path outputPath(Path inputFile, Path outputRoot, String suffix) {
        Path relativePath = rootFolder.relativize(inputFile);
        return outputRoot.resolve(relativePath + suffix);
    }
}
