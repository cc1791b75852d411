package Presentation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists the images directly inside a folder, ordered by file name so that batches are
 * reproducible between runs.
 */
public final class ImageScanner {

    private static final Logger log = LoggerFactory.getLogger(ImageScanner.class);

    public List<Path> scan(Path folder) throws IOException {
        try (Stream<Path> stream = Files.list(folder)) {
            List<Path> images = stream
                    .filter(Files::isRegularFile)
                    .filter(this::looksLikeImage)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
            log.info("Found {} images in {}", images.size(), folder);
            return images;
        }
    }

    boolean looksLikeImage(Path p) {
        String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".jpg")
                || name.endsWith(".jpeg")
                || name.endsWith(".png")
                || name.endsWith(".bmp")
                || name.endsWith(".gif");
    }
}
