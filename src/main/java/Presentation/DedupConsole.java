package Presentation;

import Model.BatchDeduplicator;
import Model.DetectionConfig;
import Model.DetectionConfigLoader;
import Model.DuplicateDetector;
import Model.H2FingerprintStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Command line entry: {@code <folder> [--settings settings.yaml] [--db ./dedup_db]}.
 */
public final class DedupConsole {

    private static final Logger log = LoggerFactory.getLogger(DedupConsole.class);

    private static final String DEFAULT_DB = "./dedup_db";
    private static final String DEFAULT_SETTINGS = "settings.yaml";

    record Options(Path folder, Path settings, String db) {

        static Options parse(String[] args) {
            Path folder = null;
            Path settings = Paths.get(DEFAULT_SETTINGS);
            String db = DEFAULT_DB;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--settings" -> settings = Paths.get(value(args, ++i, "--settings"));
                    case "--db" -> db = value(args, ++i, "--db");
                    default -> {
                        if (folder != null) throw new IllegalArgumentException("Unexpected argument: " + args[i]);
                        folder = Paths.get(args[i]);
                    }
                }
            }
            if (folder == null) throw new IllegalArgumentException("Missing image folder");
            return new Options(folder, settings, db);
        }

        private static String value(String[] args, int i, String flag) {
            if (i >= args.length) throw new IllegalArgumentException(flag + " needs a value");
            return args[i];
        }
    }

    public static void main(String[] args) {
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("usage: DedupConsole <folder> [--settings settings.yaml] [--db ./dedup_db]");
            System.exit(2);
            return;
        }

        try {
            System.exit(run(options, System.out));
        } catch (IOException e) {
            log.error("Duplicate scan failed", e);
            System.exit(1);
        }
    }

    static int run(Options options, PrintStream out) throws IOException {
        DetectionConfig config = Files.isRegularFile(options.settings())
                ? new DetectionConfigLoader().load(options.settings())
                : DetectionConfig.defaults();

        List<Path> images = new ImageScanner().scan(options.folder());

        try (H2FingerprintStore store = new H2FingerprintStore(options.db())) {
            BatchDeduplicator deduplicator = new BatchDeduplicator(new DuplicateDetector(config), store);
            try {
                print(deduplicator.scan(images), out);
            } finally {
                deduplicator.shutdown();
            }
        }
        return 0;
    }

    static void print(BatchDeduplicator.BatchReport report, PrintStream out) {
        for (BatchDeduplicator.Entry e : report.entries()) {
            String name = e.path().getFileName().toString();
            if (e.duplicate()) {
                out.println("[DUPLICATE] " + name + " -> " + e.reference().getFileName());
            } else if (!e.fingerprinted()) {
                out.println("[UNIQUE]    " + name + " (could not fingerprint)");
            } else {
                out.println("[UNIQUE]    " + name);
            }
        }
        out.println(report.duplicatesFound() + " duplicates, " + report.skipped() + " already processed");
    }
}
