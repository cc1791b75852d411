package Model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class H2FingerprintStore implements FingerprintStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(H2FingerprintStore.class);

    private static final String COLUMNS =
            "path, hash_size, algo_version, phash, ahash, ghash, file_size, last_modified, recorded_at";

    private final Connection conn;

    public H2FingerprintStore(String dbFilePath) {
        this(dbFilePath, "jdbc:h2:file:" + dbFilePath + ";AUTO_SERVER=TRUE");
    }

    private H2FingerprintStore(String description, String url) {
        try {
            conn = DriverManager.getConnection(url);
            init();
            log.info("Opened fingerprint store {}", description);
        } catch (SQLException e) {
            throw new FingerprintStoreException("Cannot open H2 at " + description, e);
        }
    }

    public static H2FingerprintStore inMemory(String name) {
        return new H2FingerprintStore("mem:" + name, "jdbc:h2:mem:" + name + ";DB_CLOSE_DELAY=-1");
    }

    private void init() throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                CREATE TABLE IF NOT EXISTS image_fingerprint (
                  path VARCHAR PRIMARY KEY,
                  hash_size INT NOT NULL,
                  algo_version INT NOT NULL,
                  phash VARCHAR NOT NULL,
                  ahash VARCHAR NOT NULL,
                  ghash VARCHAR NOT NULL,
                  file_size BIGINT NOT NULL,
                  last_modified BIGINT NOT NULL,
                  recorded_at TIMESTAMP NOT NULL
                )
            """);
            st.execute("""
                CREATE INDEX IF NOT EXISTS image_fingerprint_tag
                  ON image_fingerprint (hash_size, algo_version)
            """);
            st.execute("""
                CREATE TABLE IF NOT EXISTS processed_image (
                  image_name VARCHAR PRIMARY KEY,
                  processed_at TIMESTAMP NOT NULL
                )
            """);
        }
    }

    @Override
    public List<StoredFingerprint> lookup(Fingerprint probe) {
        try (PreparedStatement ps = conn.prepareStatement("SELECT " + COLUMNS
                + " FROM image_fingerprint WHERE hash_size=? AND algo_version=? ORDER BY recorded_at, path")) {
            ps.setInt(1, probe.hashSize());
            ps.setInt(2, probe.algorithmVersion());
            try (ResultSet rs = ps.executeQuery()) {
                List<StoredFingerprint> out = new ArrayList<>();
                while (rs.next()) {
                    try {
                        out.add(map(rs));
                    } catch (FingerprintStoreException e) {
                        log.error("Skipping unreadable stored fingerprint: {}", e.getMessage(), e);
                    }
                }
                return out;
            }
        } catch (SQLException e) {
            throw new FingerprintStoreException("Fingerprint lookup failed", e);
        }
    }

    @Override
    public void record(Path path, Fingerprint fingerprint, FingerprintMetadata metadata) {
        try (PreparedStatement ps = conn.prepareStatement("MERGE INTO image_fingerprint (" + COLUMNS + ")"
                + " KEY(path) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
            ps.setString(1, path.toString());
            ps.setInt(2, fingerprint.hashSize());
            ps.setInt(3, fingerprint.algorithmVersion());
            ps.setString(4, fingerprint.perceptualBits());
            ps.setString(5, fingerprint.averageBits());
            ps.setString(6, fingerprint.gradientBits());
            ps.setLong(7, metadata.fileSize());
            ps.setLong(8, metadata.lastModified());
            ps.setTimestamp(9, Timestamp.from(Instant.now()));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new FingerprintStoreException("Cannot record fingerprint for " + path, e);
        }
    }

    @Override
    public Optional<StoredFingerprint> find(Path path) {
        try (PreparedStatement ps = conn.prepareStatement("SELECT " + COLUMNS
                + " FROM image_fingerprint WHERE path=?")) {
            ps.setString(1, path.toString());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(map(rs));
            }
        } catch (SQLException e) {
            throw new FingerprintStoreException("Cannot read fingerprint for " + path, e);
        }
    }

    @Override
    public void remove(Path path) {
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM image_fingerprint WHERE path=?")) {
            ps.setString(1, path.toString());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new FingerprintStoreException("Cannot remove fingerprint for " + path, e);
        }
    }

    @Override
    public void markProcessed(String imageName) {
        try (PreparedStatement ps = conn.prepareStatement(
                "MERGE INTO processed_image (image_name, processed_at) KEY(image_name) VALUES (?, ?)")) {
            ps.setString(1, imageName);
            ps.setTimestamp(2, Timestamp.from(Instant.now()));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new FingerprintStoreException("Cannot mark " + imageName + " as processed", e);
        }
    }

    @Override
    public boolean isProcessed(String imageName) {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM processed_image WHERE image_name=?")) {
            ps.setString(1, imageName);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new FingerprintStoreException("Cannot check processed marker for " + imageName, e);
        }
    }

    private static StoredFingerprint map(ResultSet rs) throws SQLException {
        String path = rs.getString("path");
        Fingerprint fp;
        try {
            fp = Fingerprint.fromBitStrings(
                    rs.getInt("hash_size"),
                    rs.getInt("algo_version"),
                    rs.getString("phash"),
                    rs.getString("ahash"),
                    rs.getString("ghash"));
        } catch (IllegalArgumentException e) {
            throw new FingerprintStoreException("Malformed fingerprint stored for " + path, e);
        }
        return new StoredFingerprint(
                Paths.get(path),
                fp,
                new FingerprintMetadata(rs.getLong("file_size"), rs.getLong("last_modified")),
                rs.getTimestamp("recorded_at").toInstant());
    }

    @Override
    public void close() {
        try {
            conn.close();
        } catch (SQLException e) {
            log.warn("Closing fingerprint store failed", e);
        }
    }
}
