package com.astrofiler.service;

import com.astrofiler.db.FitsFileDao;
import com.astrofiler.model.BatchResult;
import com.astrofiler.model.FitsFile;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Content hashing and duplicate detection over the registered files.
 */
public class HashService {
    private static final Logger LOG = LogManager.getLogger(HashService.class);
    private static final int BUFFER_SIZE = 8192;

    private final FitsFileDao fileDao;

    public HashService(FitsFileDao fileDao) {
        this.fileDao = fileDao;
    }

    /** SHA-256 of the file content as lowercase hex. */
    public static String hash(Path file) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        try (InputStream in = Files.newInputStream(file);
             DigestInputStream dis = new DigestInputStream(in, digest)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            while (dis.read(buffer) != -1) {
                // digest is updated by the stream
            }
        }
        return toHex(digest.digest());
    }

    /** Id of the file already registered with this digest. */
    public Optional<String> lookup(String digest) throws SQLException {
        return fileDao.findIdByHash(digest);
    }

    /**
     * Removes rows sharing a content hash, keeping the first registered one. The file of a
     * removed row is deleted too unless it is the same path as the kept row.
     */
    public BatchResult removeDuplicates(CancellationToken token) {
        BatchResult result = new BatchResult();
        List<String> hashes;
        try {
            hashes = fileDao.findDuplicateHashes();
        } catch (SQLException e) {
            LOG.error("Cannot list duplicate hashes", e);
            result.addError("Database error: " + e.getMessage());
            return result;
        }

        for (int i = 0; i < hashes.size(); i++) {
            String digest = hashes.get(i);
            if (!token.proceed(i + 1, hashes.size(), digest)) {
                result.cancelled = true;
                break;
            }
            result.attempted++;
            try {
                List<FitsFile> rows = fileDao.findByHash(digest);
                FitsFile keep = rows.get(0);
                for (FitsFile dup : rows.subList(1, rows.size())) {
                    if (dup.path != null && !dup.path.equals(keep.path)) {
                        Files.deleteIfExists(Paths.get(dup.path));
                    }
                    fileDao.delete(dup.id);
                    LOG.info("Removed duplicate {} of {}", dup.path, keep.path);
                }
                result.processed++;
            } catch (SQLException | IOException e) {
                LOG.error("Duplicate cleanup failed for hash {}", digest, e);
                result.addError(digest + ": " + e.getMessage());
            }
        }
        return result;
    }

    private static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
