package com.astrofiler.service;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Unpacks compressed FITS downloads ({@code *.fit.zip}, {@code *.fits.zip}).
 */
public class ZipExtractor {
    private static final Logger LOG = LogManager.getLogger(ZipExtractor.class);

    public static boolean isFitsArchive(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        return lower.endsWith(".fit.zip") || lower.endsWith(".fits.zip");
    }

    /**
     * Extracts the FITS member next to the archive. With several members the first one
     * is used. Empty when the archive holds no FITS file.
     */
    public Optional<Path> extractFits(Path archive) throws IOException {
        try (ZipFile zip = new ZipFile(archive.toFile())) {
            List<ZipEntry> members = new ArrayList<>();
            zip.stream()
                    .filter(e -> !e.isDirectory() && isFitsName(e.getName()))
                    .forEach(members::add);
            if (members.isEmpty()) {
                LOG.warn("No FITS file in {}", archive);
                return Optional.empty();
            }
            if (members.size() > 1) {
                LOG.warn("{} holds {} FITS files, using {}", archive.getFileName(), members.size(),
                        members.get(0).getName());
            }
            ZipEntry entry = members.get(0);
            // only the member's own name, never its directories
            Path target = archive.toAbsolutePath().getParent()
                    .resolve(Paths.get(entry.getName()).getFileName().toString());
            try (InputStream in = zip.getInputStream(entry)) {
                Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            }
            LOG.info("Extracted {} from {}", target.getFileName(), archive.getFileName());
            return Optional.of(target);
        }
    }

    private static boolean isFitsName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.endsWith(".fit") || lower.endsWith(".fits");
    }
}
