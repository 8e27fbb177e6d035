package com.astrofiler.service;

import com.astrofiler.model.FitsFile;
import com.astrofiler.model.ImageType;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Folder structure of the repository:
 * {@code Light/<Object>/<Telescope>/<Instrument>/<yyyyMMdd>/},
 * {@code Calibrate/<Type>/<Telescope>/<Instrument>/} and {@code Masters/}.
 */
public class RepositoryLayout {

    private static final DateTimeFormatter NIGHT = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final Path root;

    public RepositoryLayout(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    public Path mastersDirectory() {
        return root.resolve("Masters");
    }

    public Path directoryFor(FitsFile f) {
        String telescope = FileNamer.sanitize(f.telescope);
        String instrument = FileNamer.sanitize(f.instrument);
        if (f.type == ImageType.LIGHT) {
            return root.resolve("Light").resolve(FileNamer.sanitize(f.objectName)).resolve(telescope)
                    .resolve(instrument).resolve(f.captureDate.format(NIGHT));
        }
        return root.resolve("Calibrate").resolve(f.type.label()).resolve(telescope).resolve(instrument);
    }

    /** {@code dir/name}, or {@code dir/name_N.ext} with the first free N. */
    public static Path uniquePath(Path dir, String fileName) {
        Path candidate = dir.resolve(fileName);
        if (!Files.exists(candidate)) return candidate;
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        String ext = dot > 0 ? fileName.substring(dot) : "";
        for (int n = 1; ; n++) {
            candidate = dir.resolve(stem + "_" + n + ext);
            if (!Files.exists(candidate)) return candidate;
        }
    }

    /** Stored form of a path: absolute with forward slashes. */
    public static String toStoredPath(Path p) {
        return p.toAbsolutePath().normalize().toString().replace('\\', '/');
    }

    static boolean isMastersPath(Path p) {
        for (Path part : p) {
            if (part.toString().toLowerCase(Locale.ROOT).equals("masters")) return true;
        }
        return false;
    }
}
