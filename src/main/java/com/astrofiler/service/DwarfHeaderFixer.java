package com.astrofiler.service;

import com.astrofiler.exception.VendorNormalizationException;
import com.astrofiler.model.FitsHeader;
import com.astrofiler.model.HeaderKey;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rebuilds the header of DWARF files from the device's folder layout:
 * <pre>
 * root/
 *   DWARF_RAW_...   light frames
 *   CALI_FRAME/     bias|dark|flat / cam_0|cam_1 / files
 *   DWARF_DARK/     dark library files
 * </pre>
 */
public class DwarfHeaderFixer {
    private static final Logger LOG = LogManager.getLogger(DwarfHeaderFixer.class);

    private static final String CALI_FRAME = "CALI_FRAME";
    private static final String DWARF_DARK = "DWARF_DARK";
    private static final double DEFAULT_TEMP = -10.0;
    private static final Pattern DWARF_DATE = Pattern.compile(
            "(\\d{4})-(\\d{2})-(\\d{2})[-_T ](\\d{2})[-_:](\\d{2})[-_:](\\d{2})(?:[-_.]\\d+)?");
    private static final DateTimeFormatter ISO = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private final Clock clock;

    public DwarfHeaderFixer(Clock clock) {
        this.clock = clock;
    }

    public static boolean applies(FitsHeader header) {
        return header.getString(HeaderKey.TELESCOP).map(t -> t.equalsIgnoreCase("DWARF")).orElse(false);
    }

    public void fix(Path file, FitsHeader header) throws VendorNormalizationException {
        String fileName = file.getFileName().toString();
        if (fileName.startsWith("failed_")) {
            throw new VendorNormalizationException("DWARF marked the capture as failed: " + fileName);
        }
        Path dir = file.toAbsolutePath().getParent();
        Path root = findRoot(dir)
                .orElseThrow(() -> new VendorNormalizationException("DWARF folder structure not recognized for " + file));
        Path rel = root.relativize(dir);
        if (rel.toString().isEmpty()) {
            throw new VendorNormalizationException("DWARF file outside any role folder: " + file);
        }

        String role = rel.getName(0).toString();
        if (role.startsWith("DWARF_RAW")) {
            fixLight(role, header);
        } else if (role.equals(CALI_FRAME)) {
            fixCalibration(rel, baseName(fileName), header);
        } else if (role.equals(DWARF_DARK)) {
            fixDarkLibrary(baseName(fileName), header);
        } else {
            throw new VendorNormalizationException("Unknown DWARF folder '" + role + "' for " + file);
        }
    }

    /** Nearest ancestor holding both {@code CALI_FRAME} and {@code DWARF_DARK}. */
    static Optional<Path> findRoot(Path dir) {
        for (Path p = dir; p != null; p = p.getParent()) {
            if (Files.isDirectory(p.resolve(CALI_FRAME)) && Files.isDirectory(p.resolve(DWARF_DARK))) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }

    private void fixLight(String folder, FitsHeader header) throws VendorNormalizationException {
        Map<String, String> f = DwarfGrammar.RAW_FOLDER.parse(folder)
                .orElseThrow(() -> new VendorNormalizationException("Malformed DWARF_RAW folder name: " + folder));
        header.set(HeaderKey.INSTRUME, f.get("instrument"));
        header.set(HeaderKey.OBJECT, f.get("object"));
        header.set(HeaderKey.EXPTIME, Double.parseDouble(f.get("exposure")));
        header.set(HeaderKey.GAIN, Double.parseDouble(f.get("gain")));
        header.setIfAbsent(HeaderKey.XBINNING, 1L);
        header.setIfAbsent(HeaderKey.YBINNING, 1L);
        header.setIfAbsent(HeaderKey.CCD_TEMP, DEFAULT_TEMP);
        if (!header.has(HeaderKey.DATE_OBS)) {
            String date = toIsoDate(f.get("date"))
                    .orElseThrow(() -> new VendorNormalizationException("Unparsable date in DWARF folder: " + folder));
            header.set(HeaderKey.DATE_OBS, date);
        }
        header.set(HeaderKey.IMAGETYP, "LIGHT");
        LOG.debug("DWARF light: OBJECT={}, INSTRUME={}", f.get("object"), f.get("instrument"));
    }

    private void fixCalibration(Path rel, String base, FitsHeader header) throws VendorNormalizationException {
        if (rel.getNameCount() < 3) {
            throw new VendorNormalizationException("CALI_FRAME file needs <type>/<camera> folders: " + rel);
        }
        String frameType = rel.getName(1).toString().toLowerCase(Locale.ROOT);
        String camera = rel.getName(2).toString();

        String instrument;
        if (camera.equals("cam_0")) {
            instrument = "TELE";
        } else if (camera.equals("cam_1")) {
            instrument = "WIDE";
        } else {
            throw new VendorNormalizationException("Unknown DWARF camera folder: " + camera);
        }

        DwarfGrammar grammar;
        switch (frameType) {
            case "bias": grammar = DwarfGrammar.BIAS_FILE; break;
            case "flat": grammar = DwarfGrammar.FLAT_FILE; break;
            case "dark": grammar = DwarfGrammar.DARK_FILE; break;
            default: throw new VendorNormalizationException("Unknown CALI_FRAME type folder: " + frameType);
        }
        Map<String, String> f = grammar.parse(base)
                .orElseThrow(() -> new VendorNormalizationException("Malformed " + frameType + " file name: " + base));

        String upper = frameType.toUpperCase(Locale.ROOT);
        header.set(HeaderKey.IMAGETYP, upper);
        header.set(HeaderKey.OBJECT, "MASTER" + upper);
        header.set(HeaderKey.INSTRUME, instrument);
        header.setIfAbsent(HeaderKey.DATE_OBS, LocalDateTime.now(clock).format(ISO));
        header.set(HeaderKey.GAIN, Double.parseDouble(f.get("gain")));
        long binning = Long.parseLong(f.get("binning"));
        header.set(HeaderKey.XBINNING, binning);
        header.set(HeaderKey.YBINNING, binning);

        switch (grammar) {
            case BIAS_FILE:
                header.setIfAbsent(HeaderKey.EXPTIME, 0.0);
                header.setIfAbsent(HeaderKey.CCD_TEMP, DEFAULT_TEMP);
                break;
            case FLAT_FILE:
                header.setIfAbsent(HeaderKey.EXPTIME, 1.0);
                header.setIfAbsent(HeaderKey.CCD_TEMP, DEFAULT_TEMP);
                header.setIfAbsent(HeaderKey.FILTER, "UNKNOWN");
                break;
            default:
                header.set(HeaderKey.EXPTIME, Double.parseDouble(f.get("exposure")));
                header.set(HeaderKey.CCD_TEMP, Double.parseDouble(f.get("temp")));
                break;
        }
        LOG.debug("DWARF calibration: IMAGETYP={}, INSTRUME={}", upper, instrument);
    }

    private void fixDarkLibrary(String base, FitsHeader header) throws VendorNormalizationException {
        Map<String, String> f = DwarfGrammar.DARK_LIBRARY_FILE.parse(base)
                .orElseThrow(() -> new VendorNormalizationException("Malformed DWARF_DARK file name: " + base));
        header.set(HeaderKey.INSTRUME, "TELE");
        header.set(HeaderKey.IMAGETYP, "DARKMASTER");
        header.set(HeaderKey.OBJECT, "DARKMASTER");
        header.set(HeaderKey.EXPTIME, Double.parseDouble(f.get("exposure")));
        header.set(HeaderKey.GAIN, Double.parseDouble(f.get("gain")));
        long binning = Long.parseLong(f.get("binning"));
        header.set(HeaderKey.XBINNING, binning);
        header.set(HeaderKey.YBINNING, binning);
        header.setIfAbsent(HeaderKey.CCD_TEMP, DEFAULT_TEMP);
        String date = toIsoDate(f.get("date")).orElseGet(() -> {
            LOG.warn("Unparsable DWARF_DARK date '{}', using current time", f.get("date"));
            return LocalDateTime.now(clock).format(ISO);
        });
        header.set(HeaderKey.DATE_OBS, date);
    }

    /** {@code 2024-10-08-21-04-39-046} and similar to {@code 2024-10-08T21:04:39}. */
    static Optional<String> toIsoDate(String raw) {
        if (raw == null) return Optional.empty();
        Matcher m = DWARF_DATE.matcher(raw.trim());
        if (!m.find()) return Optional.empty();
        String iso = m.group(1) + "-" + m.group(2) + "-" + m.group(3) + "T"
                + m.group(4) + ":" + m.group(5) + ":" + m.group(6);
        try {
            return Optional.of(LocalDateTime.parse(iso).format(ISO));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static String baseName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
