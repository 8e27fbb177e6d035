package com.astrofiler.service;

import com.astrofiler.model.FitsFile;
import com.astrofiler.model.FitsHeader;

import java.time.format.DateTimeFormatter;

/**
 * Canonical repository file names.
 * <pre>
 * Light  Object-Telescope-Instrument-Filter-yyyyMMddHHmmss-EXPs-XxY-tTEMP.fits
 * Flat   Flat-Telescope-Instrument-Filter-yyyyMMddHHmmss-EXPs-XxY-tTEMP.fits
 * Dark   Dark-Telescope-Instrument-yyyyMMddHHmmss-EXPs-XxY-tTEMP.fits
 * Bias   Bias-Telescope-Instrument-yyyyMMddHHmmss-XxY-tTEMP.fits
 * </pre>
 */
public final class FileNamer {

    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");
    private static final String INVALID = " \\/:*?\"<>|\t\n\r";

    private FileNamer() {
    }

    public static String canonicalName(FitsFile f) {
        String telescope = sanitize(f.telescope);
        String instrument = sanitize(f.instrument);
        String date = f.captureDate.format(FILE_DATE);
        String exposure = FitsHeader.format(f.exposure == null ? 0.0 : f.exposure) + "s";
        String binning = f.xBinning + "x" + f.yBinning;
        String temp = "t" + FitsHeader.format(f.ccdTemp == null ? 0.0 : f.ccdTemp);
        String filter = f.filter == null ? "OSC" : sanitize(f.filter);

        switch (f.type) {
            case LIGHT:
                return String.join("-", sanitize(f.objectName), telescope, instrument, filter, date, exposure,
                        binning, temp) + ".fits";
            case FLAT:
                return String.join("-", "Flat", telescope, instrument, filter, date, exposure, binning, temp) + ".fits";
            case DARK:
                return String.join("-", "Dark", telescope, instrument, date, exposure, binning, temp) + ".fits";
            case BIAS:
                return String.join("-", "Bias", telescope, instrument, date, binning, temp) + ".fits";
            default:
                throw new IllegalArgumentException("Unknown type " + f.type);
        }
    }

    /**
     * Replaces characters that are unsafe in file names with {@code _}, collapses repeated
     * underscores and trims them at both ends. Blank input becomes {@code Unknown}.
     */
    public static String sanitize(String value) {
        if (value == null) return "Unknown";
        StringBuilder sb = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            sb.append(INVALID.indexOf(c) >= 0 ? '_' : c);
        }
        String s = sb.toString();
        while (s.contains("__")) {
            s = s.replace("__", "_");
        }
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '_') start++;
        while (end > start && s.charAt(end - 1) == '_') end--;
        s = s.substring(start, end);
        return s.isEmpty() ? "Unknown" : s;
    }
}
