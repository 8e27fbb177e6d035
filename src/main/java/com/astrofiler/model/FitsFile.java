package com.astrofiler.model;

import java.time.LocalDateTime;

/**
 * One registered FITS image. Paths are absolute and use forward slashes.
 */
public class FitsFile {
    public String id;
    public String path;
    public LocalDateTime captureDate;
    public ImageType type;
    public String objectName;
    public Double exposure;
    public int xBinning = 1;
    public int yBinning = 1;
    public Double ccdTemp;
    public String telescope;
    public String instrument;
    public Double gain;
    public Double offset;
    public String filter;
    public String contentHash;
    public boolean calibrated;
    public String sessionId;

    public String fileName() {
        int idx = path == null ? -1 : path.lastIndexOf('/');
        return idx < 0 ? path : path.substring(idx + 1);
    }

    @Override
    public String toString() {
        return "FitsFile{" + id + ", " + type + ", " + path + "}";
    }
}
