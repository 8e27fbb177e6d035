package com.astrofiler.model;

import java.time.LocalDateTime;

/**
 * A master calibration frame stacked from one calibration session, or registered
 * from an existing file found during ingestion.
 */
public class Master {
    public String id;
    public ImageType type;
    public String telescope;
    public String instrument;
    public Double exposure;
    public String filter;
    public int xBinning = 1;
    public int yBinning = 1;
    public Double ccdTemp;
    public Double gain;
    public Double offset;
    public String path;
    public String contentHash;
    public long fileSize;
    public int frameCount;
    public String sourceSessionId;
    public boolean validated;
    public LocalDateTime validationDate;
    public LocalDateTime creationDate;
    public boolean softDeleted;

    public CalibrationFingerprint fingerprint() {
        return CalibrationFingerprint.of(type, telescope, instrument, xBinning, yBinning, gain, offset, exposure, ccdTemp,
                filter);
    }

    @Override
    public String toString() {
        return "Master{" + id + ", " + type + ", " + path + "}";
    }
}
