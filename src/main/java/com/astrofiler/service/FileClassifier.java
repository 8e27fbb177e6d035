package com.astrofiler.service;

import com.astrofiler.exception.ValidationException;
import com.astrofiler.model.FitsFile;
import com.astrofiler.model.FitsHeader;
import com.astrofiler.model.HeaderKey;
import com.astrofiler.model.ImageType;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

/**
 * Turns a normalized header into an unsaved {@link FitsFile}: frame type, capture date
 * and the equipment fields used for grouping and matching.
 */
public class FileClassifier {

    private static final DateTimeFormatter DATE_OBS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public FitsFile classify(FitsHeader header) throws ValidationException {
        String imageTyp = header.getString(HeaderKey.IMAGETYP)
                .orElseThrow(() -> new ValidationException("IMAGETYP", "Missing IMAGETYP"));
        ImageType type = ImageType.fromImageTyp(imageTyp)
                .orElseThrow(() -> new ValidationException("IMAGETYP", "Unknown image type '" + imageTyp + "'"));

        String dateObs = header.getString(HeaderKey.DATE_OBS)
                .orElseThrow(() -> new ValidationException("DATE-OBS", "Missing DATE-OBS"));
        Double exposure = header.getDouble(HeaderKey.EXPTIME)
                .or(() -> header.getDouble(HeaderKey.EXPOSURE))
                .orElseThrow(() -> new ValidationException("EXPTIME", "Missing EXPTIME/EXPOSURE"));

        FitsFile f = new FitsFile();
        f.type = type;
        f.captureDate = parseDateObs(dateObs);
        f.exposure = exposure;
        if (type == ImageType.LIGHT) {
            f.objectName = header.getString(HeaderKey.OBJECT)
                    .orElseThrow(() -> new ValidationException("OBJECT", "Light frame without OBJECT"));
        } else {
            f.objectName = type.label();
        }
        f.telescope = header.getString(HeaderKey.TELESCOP).orElse("Unknown");
        f.instrument = header.getString(HeaderKey.INSTRUME).orElse("Unknown");
        f.xBinning = header.getInt(HeaderKey.XBINNING).orElse(1);
        f.yBinning = header.getInt(HeaderKey.YBINNING).orElse(1);
        f.ccdTemp = header.getDouble(HeaderKey.CCD_TEMP).orElse(null);
        f.gain = header.getDouble(HeaderKey.GAIN).orElse(null);
        f.offset = header.getDouble(HeaderKey.OFFSET).orElse(null);
        f.filter = header.getString(HeaderKey.FILTER).orElse(null);
        f.calibrated = isPreCalibrated(f.telescope, f.instrument);
        return f;
    }

    /**
     * Parses DATE-OBS: {@code T} becomes a space and fractional seconds are dropped.
     */
    public static LocalDateTime parseDateObs(String value) throws ValidationException {
        String s = value.trim().replace('T', ' ');
        int dot = s.indexOf('.');
        if (dot >= 0) s = s.substring(0, dot);
        try {
            return LocalDateTime.parse(s, DATE_OBS);
        } catch (DateTimeParseException e) {
            throw new ValidationException("DATE-OBS", "Unparsable DATE-OBS '" + value + "'", e);
        }
    }

    /** Remote observatories and smart telescopes deliver frames already calibrated. */
    static boolean isPreCalibrated(String telescope, String instrument) {
        String tel = Optional.ofNullable(telescope).orElse("").toLowerCase(Locale.ROOT);
        String inst = Optional.ofNullable(instrument).orElse("").toLowerCase(Locale.ROOT);
        return tel.contains("itelescope") || inst.contains("seestar");
    }
}
