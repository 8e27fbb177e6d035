package com.astrofiler.service;

import com.astrofiler.db.FitsSessionDao;
import com.astrofiler.model.BatchResult;
import com.astrofiler.model.CalibrationFingerprint;
import com.astrofiler.model.FitsSession;
import com.astrofiler.model.ImageType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Links light sessions to bias, dark and flat sessions taken with the same equipment.
 * Only empty references are filled; {@link #clearLinks()} resets them.
 */
public class CalibrationMatcher {
    private static final Logger LOG = LogManager.getLogger(CalibrationMatcher.class);

    private static final ImageType[] CALIBRATION_TYPES = {ImageType.BIAS, ImageType.DARK, ImageType.FLAT};

    private final FitsSessionDao sessionDao;

    public CalibrationMatcher(FitsSessionDao sessionDao) {
        this.sessionDao = sessionDao;
    }

    public BatchResult linkSessions(CancellationToken token) {
        BatchResult result = new BatchResult();
        List<FitsSession> lights;
        Map<ImageType, List<FitsSession>> calibrations = new EnumMap<>(ImageType.class);
        try {
            lights = sessionDao.findLightSessions();
            for (ImageType type : CALIBRATION_TYPES) {
                calibrations.put(type, sessionDao.findCalibrationSessions(type));
            }
        } catch (SQLException e) {
            LOG.error("Cannot load sessions for linking", e);
            result.addError("Database error: " + e.getMessage());
            return result;
        }

        int linked = 0;
        for (int i = 0; i < lights.size(); i++) {
            FitsSession light = lights.get(i);
            if (!token.proceed(i + 1, lights.size(), light.objectName)) {
                result.cancelled = true;
                break;
            }
            result.attempted++;
            try {
                for (ImageType type : CALIBRATION_TYPES) {
                    if (light.calibrationSession(type) != null) continue;
                    Optional<FitsSession> best = bestMatch(light, type, calibrations.get(type));
                    if (best.isPresent() && sessionDao.fillCalibrationReference(light.id, type, best.get().id)) {
                        linked++;
                        LOG.debug("Linked {} session {} to {}", type.label(), best.get().id, light.id);
                    }
                }
                result.processed++;
            } catch (SQLException e) {
                LOG.error("Linking failed for session {}", light.id, e);
                result.addError(light.id + ": " + e.getMessage());
            }
        }
        LOG.info("Linked {} calibration references over {} light sessions", linked, result.processed);
        return result;
    }

    public int clearLinks() throws SQLException {
        return sessionDao.clearCalibrationReferences();
    }

    /**
     * Calibration session with the required fingerprint closest in time to the light
     * session. Equal distances prefer the later session, then the smaller id.
     */
    static Optional<FitsSession> bestMatch(FitsSession light, ImageType type, List<FitsSession> candidates) {
        CalibrationFingerprint required = CalibrationFingerprint.required(light, type);
        return candidates.stream()
                .filter(c -> required.matches(CalibrationFingerprint.of(c)))
                .min(Comparator.comparing((FitsSession c) -> distance(light.date, c.date))
                        .thenComparing(c -> c.date, Comparator.nullsLast(Comparator.reverseOrder()))
                        .thenComparing(c -> c.id));
    }

    private static Duration distance(LocalDateTime a, LocalDateTime b) {
        if (a == null || b == null) return Duration.ofSeconds(Long.MAX_VALUE);
        return Duration.between(a, b).abs();
    }
}
