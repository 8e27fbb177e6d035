package com.astrofiler.service;

import com.astrofiler.db.FitsFileDao;
import com.astrofiler.db.FitsSessionDao;
import com.astrofiler.model.CalibrationFingerprint;
import com.astrofiler.model.FitsFile;
import com.astrofiler.model.FitsSession;
import com.astrofiler.model.GroupingResult;
import com.astrofiler.model.ImageType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Groups registered files into sessions: same target (or calibration type), same
 * equipment, captured within one night of the session's first file.
 */
public class SessionGrouper {
    private static final Logger LOG = LogManager.getLogger(SessionGrouper.class);

    static final Duration NIGHT_WINDOW = Duration.ofHours(12);

    private final FitsFileDao fileDao;
    private final FitsSessionDao sessionDao;

    public SessionGrouper(FitsFileDao fileDao, FitsSessionDao sessionDao) {
        this.fileDao = fileDao;
        this.sessionDao = sessionDao;
    }

    public GroupingResult createLightSessions(CancellationToken token) throws SQLException {
        return group(fileDao.findUnassigned(true), sessionDao.findLightSessions(), token);
    }

    public GroupingResult createCalibrationSessions(CancellationToken token) throws SQLException {
        return group(fileDao.findUnassigned(false), sessionDao.findCalibrationSessions(), token);
    }

    /** Removes all sessions. File references are cleared first. */
    public void clearSessions() throws SQLException {
        int files = fileDao.clearSessionReferences();
        int sessions = sessionDao.deleteAll();
        LOG.info("Cleared {} sessions ({} file references)", sessions, files);
    }

    public GroupingResult regenerateSessions(CancellationToken token) throws SQLException {
        clearSessions();
        GroupingResult result = createLightSessions(token);
        if (result.cancelled) return result;
        GroupingResult calibration = createCalibrationSessions(token);
        result.createdSessions.addAll(calibration.createdSessions);
        result.assignedFiles += calibration.assignedFiles;
        result.cancelled = calibration.cancelled;
        return result;
    }

    /** Whether two ISO date-times are at most 12 hours apart. */
    public static boolean sameNight(String first, String second) {
        return sameNight(parse(first), parse(second));
    }

    public static boolean sameNight(LocalDateTime first, LocalDateTime second) {
        if (first == null || second == null) return false;
        return Duration.between(first, second).abs().compareTo(NIGHT_WINDOW) <= 0;
    }

    private GroupingResult group(List<FitsFile> files, List<FitsSession> candidates, CancellationToken token)
            throws SQLException {
        GroupingResult result = new GroupingResult();
        for (int i = 0; i < files.size(); i++) {
            FitsFile f = files.get(i);
            if (!token.proceed(i + 1, files.size(), f.fileName())) {
                result.cancelled = true;
                LOG.info("Session grouping cancelled after {} of {} files", i, files.size());
                break;
            }
            if (f.captureDate == null || f.type == null) {
                LOG.warn("Skipping {} without capture date or type", f.path);
                continue;
            }

            Optional<FitsSession> match = candidates.stream()
                    .filter(s -> belongsTo(f, s))
                    .min(Comparator.comparing((FitsSession s) -> Duration.between(s.date, f.captureDate).abs())
                            .thenComparing(s -> s.id));
            FitsSession session;
            if (match.isPresent()) {
                session = match.get();
            } else {
                session = newSession(f);
                sessionDao.insert(session);
                candidates.add(session);
                result.createdSessions.add(session.id);
                LOG.info("New {} session {} ({} {}/{})", f.type.label(), session.id, session.objectName,
                        session.telescope, session.imager);
            }
            if (fileDao.assignSession(f.id, session.id)) {
                result.assignedFiles++;
            }
        }
        return result;
    }

    static boolean belongsTo(FitsFile f, FitsSession s) {
        if (!Objects.equals(f.objectName, s.objectName)
                || !Objects.equals(f.telescope, s.telescope)
                || !Objects.equals(f.instrument, s.imager)
                || !sameNight(s.date, f.captureDate)) {
            return false;
        }
        if (f.type == ImageType.LIGHT) return true;
        return CalibrationFingerprint.of(f).matches(CalibrationFingerprint.of(s));
    }

    private static FitsSession newSession(FitsFile f) {
        FitsSession s = new FitsSession();
        s.id = UUID.randomUUID().toString();
        s.objectName = f.objectName;
        s.date = f.captureDate;
        s.telescope = f.telescope;
        s.imager = f.instrument;
        s.xBinning = f.xBinning;
        s.yBinning = f.yBinning;
        s.ccdTemp = f.ccdTemp;
        s.gain = f.gain;
        s.offset = f.offset;
        if (f.type == ImageType.LIGHT || f.type == ImageType.DARK) s.exposure = f.exposure;
        if (f.type == ImageType.LIGHT || f.type == ImageType.FLAT) s.filter = f.filter;
        return s;
    }

    private static LocalDateTime parse(String isoDateTime) {
        String s = isoDateTime.trim().replace(' ', 'T');
        int dot = s.indexOf('.');
        return LocalDateTime.parse(dot >= 0 ? s.substring(0, dot) : s);
    }
}
