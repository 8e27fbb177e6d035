package com.astrofiler.service;

import com.astrofiler.db.FitsFileDao;
import com.astrofiler.db.FitsSessionDao;
import com.astrofiler.db.MasterDao;
import com.astrofiler.exception.ExternalToolException;
import com.astrofiler.exception.FitsReadException;
import com.astrofiler.exception.ValidationException;
import com.astrofiler.model.BatchResult;
import com.astrofiler.model.CalibrationFingerprint;
import com.astrofiler.model.FitsFile;
import com.astrofiler.model.FitsHeader;
import com.astrofiler.model.FitsSession;
import com.astrofiler.model.HeaderKey;
import com.astrofiler.model.ImageType;
import com.astrofiler.model.Master;
import com.astrofiler.model.MasterValidationReport;
import com.astrofiler.model.RegistrationResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lifecycle of master calibration frames: stacking calibration sessions with the
 * external tool, registering existing masters, matching them to light sessions,
 * validation and retention cleanup.
 */
public class MasterFrameManager {
    private static final Logger LOG = LogManager.getLogger(MasterFrameManager.class);

    private static final DateTimeFormatter NIGHT = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter ISO = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");
    private static final String OUTPUT_NAME = "master.fits";
    private static final Comparator<Master> NEWEST_FIRST =
            Comparator.comparing((Master m) -> m.creationDate, Comparator.reverseOrder())
                    .thenComparing(m -> m.id);

    private final FitsFileDao fileDao;
    private final FitsSessionDao sessionDao;
    private final MasterDao masterDao;
    private final FitsHeaderService headerService;
    private final ExternalToolService toolService;
    private final MasterIntegrityService integrityService;
    private final RepositoryLayout layout;
    private final Clock clock;

    public MasterFrameManager(FitsFileDao fileDao, FitsSessionDao sessionDao, MasterDao masterDao,
                              FitsHeaderService headerService, ExternalToolService toolService,
                              MasterIntegrityService integrityService, RepositoryLayout layout, Clock clock) {
        this.fileDao = fileDao;
        this.sessionDao = sessionDao;
        this.masterDao = masterDao;
        this.headerService = headerService;
        this.toolService = toolService;
        this.integrityService = integrityService;
        this.layout = layout;
        this.clock = clock;
    }

    // --- Creation ---

    /**
     * Stacks the frames of one calibration session into a master. Returns empty when the
     * session has fewer than {@code minFiles} frames of {@code type} or the tool fails;
     * no master record is written in that case.
     */
    public Optional<Master> createMasterFromSession(String sessionId, ImageType type, int minFiles) {
        if (!type.isCalibration()) {
            throw new IllegalArgumentException("Masters are built from calibration frames, not " + type);
        }
        try {
            Optional<FitsSession> found = sessionDao.findById(sessionId);
            if (found.isEmpty()) {
                LOG.warn("Session {} not found", sessionId);
                return Optional.empty();
            }
            FitsSession session = found.get();

            List<FitsFile> frames = new ArrayList<>();
            for (FitsFile f : fileDao.findBySession(sessionId)) {
                if (f.type == type && Files.isRegularFile(Paths.get(f.path))) {
                    frames.add(f);
                }
            }
            if (frames.size() < minFiles) {
                LOG.info("Session {} has {} {} frames, {} required for a master", sessionId, frames.size(),
                        type.label(), minFiles);
                return Optional.empty();
            }

            Path mastersDir = layout.mastersDirectory();
            Files.createDirectories(mastersDir);
            Path output = mastersDir.resolve(masterFileName(type, session, frames.get(0)));
            if (!stack(type, frames, output)) {
                return Optional.empty();
            }

            LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
            Master master = newMaster(type, session, frames, output, now);
            try {
                writeMasterHeader(output, master);
                master.contentHash = HashService.hash(output);
                master.fileSize = Files.size(output);
            } catch (IOException | FitsReadException e) {
                LOG.error("Cannot finalize master {}", output, e);
                Files.deleteIfExists(output);
                return Optional.empty();
            }

            Master saved = saveOrUpdate(master);
            sessionDao.setMasterPath(sessionId, type, saved.path);
            LOG.info("Created master {} from {} frames of session {}", saved.path, frames.size(), sessionId);
            return Optional.of(saved);
        } catch (SQLException | IOException e) {
            LOG.error("Master creation failed for session {}", sessionId, e);
            return Optional.empty();
        }
    }

    /** Builds a master for every calibration session that has none yet. */
    public BatchResult createMastersForSessions(int minFiles, CancellationToken token) {
        BatchResult result = new BatchResult();
        List<FitsSession> sessions;
        try {
            sessions = sessionDao.findCalibrationSessions();
        } catch (SQLException e) {
            LOG.error("Cannot list calibration sessions", e);
            result.addError("Database error: " + e.getMessage());
            return result;
        }
        for (int i = 0; i < sessions.size(); i++) {
            FitsSession s = sessions.get(i);
            if (!token.proceed(i + 1, sessions.size(), s.objectName + " " + s.date)) {
                result.cancelled = true;
                break;
            }
            ImageType type = s.calibrationType().get();
            if (s.masterPath(type) != null) continue;
            result.attempted++;
            if (createMasterFromSession(s.id, type, minFiles).isPresent()) {
                result.processed++;
            }
        }
        return result;
    }

    private boolean stack(ImageType type, List<FitsFile> frames, Path output) throws IOException {
        Path workDir = Files.createTempDirectory(output.getParent(), "stack_");
        try {
            Path stacked = workDir.resolve(OUTPUT_NAME);
            Path script = workDir.resolve("stack.ssf");
            List<Path> inputs = frames.stream().map(f -> Paths.get(f.path)).collect(Collectors.toList());
            Files.write(script, buildScript(type, inputs, stacked), StandardCharsets.UTF_8);

            toolService.runScript(script, workDir);
            if (!Files.isRegularFile(stacked)) {
                throw new ExternalToolException("Stacking tool reported success but wrote no " + stacked, 0);
            }
            Files.move(stacked, output, StandardCopyOption.REPLACE_EXISTING);
            return true;
        } catch (ExternalToolException e) {
            LOG.error("Stacking {} frames into {} failed: {}", frames.size(), output.getFileName(), e.getMessage());
            return false;
        } finally {
            deleteRecursively(workDir);
        }
    }

    /**
     * One {@code load} per input, a single stack directive and the {@code save} target.
     * Flats are normalized multiplicatively, bias and darks are not normalized.
     */
    static List<String> buildScript(ImageType type, List<Path> inputs, Path output) {
        List<String> lines = new ArrayList<>();
        for (Path in : inputs) {
            lines.add("load \"" + RepositoryLayout.toStoredPath(in) + "\"");
        }
        lines.add(type == ImageType.FLAT ? "stack median -norm=mul" : "stack median -nonorm");
        lines.add("save \"" + RepositoryLayout.toStoredPath(output) + "\"");
        return lines;
    }

    static String masterFileName(ImageType type, FitsSession session, FitsFile sample) {
        List<String> parts = new ArrayList<>();
        parts.add("Master");
        parts.add(type.label());
        parts.add(FileNamer.sanitize(session.telescope));
        parts.add(FileNamer.sanitize(session.imager));
        if (type == ImageType.FLAT) {
            parts.add(session.filter == null ? "OSC" : FileNamer.sanitize(session.filter));
        }
        LocalDateTime date = session.date != null ? session.date : sample.captureDate;
        parts.add(date.format(NIGHT));
        if (type == ImageType.DARK) {
            parts.add(FitsHeader.format(sample.exposure == null ? 0.0 : sample.exposure) + "s");
        }
        parts.add(sample.xBinning + "x" + sample.yBinning);
        if (sample.gain != null) parts.add("g" + FitsHeader.format(sample.gain));
        if (sample.offset != null) parts.add("o" + FitsHeader.format(sample.offset));
        parts.add("t" + FitsHeader.format(sample.ccdTemp == null ? 0.0 : sample.ccdTemp));
        return String.join("-", parts) + ".fits";
    }

    private Master newMaster(ImageType type, FitsSession session, List<FitsFile> frames, Path output,
                             LocalDateTime now) {
        FitsFile sample = frames.get(0);
        Master m = new Master();
        m.id = UUID.randomUUID().toString();
        m.type = type;
        m.telescope = session.telescope;
        m.instrument = session.imager;
        m.xBinning = sample.xBinning;
        m.yBinning = sample.yBinning;
        m.exposure = type == ImageType.DARK ? sample.exposure : null;
        m.filter = type == ImageType.FLAT ? sample.filter : null;
        m.ccdTemp = sample.ccdTemp;
        m.gain = sample.gain;
        m.offset = sample.offset;
        m.path = RepositoryLayout.toStoredPath(output);
        m.frameCount = frames.size();
        m.sourceSessionId = session.id;
        m.creationDate = now;
        m.validated = true;
        m.validationDate = now;
        return m;
    }

    private void writeMasterHeader(Path file, Master m) throws IOException, FitsReadException {
        FitsHeader header = headerService.readHeader(file);
        header.set(HeaderKey.IMAGETYP, "Master " + m.type.label());
        header.set(HeaderKey.OBJECT, m.type.label());
        header.set(HeaderKey.MSTTYPE, m.type.name());
        header.set(HeaderKey.NCOMBINE, (long) m.frameCount);
        header.set(HeaderKey.CREATOR, "AstroFiler");
        header.set(HeaderKey.DATE, m.creationDate.format(ISO));
        header.set(HeaderKey.TELESCOP, m.telescope);
        header.set(HeaderKey.INSTRUME, m.instrument);
        header.set(HeaderKey.SESSID, m.sourceSessionId);
        header.set(HeaderKey.XBINNING, (long) m.xBinning);
        header.set(HeaderKey.YBINNING, (long) m.yBinning);
        if (m.type == ImageType.DARK && m.exposure != null) header.set(HeaderKey.EXPTIME, m.exposure);
        if (m.type == ImageType.BIAS) header.set(HeaderKey.EXPTIME, 0.0);
        if (m.type == ImageType.FLAT && m.filter != null) header.set(HeaderKey.FILTER, m.filter);
        if (m.ccdTemp != null) header.set(HeaderKey.CCD_TEMP, m.ccdTemp);
        if (m.gain != null) header.set(HeaderKey.GAIN, m.gain);
        if (m.offset != null) header.set(HeaderKey.OFFSET, m.offset);
        headerService.writeHeader(file, header);
    }

    /**
     * Updates the master with the same fingerprint in place, or inserts a new one. A file
     * replaced by one under another name is deleted once nothing refers to it any more.
     */
    private Master saveOrUpdate(Master m) throws SQLException {
        Optional<Master> existing = findExact(m.fingerprint());
        if (existing.isEmpty()) {
            masterDao.insert(m);
            return m;
        }
        Master old = existing.get();
        String oldPath = old.path;
        m.id = old.id;
        masterDao.updateFile(m);
        if (oldPath != null && !oldPath.equals(m.path)) {
            sessionDao.replaceMasterPath(oldPath, m.path);
            deleteReplacedFile(oldPath);
        }
        LOG.debug("Updated master {} in place ({} -> {})", m.id, oldPath, m.path);
        return m;
    }

    // --- Registration of existing master files ---

    /**
     * Registers a master frame found during ingestion. The type comes from the file name,
     * then IMAGETYP, then OBJECT.
     */
    public RegistrationResult registerMasterFile(Path file) {
        String stored = RepositoryLayout.toStoredPath(file);
        try {
            FitsHeader header = headerService.readHeader(file);
            Optional<ImageType> type = masterType(file.getFileName().toString(), header);
            if (type.isEmpty()) {
                return RegistrationResult.rejected(stored, "Cannot determine master type");
            }
            LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
            Master m = new Master();
            m.id = UUID.randomUUID().toString();
            m.type = type.get();
            m.telescope = header.getString(HeaderKey.TELESCOP).orElse("Unknown");
            m.instrument = header.getString(HeaderKey.INSTRUME).orElse("Unknown");
            m.xBinning = header.getInt(HeaderKey.XBINNING).orElse(1);
            m.yBinning = header.getInt(HeaderKey.YBINNING).orElse(1);
            m.exposure = m.type == ImageType.DARK
                    ? header.getDouble(HeaderKey.EXPTIME).or(() -> header.getDouble(HeaderKey.EXPOSURE)).orElse(null)
                    : null;
            m.filter = m.type == ImageType.FLAT ? header.getString(HeaderKey.FILTER).orElse(null) : null;
            m.ccdTemp = header.getDouble(HeaderKey.CCD_TEMP).orElse(null);
            m.gain = header.getDouble(HeaderKey.GAIN).orElse(null);
            m.offset = header.getDouble(HeaderKey.OFFSET).orElse(null);
            m.frameCount = header.getInt(HeaderKey.NCOMBINE).or(() -> header.getInt(HeaderKey.NIMAGES)).orElse(0);
            m.sourceSessionId = header.getString(HeaderKey.SESSID).orElse(null);
            m.path = stored;
            m.contentHash = HashService.hash(file);
            m.fileSize = Files.size(file);
            m.creationDate = headerCreationDate(header).orElse(now);
            m.validated = true;
            m.validationDate = now;

            Optional<Master> existing = findExact(m.fingerprint());
            if (existing.isPresent() && stored.equals(existing.get().path)
                    && m.contentHash.equals(existing.get().contentHash)) {
                return RegistrationResult.master(existing.get().id, stored);
            }
            Master saved = saveOrUpdate(m);
            LOG.info("Registered {} master {}", saved.type.label(), stored);
            return RegistrationResult.master(saved.id, stored);
        } catch (FitsReadException | IOException | SQLException e) {
            LOG.warn("Cannot register master {}: {}", file, e.getMessage());
            return RegistrationResult.rejected(stored, e.getMessage());
        }
    }

    static Optional<ImageType> masterType(String fileName, FitsHeader header) {
        String name = fileName.toLowerCase(Locale.ROOT);
        if (name.contains("bias")) return Optional.of(ImageType.BIAS);
        if (name.contains("dark")) return Optional.of(ImageType.DARK);
        if (name.contains("flat")) return Optional.of(ImageType.FLAT);
        return ImageType.fromImageTyp(header.getString(HeaderKey.IMAGETYP).orElse(null))
                .filter(ImageType::isCalibration)
                .or(() -> ImageType.fromImageTyp(header.getString(HeaderKey.OBJECT).orElse(null))
                        .filter(ImageType::isCalibration));
    }

    // --- Matching ---

    /**
     * Active master of {@code type} whose fingerprint matches what the session needs.
     * Among several, the most recently created wins, then the smallest id.
     */
    public Optional<Master> findMatchingMaster(FitsSession session, ImageType type) throws SQLException {
        CalibrationFingerprint required = CalibrationFingerprint.required(session, type);
        return masterDao.findActiveByType(type).stream()
                .filter(m -> required.matches(m.fingerprint()))
                .min(NEWEST_FIRST);
    }

    private Optional<Master> findExact(CalibrationFingerprint fingerprint) throws SQLException {
        return masterDao.findActiveByType(fingerprint.type()).stream()
                .filter(m -> m.fingerprint().equals(fingerprint))
                .min(NEWEST_FIRST);
    }

    private void deleteReplacedFile(String oldPath) {
        try {
            if (Files.deleteIfExists(Paths.get(oldPath))) {
                LOG.info("Deleted replaced master file {}", oldPath);
            }
        } catch (IOException e) {
            LOG.warn("Cannot delete replaced master file {}: {}", oldPath, e.getMessage());
        }
    }

    /** Creation time from the DATE card, as written by this tool or by stacking software. */
    static Optional<LocalDateTime> headerCreationDate(FitsHeader header) {
        Optional<String> date = header.getString(HeaderKey.DATE);
        if (date.isEmpty()) return Optional.empty();
        try {
            return Optional.of(FileClassifier.parseDateObs(date.get()));
        } catch (ValidationException e) {
            LOG.debug("Ignoring unparsable DATE '{}': {}", date.get(), e.getMessage());
            return Optional.empty();
        }
    }

    /** Fills the empty master paths of light sessions with matching masters. */
    public BatchResult assignMastersToLightSessions(CancellationToken token) {
        BatchResult result = new BatchResult();
        List<FitsSession> sessions;
        try {
            sessions = sessionDao.findLightSessions();
        } catch (SQLException e) {
            LOG.error("Cannot list light sessions", e);
            result.addError("Database error: " + e.getMessage());
            return result;
        }
        for (int i = 0; i < sessions.size(); i++) {
            FitsSession s = sessions.get(i);
            if (!token.proceed(i + 1, sessions.size(), s.objectName + " " + s.date)) {
                result.cancelled = true;
                break;
            }
            result.attempted++;
            try {
                for (ImageType type : new ImageType[]{ImageType.BIAS, ImageType.DARK, ImageType.FLAT}) {
                    if (s.masterPath(type) != null) continue;
                    Optional<Master> match = findMatchingMaster(s, type);
                    if (match.isPresent() && sessionDao.fillMasterPath(s.id, type, match.get().path)) {
                        LOG.debug("Session {} uses {} master {}", s.id, type.label(), match.get().path);
                    }
                }
                result.processed++;
            } catch (SQLException e) {
                LOG.error("Master assignment failed for session {}", s.id, e);
                result.addError(s.id + ": " + e.getMessage());
            }
        }
        return result;
    }

    // --- Validation and retention ---

    public MasterValidationReport validateMasters(CancellationToken token) {
        MasterValidationReport report = new MasterValidationReport();
        List<Master> masters;
        try {
            masters = masterDao.findActive();
        } catch (SQLException e) {
            LOG.error("Cannot list masters", e);
            report.addError("Database error: " + e.getMessage());
            return report;
        }
        for (int i = 0; i < masters.size(); i++) {
            Master m = masters.get(i);
            if (!token.proceed(i + 1, masters.size(), m.path)) {
                report.cancelled = true;
                break;
            }
            report.checked++;
            LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
            try {
                Path file = Paths.get(m.path);
                if (!Files.isRegularFile(file)) {
                    LOG.warn("Master {} is missing: {}", m.id, m.path);
                    report.missing.add(m.path);
                    masterDao.updateValidation(m.id, false, now);
                    continue;
                }
                String problem = integrityProblem(m, file);
                if (problem != null) {
                    LOG.warn("Master {} is invalid: {}", m.path, problem);
                    report.invalid.add(m.path);
                    masterDao.updateValidation(m.id, false, now);
                    continue;
                }
                masterDao.updateValidation(m.id, true, now);
                report.valid++;
            } catch (SQLException | IOException e) {
                LOG.error("Validation failed for master {}", m.path, e);
                report.addError(m.path + ": " + e.getMessage());
            }
        }
        LOG.info("Master validation: {}", report);
        return report;
    }

    private String integrityProblem(Master m, Path file) throws IOException {
        if (m.contentHash != null && !m.contentHash.equals(HashService.hash(file))) {
            return "content hash changed";
        }
        try {
            return integrityService.hasImageData(file) ? null : "no usable image data";
        } catch (FitsReadException e) {
            return "unreadable: " + e.getMessage();
        }
    }

    /**
     * Deletes masters created more than {@code retentionDays} ago that no session refers to.
     * The record is kept as soft-deleted.
     */
    public BatchResult cleanupMasters(int retentionDays, CancellationToken token) {
        BatchResult result = new BatchResult();
        List<Master> candidates;
        Set<String> referenced;
        try {
            LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(retentionDays);
            candidates = masterDao.findCreatedBefore(cutoff);
            referenced = sessionDao.findReferencedMasterPaths();
        } catch (SQLException e) {
            LOG.error("Cannot list masters for cleanup", e);
            result.addError("Database error: " + e.getMessage());
            return result;
        }
        for (int i = 0; i < candidates.size(); i++) {
            Master m = candidates.get(i);
            if (!token.proceed(i + 1, candidates.size(), m.path)) {
                result.cancelled = true;
                break;
            }
            if (referenced.contains(m.path)) {
                LOG.debug("Keeping referenced master {}", m.path);
                continue;
            }
            result.attempted++;
            try {
                Files.deleteIfExists(Paths.get(m.path));
                masterDao.softDelete(m.id);
                result.processed++;
                LOG.info("Retired master {}", m.path);
            } catch (IOException | SQLException e) {
                LOG.error("Cleanup failed for master {}", m.path, e);
                result.addError(m.path + ": " + e.getMessage());
            }
        }
        return result;
    }

    private static void deleteRecursively(Path dir) {
        if (!Files.exists(dir)) return;
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    LOG.warn("Cannot delete {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            LOG.warn("Cannot clean up {}: {}", dir, e.getMessage());
        }
    }
}
