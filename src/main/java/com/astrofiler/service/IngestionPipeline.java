package com.astrofiler.service;

import com.astrofiler.db.FitsFileDao;
import com.astrofiler.db.MappingDao;
import com.astrofiler.exception.FitsReadException;
import com.astrofiler.exception.ValidationException;
import com.astrofiler.exception.VendorNormalizationException;
import com.astrofiler.model.FitsFile;
import com.astrofiler.model.FitsHeader;
import com.astrofiler.model.IngestionReport;
import com.astrofiler.model.RegistrationResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Registers incoming files: unpack, read header, repair, classify, hash, deduplicate,
 * store and optionally move into the repository.
 * <p>
 * Every per-file failure ends in a {@link RegistrationResult.Status#REJECTED} result;
 * nothing is thrown to the caller.
 */
public class IngestionPipeline {
    private static final Logger LOG = LogManager.getLogger(IngestionPipeline.class);

    private final FitsFileDao fileDao;
    private final HashService hashService;
    private final FitsHeaderService headerService;
    private final HeaderMappingCache mappingCache;
    private final HeaderNormalizer normalizer;
    private final FileClassifier classifier = new FileClassifier();
    private final MasterFrameManager masterManager;
    private final ZipExtractor zipExtractor = new ZipExtractor();
    private final XisfConverter xisfConverter;
    private final RepositoryLayout layout;
    private final Path sourceFolder;
    private final boolean saveModifiedHeaders;

    public IngestionPipeline(FitsFileDao fileDao, MappingDao mappingDao, MasterFrameManager masterManager,
                             FitsHeaderService headerService, XisfConverter xisfConverter, RepositoryLayout layout,
                             Path sourceFolder, boolean saveModifiedHeaders, Clock clock) {
        this.fileDao = fileDao;
        this.hashService = new HashService(fileDao);
        this.headerService = headerService;
        this.mappingCache = new HeaderMappingCache(mappingDao);
        this.normalizer = new HeaderNormalizer(new DwarfHeaderFixer(clock), mappingCache);
        this.masterManager = masterManager;
        this.xisfConverter = xisfConverter;
        this.layout = layout;
        this.sourceFolder = sourceFolder;
        this.saveModifiedHeaders = saveModifiedHeaders;
    }

    /** Mapping cache of this pipeline; invalidate it whenever mapping rules change. */
    public HeaderMappingCache mappingCache() {
        return mappingCache;
    }

    public HashService hashService() {
        return hashService;
    }

    public RegistrationResult registerFitsImage(Path root, String fileName, boolean moveFiles) {
        Path file = root.resolve(fileName);
        String lower = fileName.toLowerCase(Locale.ROOT);
        try {
            if (lower.endsWith(".zip")) {
                return registerArchive(root, file, moveFiles);
            }
            if (lower.endsWith(".xisf")) {
                file = xisfConverter.convert(file);
            }

            if (!extension(file).contains("fit")) {
                return reject(file, "Not a FITS file");
            }

            FitsHeader header = headerService.readHeader(file);

            if (isMasterFile(root, file)) {
                return masterManager.registerMasterFile(file);
            }

            normalizer.normalize(file, header);
            FitsFile record = classifier.classify(header);
            String canonicalName = FileNamer.canonicalName(record);

            if (header.isModified() && saveModifiedHeaders) {
                saveHeader(file, header);
            }

            String digest = HashService.hash(file);
            Optional<String> existing = hashService.lookup(digest);
            if (existing.isPresent()) {
                LOG.info("{} is a duplicate of {}", file.getFileName(), existing.get());
                return RegistrationResult.duplicate(existing.get(), RepositoryLayout.toStoredPath(file));
            }

            record.id = UUID.randomUUID().toString();
            record.path = RepositoryLayout.toStoredPath(file);
            record.contentHash = digest;
            fileDao.insert(record);

            if (moveFiles) {
                try {
                    Path target = relocate(file, record, canonicalName);
                    record.path = RepositoryLayout.toStoredPath(target);
                    fileDao.updatePath(record.id, record.path);
                } catch (IOException e) {
                    fileDao.delete(record.id);
                    return reject(file, "Cannot move into repository: " + e.getMessage());
                }
            }
            LOG.info("Registered {} {} as {}", record.type.label(), fileName, record.path);
            return RegistrationResult.registered(record.id, record.path);
        } catch (FitsReadException | ValidationException | VendorNormalizationException e) {
            return reject(file, e.getMessage());
        } catch (IOException | SQLException e) {
            LOG.error("Registration of {} failed", file, e);
            return RegistrationResult.rejected(RepositoryLayout.toStoredPath(file), e.getMessage());
        }
    }

    /**
     * Registers the FITS member of an archive. The extracted copy is removed again unless
     * it was registered as a new frame or a master.
     */
    private RegistrationResult registerArchive(Path root, Path archive, boolean moveFiles) throws IOException {
        if (!ZipExtractor.isFitsArchive(archive.getFileName().toString())) {
            return RegistrationResult.ignored(RepositoryLayout.toStoredPath(archive), "Not a FITS archive");
        }
        Optional<Path> extracted = zipExtractor.extractFits(archive);
        if (extracted.isEmpty()) {
            return reject(archive, "Archive contains no FITS file");
        }
        Path member = extracted.get();
        RegistrationResult result = registerFitsImage(root, member.toString(), moveFiles);
        if (result.status == RegistrationResult.Status.DUPLICATE
                || result.status == RegistrationResult.Status.REJECTED) {
            Files.deleteIfExists(member);
            LOG.debug("Removed extracted {} ({})", member.getFileName(), result.status);
        }
        return result;
    }

    /** Registers everything below the configured source folder. */
    public IngestionReport registerFitsImages(boolean moveFiles, CancellationToken token) {
        return registerFitsImages(sourceFolder, moveFiles, token);
    }

    public IngestionReport registerFitsImages(Path folder, boolean moveFiles, CancellationToken token) {
        IngestionReport report = new IngestionReport();
        List<Path> files;
        try (Stream<Path> walk = Files.walk(folder)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(IngestionPipeline::isCandidate)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            LOG.error("Cannot scan {}", folder, e);
            report.record(RegistrationResult.rejected(RepositoryLayout.toStoredPath(folder), e.getMessage()));
            return report;
        }

        report.total = files.size();
        LOG.info("Found {} candidate files in {}", files.size(), folder);
        for (int i = 0; i < files.size(); i++) {
            Path f = files.get(i);
            String name = f.getFileName().toString();
            if (!token.proceed(i + 1, files.size(), name)) {
                report.cancelled = true;
                LOG.info("Ingestion cancelled before {}", name);
                break;
            }
            report.record(registerFitsImage(folder, folder.relativize(f).toString(), moveFiles));
        }
        LOG.info("Ingestion finished: {}", report);
        return report;
    }

    private void saveHeader(Path file, FitsHeader header) {
        try {
            Path backup = file.resolveSibling(file.getFileName() + ".backup");
            if (!Files.exists(backup)) {
                Files.copy(file, backup);
            }
            headerService.writeHeader(file, header);
        } catch (IOException e) {
            LOG.warn("Could not save repaired header of {}: {}", file, e.getMessage());
        }
    }

    private Path relocate(Path file, FitsFile record, String canonicalName) throws IOException {
        Path dir = layout.directoryFor(record);
        Files.createDirectories(dir);
        Path current = file.toAbsolutePath().normalize();
        if (current.equals(dir.resolve(canonicalName))) {
            return current;
        }
        Path target = RepositoryLayout.uniquePath(dir, canonicalName);
        return Files.move(current, target);
    }

    private static boolean isMasterFile(Path root, Path file) {
        if (file.getFileName().toString().toLowerCase(Locale.ROOT).contains("master")) return true;
        Path dir = file.toAbsolutePath().normalize().getParent();
        Path base = root.toAbsolutePath().normalize();
        Path rel = dir.startsWith(base) ? base.relativize(dir) : dir;
        return RepositoryLayout.isMastersPath(rel);
    }

    static boolean isCandidate(Path p) {
        String lower = p.getFileName().toString().toLowerCase(Locale.ROOT);
        return extension(p).contains("fit") || lower.endsWith(".zip") || lower.endsWith(".xisf");
    }

    private static String extension(Path p) {
        String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1);
    }

    private static RegistrationResult reject(Path file, String reason) {
        LOG.warn("Rejected {}: {}", file.getFileName(), reason);
        return RegistrationResult.rejected(RepositoryLayout.toStoredPath(file), reason);
    }
}
