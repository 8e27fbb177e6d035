package com.astrofiler.service;

import com.astrofiler.db.Database;
import com.astrofiler.db.FitsFileDao;
import com.astrofiler.db.FitsSessionDao;
import com.astrofiler.db.MappingDao;
import com.astrofiler.db.MasterDao;
import com.astrofiler.db.MigrationRunner;
import com.astrofiler.model.AppConfig;
import com.astrofiler.model.BatchResult;
import com.astrofiler.model.GroupingResult;
import com.astrofiler.model.IngestionReport;
import com.astrofiler.model.MasterValidationReport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Clock;

/**
 * Wires the services from {@link AppConfig} and runs the processing chain:
 * ingest, group, link, build masters, assign masters.
 */
public class AstroFilerWorkflow {
    private static final Logger LOG = LogManager.getLogger(AstroFilerWorkflow.class);

    private final AppConfig config;
    private final IngestionPipeline pipeline;
    private final SessionGrouper grouper;
    private final CalibrationMatcher matcher;
    private final MasterFrameManager masterManager;
    private final MappingService mappingService;

    public AstroFilerWorkflow(AppConfig config, IngestionPipeline pipeline, SessionGrouper grouper,
                              CalibrationMatcher matcher, MasterFrameManager masterManager,
                              MappingService mappingService) {
        this.config = config;
        this.pipeline = pipeline;
        this.grouper = grouper;
        this.matcher = matcher;
        this.masterManager = masterManager;
        this.mappingService = mappingService;
    }

    /** Opens (and migrates) the configured database and builds every service on it. */
    public static AstroFilerWorkflow create(AppConfig config, XisfConverter xisfConverter, Clock clock)
            throws SQLException {
        Database database = new Database(config.getDatabasePath());
        new MigrationRunner().run(database);

        FitsFileDao fileDao = new FitsFileDao(database);
        FitsSessionDao sessionDao = new FitsSessionDao(database);
        MasterDao masterDao = new MasterDao(database);
        MappingDao mappingDao = new MappingDao(database);

        FitsHeaderService headerService = new FitsHeaderService();
        RepositoryLayout layout = new RepositoryLayout(config.getRepoFolder());
        MasterFrameManager masterManager = new MasterFrameManager(fileDao, sessionDao, masterDao, headerService,
                new ExternalToolService(config.getSirilCliPath()), new MasterIntegrityService(headerService),
                layout, clock);
        IngestionPipeline pipeline = new IngestionPipeline(fileDao, mappingDao, masterManager, headerService,
                xisfConverter, layout, config.getSourceFolder(), config.isSaveModifiedHeaders(), clock);
        MappingService mappingService = new MappingService(mappingDao, fileDao, pipeline.mappingCache());

        return new AstroFilerWorkflow(config, pipeline, new SessionGrouper(fileDao, sessionDao),
                new CalibrationMatcher(sessionDao), masterManager, mappingService);
    }

    /**
     * Runs all steps in order. Returns false when a step was cancelled; later steps are
     * then skipped and can be resumed by running again.
     */
    public boolean run(boolean moveFiles, CancellationToken token) throws SQLException {
        IngestionReport ingestion = pipeline.registerFitsImages(moveFiles, token);
        LOG.info("Ingestion: {}", ingestion);
        if (ingestion.cancelled) return false;

        GroupingResult lights = grouper.createLightSessions(token);
        LOG.info("Light sessions: {}", lights);
        if (lights.cancelled) return false;

        GroupingResult calibrations = grouper.createCalibrationSessions(token);
        LOG.info("Calibration sessions: {}", calibrations);
        if (calibrations.cancelled) return false;

        BatchResult links = matcher.linkSessions(token);
        LOG.info("Linking: {}", links);
        if (links.cancelled) return false;

        BatchResult masters = masterManager.createMastersForSessions(config.getMinMasterFiles(), token);
        LOG.info("Master creation: {}", masters);
        if (masters.cancelled) return false;

        BatchResult assigned = masterManager.assignMastersToLightSessions(token);
        LOG.info("Master assignment: {}", assigned);
        return !assigned.cancelled;
    }

    /** Validates masters, then retires the unreferenced ones past the retention period. */
    public void maintainMasters(CancellationToken token) {
        MasterValidationReport validation = masterManager.validateMasters(token);
        if (validation.cancelled) return;
        BatchResult cleanup = masterManager.cleanupMasters(config.getMasterRetentionDays(), token);
        LOG.info("Master cleanup: {}", cleanup);
    }

    public IngestionPipeline pipeline() { return pipeline; }
    public SessionGrouper grouper() { return grouper; }
    public CalibrationMatcher matcher() { return matcher; }
    public MasterFrameManager masterManager() { return masterManager; }
    public MappingService mappingService() { return mappingService; }
}
