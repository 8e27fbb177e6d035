package com.astrofiler.main;

import com.astrofiler.model.AppConfig;
import com.astrofiler.service.AstroFilerWorkflow;
import com.astrofiler.service.CancellationToken;
import com.astrofiler.service.XisfConverter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Clock;

/**
 * Runs the full pipeline once with the stored user settings.
 */
public class AstroFilerApp {
    private static final Logger LOG = LogManager.getLogger(AstroFilerApp.class);

    public static void main(String[] args) {
        AppConfig config = new AppConfig();
        LOG.info("Source: {}, repository: {}", config.getSourceFolder(), config.getRepoFolder());
        try {
            AstroFilerWorkflow workflow = AstroFilerWorkflow.create(config, XisfConverter.unsupported(),
                    Clock.systemDefaultZone());
            CancellationToken token = new CancellationToken((current, total, label) -> {
                LOG.debug("[{}/{}] {}", current, total, label);
                return true;
            });
            if (workflow.run(true, token)) {
                workflow.maintainMasters(token);
            }
        } catch (SQLException e) {
            LOG.error("Database failure: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
