package com.astrofiler.service;

import com.astrofiler.exception.ExternalToolException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Runs the stacking tool as {@code <tool> -s <script>} and waits for it to finish.
 * No timeout is applied.
 */
public class ExternalToolService {
    private static final Logger LOG = LogManager.getLogger(ExternalToolService.class);

    private final String toolPath;

    public ExternalToolService(String toolPath) {
        this.toolPath = toolPath;
    }

    public void runScript(Path script, Path workDir) throws ExternalToolException {
        if (toolPath == null || toolPath.isEmpty()) {
            throw new ExternalToolException("Stacking tool path not configured", -1);
        }
        ProcessBuilder pb = new ProcessBuilder(toolPath, "-s", script.toAbsolutePath().toString());
        pb.directory(workDir.toFile());
        pb.redirectErrorStream(true);

        int exitCode;
        try {
            Process p = pb.start();
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    LOG.debug("[{}] {}", toolPath, line);
                }
            }
            exitCode = p.waitFor();
        } catch (IOException e) {
            throw new ExternalToolException("Cannot start " + toolPath + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalToolException("Interrupted while waiting for " + toolPath, e);
        }

        if (exitCode != 0) {
            throw new ExternalToolException(toolPath + " exited with status " + exitCode, exitCode);
        }
        LOG.info("{} finished script {}", toolPath, script.getFileName());
    }
}
