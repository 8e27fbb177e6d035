package com.astrofiler.model;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.prefs.Preferences;

/**
 * User settings, persisted in a {@link Preferences} node.
 */
public class AppConfig {

    private static final String KEY_SOURCE = "source";
    private static final String KEY_REPO = "repo";
    private static final String KEY_SAVE_HEADERS = "save_modified_headers";
    private static final String KEY_SIRIL = "siril_cli_path";
    private static final String KEY_RETENTION = "master_retention_days";
    private static final String KEY_MIN_FILES = "min_master_files";
    private static final String KEY_DB = "db_path";

    private final Preferences prefs;

    public AppConfig() {
        this(Preferences.userNodeForPackage(AppConfig.class));
    }

    public AppConfig(Preferences prefs) {
        this.prefs = prefs;
    }

    // --- Folders ---
    public Path getSourceFolder() { return Paths.get(prefs.get(KEY_SOURCE, ".")); }
    public void setSourceFolder(Path v) { prefs.put(KEY_SOURCE, v.toString()); }

    public Path getRepoFolder() { return Paths.get(prefs.get(KEY_REPO, "./repo")); }
    public void setRepoFolder(Path v) { prefs.put(KEY_REPO, v.toString()); }

    public Path getMastersFolder() { return getRepoFolder().resolve("Masters"); }

    /** Database file, inside the repository unless configured otherwise. */
    public Path getDatabasePath() {
        String v = prefs.get(KEY_DB, "");
        return v.isEmpty() ? getRepoFolder().resolve("astrofiler.db") : Paths.get(v);
    }
    public void setDatabasePath(Path v) { prefs.put(KEY_DB, v.toString()); }

    // --- Ingestion ---
    public boolean isSaveModifiedHeaders() { return prefs.getBoolean(KEY_SAVE_HEADERS, false); }
    public void setSaveModifiedHeaders(boolean v) { prefs.putBoolean(KEY_SAVE_HEADERS, v); }

    // --- Masters ---
    public String getSirilCliPath() { return prefs.get(KEY_SIRIL, "siril-cli"); }
    public void setSirilCliPath(String v) { prefs.put(KEY_SIRIL, v); }

    public int getMasterRetentionDays() { return prefs.getInt(KEY_RETENTION, 365); }
    public void setMasterRetentionDays(int v) { prefs.putInt(KEY_RETENTION, v); }

    public int getMinMasterFiles() { return prefs.getInt(KEY_MIN_FILES, 2); }
    public void setMinMasterFiles(int v) { prefs.putInt(KEY_MIN_FILES, v); }
}
