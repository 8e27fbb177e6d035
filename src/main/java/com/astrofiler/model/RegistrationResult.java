package com.astrofiler.model;

/**
 * Outcome of registering a single file.
 */
public class RegistrationResult {

    public enum Status {
        /** New FitsFile row created. */
        REGISTERED,
        /** Content already registered; {@link #id} is the existing row. */
        DUPLICATE,
        /** File recognised as a master frame and registered in the master table. */
        MASTER,
        /** Not a FITS candidate (other zip archives, unrelated extensions). */
        IGNORED,
        REJECTED
    }

    public final Status status;
    public final String id;
    public final String path;
    public final String message;

    private RegistrationResult(Status status, String id, String path, String message) {
        this.status = status;
        this.id = id;
        this.path = path;
        this.message = message;
    }

    public static RegistrationResult registered(String id, String path) {
        return new RegistrationResult(Status.REGISTERED, id, path, null);
    }

    public static RegistrationResult duplicate(String existingId, String path) {
        return new RegistrationResult(Status.DUPLICATE, existingId, path, "Duplicate of " + existingId);
    }

    public static RegistrationResult master(String masterId, String path) {
        return new RegistrationResult(Status.MASTER, masterId, path, null);
    }

    public static RegistrationResult ignored(String path, String reason) {
        return new RegistrationResult(Status.IGNORED, null, path, reason);
    }

    public static RegistrationResult rejected(String path, String reason) {
        return new RegistrationResult(Status.REJECTED, null, path, reason);
    }

    /** True when the file is known to the store after this call. */
    public boolean isSuccess() {
        return status == Status.REGISTERED || status == Status.DUPLICATE || status == Status.MASTER;
    }

    @Override
    public String toString() {
        return status + (id != null ? " " + id : "") + " " + path + (message != null ? " (" + message + ")" : "");
    }
}
