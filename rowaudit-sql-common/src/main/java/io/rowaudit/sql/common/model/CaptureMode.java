package io.rowaudit.sql.common.model;

/**
 * How the before/after images of an audit record were obtained.
 */
public enum CaptureMode {
    /** The statement itself returned the images through an OUTPUT clause. Exact and race free. */
    REWRITE,
    /** Images were read with separate SELECT statements around the execution. Best effort. */
    RELOAD
}
