package io.bankseed.config;

/**
 * How several consecutively missed triggers are compensated.
 */
public enum CatchUpPolicy {
    /** One catch-up task spanning every missed window, horizon at the latest missed trigger. */
    COLLAPSE,
    /** One catch-up task per missed trigger, executed oldest first. */
    SEQUENTIAL
}
