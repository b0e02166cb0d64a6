package com.browserpilot.core.errors;

/**
 * Category of a client-side failure. Drives how the failure is rendered and
 * whether local session state has to be torn down.
 */
public enum ErrorKind {
    VALIDATION,
    TRANSPORT,
    SESSION_LOST,
    CAPTCHA_PENDING,
    REMOTE_FAILURE
}
