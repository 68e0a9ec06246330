package com.questrail.repomon.cli;

import com.questrail.repomon.error.BridgeErrorKind;

/**
 * Process exit codes of the bridge command.
 */
public enum ExitCode {
    /** Session ended because the peer closed. */
    SUCCESS(0),
    /** Arguments or remote address were invalid. */
    INVALID_ARGS(2),
    /** Socket bind, read or write failed, or the console output failed. */
    IO_ERROR(3),
    /** The stream connection could not be established. */
    CONNECTION_ERROR(4),
    /** Unexpected runtime failure. */
    RUNTIME_FAILURE(5),
    /** Process was interrupted. */
    INTERRUPTED(130);

    private final int code;

    ExitCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static ExitCode forError(BridgeErrorKind kind) {
        if (kind.isIoFailure()) {
            return IO_ERROR;
        }
        return kind == BridgeErrorKind.CONNECTION ? CONNECTION_ERROR : INVALID_ARGS;
    }
}
