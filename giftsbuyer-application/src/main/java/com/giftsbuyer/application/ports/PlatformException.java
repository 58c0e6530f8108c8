package com.giftsbuyer.application.ports;

import com.giftsbuyer.domain.purchase.CodedFailure;

/**
 * Failure of a remote platform call.
 *
 * errorCode is the platform's symbolic code when known (e.g. "BALANCE_TOO_LOW"),
 * status is the transport status (HTTP code or platform error_code), -1 when unknown.
 */
public class PlatformException extends Exception implements CodedFailure {

    private final String errorCode;
    private final int status;

    public PlatformException(String message) {
        this(message, null, -1, null);
    }

    public PlatformException(String message, Throwable cause) {
        this(message, null, -1, cause);
    }

    public PlatformException(String message, String errorCode, int status) {
        this(message, errorCode, status, null);
    }

    public PlatformException(String message, String errorCode, int status, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.status = status;
    }

    @Override
    public String errorCode() {
        return errorCode;
    }

    public int status() {
        return status;
    }
}
