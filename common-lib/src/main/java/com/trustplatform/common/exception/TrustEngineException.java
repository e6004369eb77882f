package com.trustplatform.common.exception;

/**
 * Base failure of the trust pipeline. Always unchecked; callers translate it into a
 * result value or an HTTP status at the boundary.
 */
public class TrustEngineException extends RuntimeException {

    public TrustEngineException(String message) {
        super(message);
    }

    public TrustEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
