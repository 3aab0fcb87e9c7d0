package com.conveyal.sweep;

import com.conveyal.sweep.util.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Problems with a request that should be reported to the HTTP client with a specific status code. Sweep failures are
 * not reported this way: they are ordinary SweepResults.
 */
public class SweepServerException extends RuntimeException {

    private static final Logger LOG = LoggerFactory.getLogger(SweepServerException.class);

    public final int httpCode;
    public final Type type;
    public final String message;

    public enum Type {
        BAD_REQUEST,
        PROVIDER_DISABLED,
        UNKNOWN;
    }

    public static SweepServerException badRequest (String message) {
        return new SweepServerException(Type.BAD_REQUEST, message, 400);
    }

    public static SweepServerException providerDisabled (String message) {
        return new SweepServerException(Type.PROVIDER_DISABLED, message, 503);
    }

    public static SweepServerException unknown (Exception e) {
        LOG.error(ExceptionUtils.stackTraceString(e));
        return new SweepServerException(Type.UNKNOWN, ExceptionUtils.shortCauseString(e), 500);
    }

    public SweepServerException (Type type, String message, int httpCode) {
        this.type = type;
        this.message = message;
        this.httpCode = httpCode;
    }

    @Override
    public String getMessage () {
        return message;
    }

}
