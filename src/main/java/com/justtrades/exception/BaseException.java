package com.justtrades.exception;

import com.justtrades.domain.model.PositionKey;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Root of the engine's unchecked exceptions. The {@link ErrorCode} fixes the
 * HTTP status; {@code details} is copied into the error envelope as-is.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        this(errorCode, message, details, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, null, cause);
    }

    private BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    /** Details naming the position, followed by {@code extra} as alternating name/value pairs. */
    protected static Map<String, Object> positionDetails(PositionKey key, Object... extra) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("accountId", key.accountId());
        details.put("symbol", key.symbol());
        for (int i = 0; i + 1 < extra.length; i += 2) {
            details.put(String.valueOf(extra[i]), String.valueOf(extra[i + 1]));
        }
        return details;
    }
}
