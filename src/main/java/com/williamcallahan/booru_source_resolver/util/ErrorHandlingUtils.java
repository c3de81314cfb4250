/**
 * Utility class for standardized error classification across the resolver
 * Decides retryability for the fetch layer and maps failures onto attempt statuses
 *
 * @author William Callahan
 */

package com.williamcallahan.booru_source_resolver.util;

import com.williamcallahan.booru_source_resolver.types.AttemptStatus;
import com.williamcallahan.booru_source_resolver.types.BackupFailedException;
import com.williamcallahan.booru_source_resolver.types.BadChunkException;
import com.williamcallahan.booru_source_resolver.types.DecodeException;
import com.williamcallahan.booru_source_resolver.types.EntryNotFoundException;
import com.williamcallahan.booru_source_resolver.types.FetchException;
import com.williamcallahan.booru_source_resolver.types.NotApplicableException;
import com.williamcallahan.booru_source_resolver.types.SourceResolutionException;
import com.williamcallahan.booru_source_resolver.types.ValidationException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;
import reactor.netty.http.client.PrematureCloseException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

public final class ErrorHandlingUtils {

    private ErrorHandlingUtils() {
    }

    /**
     * Standard error categorization for consistent handling
     */
    public enum ErrorCategory {
        TIMEOUT,
        CONNECTION,
        SERVER_ERROR,
        RATE_LIMIT,
        CLIENT_ERROR,
        GENERAL
    }

    /**
     * Categorize an exception into standard error types
     */
    public static ErrorCategory categorizeError(Throwable throwable) {
        Throwable unwrapped = Exceptions.unwrap(throwable);
        if (unwrapped instanceof FetchException fetchException) {
            Integer status = fetchException.getStatusCode();
            if (status == null) {
                return fetchException.getCause() != null ? categorizeError(fetchException.getCause()) : ErrorCategory.CONNECTION;
            }
            if (status == 429) {
                return ErrorCategory.RATE_LIMIT;
            }
            return status >= 500 ? ErrorCategory.SERVER_ERROR : ErrorCategory.CLIENT_ERROR;
        }
        if (unwrapped instanceof TimeoutException) {
            return ErrorCategory.TIMEOUT;
        }
        if (unwrapped instanceof PrematureCloseException
            || unwrapped instanceof WebClientRequestException
            || unwrapped instanceof IOException) {
            return ErrorCategory.CONNECTION;
        }
        if (unwrapped.getCause() != null && unwrapped.getCause() != unwrapped) {
            ErrorCategory nested = categorizeError(unwrapped.getCause());
            if (nested != ErrorCategory.GENERAL) {
                return nested;
            }
        }
        return ErrorCategory.GENERAL;
    }

    /**
     * Connection resets, timeouts, 5xx and 429 are worth another attempt; every other HTTP status is final
     */
    public static boolean isRetryable(Throwable throwable) {
        ErrorCategory category = categorizeError(throwable);
        return category == ErrorCategory.TIMEOUT
            || category == ErrorCategory.CONNECTION
            || category == ErrorCategory.SERVER_ERROR
            || category == ErrorCategory.RATE_LIMIT;
    }

    /**
     * Recoverable failures demote to "try the next strategy"; anything else is a programming error
     */
    public static boolean isRecoverable(Throwable throwable) {
        Throwable unwrapped = Exceptions.unwrap(throwable);
        return unwrapped instanceof SourceResolutionException sre && sre.isRecoverable();
    }

    public static AttemptStatus toAttemptStatus(Throwable throwable) {
        Throwable unwrapped = Exceptions.unwrap(throwable);
        if (unwrapped instanceof NotApplicableException) {
            return AttemptStatus.NOT_APPLICABLE;
        } else if (unwrapped instanceof ValidationException) {
            return AttemptStatus.FAILURE_VALIDATION;
        } else if (unwrapped instanceof DecodeException) {
            return AttemptStatus.FAILURE_DECODE;
        } else if (unwrapped instanceof FetchException) {
            return AttemptStatus.FAILURE_FETCH;
        } else if (unwrapped instanceof BadChunkException
            || unwrapped instanceof EntryNotFoundException
            || unwrapped instanceof BackupFailedException) {
            return AttemptStatus.FAILURE_INTEGRITY;
        }
        return AttemptStatus.FAILURE_GENERIC;
    }
}
