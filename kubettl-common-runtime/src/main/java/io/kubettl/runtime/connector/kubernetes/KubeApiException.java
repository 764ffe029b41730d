/*
 * Copyright 2026 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.kubettl.runtime.connector.kubernetes;

import java.io.InterruptedIOException;

import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.models.V1Status;

public class KubeApiException extends RuntimeException {

    private static final String NOT_FOUND = "Not Found";

    public enum ErrorCode {
        CANCELLED,
        INTERNAL,
        NOT_FOUND,
    }

    private final ErrorCode errorCode;

    public KubeApiException(String message, ErrorCode errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public KubeApiException(String message, ErrorCode errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public KubeApiException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = toErrorCode(cause);
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Creates an exception for a Kubernetes API call, that completed with a non-success HTTP status.
     */
    public static KubeApiException fromStatus(String operation, int httpStatusCode, V1Status status) {
        String message = String.format("%s failed: httpStatus=%s, reason=%s, message=%s",
                operation,
                httpStatusCode,
                status == null ? null : status.getReason(),
                status == null ? null : status.getMessage()
        );
        return new KubeApiException(message, httpStatusCode == 404 ? ErrorCode.NOT_FOUND : ErrorCode.INTERNAL);
    }

    private static ErrorCode toErrorCode(Throwable cause) {
        if (cause instanceof ApiException) {
            return toErrorCode((ApiException) cause);
        }
        if (isInterruption(cause)) {
            return ErrorCode.CANCELLED;
        }
        return ErrorCode.INTERNAL;
    }

    private static ErrorCode toErrorCode(ApiException e) {
        if (isInterruption(e.getCause())) {
            return ErrorCode.CANCELLED;
        }
        if (e.getCode() == 404 || NOT_FOUND.equalsIgnoreCase(e.getMessage())) {
            return ErrorCode.NOT_FOUND;
        }
        return ErrorCode.INTERNAL;
    }

    /**
     * A blocking call aborted by a thread interrupt surfaces as {@link InterruptedIOException} (OkHttp) or
     * {@link InterruptedException}, possibly wrapped.
     */
    private static boolean isInterruption(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof InterruptedIOException || current instanceof InterruptedException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}
