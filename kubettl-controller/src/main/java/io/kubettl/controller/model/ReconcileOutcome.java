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

package io.kubettl.controller.model;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

import com.google.common.base.Preconditions;

/**
 * Outcome of a single reconciliation of a resource. It tells the reconcile queue what to do with the key next.
 */
public final class ReconcileOutcome {

    public enum Kind {
        /**
         * Nothing to do. The resource is gone, or it is not subject to TTL.
         */
        NoOp,

        /**
         * The TTL has not elapsed yet. The key should be delivered again after {@link #getRequeueAfter()}.
         */
        RequeueAfter,

        /**
         * The resource was deleted, or it was found already deleted during the delete call.
         */
        Deleted,

        /**
         * Infrastructure failure (API error, timeout, cancellation). Retrying may succeed.
         */
        TransientError,

        /**
         * The resource is misconfigured. Retrying without changing the resource cannot succeed.
         */
        PermanentError
    }

    private static final ReconcileOutcome NO_OP = new ReconcileOutcome(Kind.NoOp, Duration.ZERO, null);
    private static final ReconcileOutcome DELETED = new ReconcileOutcome(Kind.Deleted, Duration.ZERO, null);

    private final Kind kind;
    private final Duration requeueAfter;
    private final Throwable error;

    private ReconcileOutcome(Kind kind, Duration requeueAfter, Throwable error) {
        this.kind = kind;
        this.requeueAfter = requeueAfter;
        this.error = error;
    }

    public static ReconcileOutcome noOp() {
        return NO_OP;
    }

    public static ReconcileOutcome deleted() {
        return DELETED;
    }

    public static ReconcileOutcome requeueAfter(Duration delay) {
        Preconditions.checkNotNull(delay, "delay is null");
        Preconditions.checkArgument(!delay.isNegative(), "Negative requeue delay: %s", delay);
        return new ReconcileOutcome(Kind.RequeueAfter, delay, null);
    }

    public static ReconcileOutcome transientError(Throwable error) {
        Preconditions.checkNotNull(error, "error is null");
        return new ReconcileOutcome(Kind.TransientError, Duration.ZERO, error);
    }

    public static ReconcileOutcome permanentError(Throwable error) {
        Preconditions.checkNotNull(error, "error is null");
        return new ReconcileOutcome(Kind.PermanentError, Duration.ZERO, error);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Requested redelivery delay. {@link Duration#ZERO} for all kinds except {@link Kind#RequeueAfter}.
     */
    public Duration getRequeueAfter() {
        return requeueAfter;
    }

    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ReconcileOutcome that = (ReconcileOutcome) o;
        return kind == that.kind &&
                Objects.equals(requeueAfter, that.requeueAfter) &&
                Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, requeueAfter, error);
    }

    @Override
    public String toString() {
        switch (kind) {
            case RequeueAfter:
                return "ReconcileOutcome{kind=RequeueAfter, requeueAfter=" + requeueAfter + '}';
            case TransientError:
            case PermanentError:
                return "ReconcileOutcome{kind=" + kind + ", error=" + error + '}';
            default:
                return "ReconcileOutcome{kind=" + kind + '}';
        }
    }
}
