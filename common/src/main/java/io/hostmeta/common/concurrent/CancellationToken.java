/**
 * Copyright Pravega Authors.
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
package io.hostmeta.common.concurrent;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.concurrent.CompletableFuture;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

/**
 * A one-shot cancellation signal. Futures registered with the token are cancelled when
 * {@link #requestCancellation()} is invoked; futures registered afterwards are cancelled immediately.
 */
@ThreadSafe
public class CancellationToken {
    @GuardedBy("futures")
    private final Collection<CompletableFuture<?>> futures;
    @GuardedBy("futures")
    private boolean cancellationRequested;

    /**
     * Creates a new instance of the CancellationToken class.
     */
    public CancellationToken() {
        this.futures = new HashSet<>();
    }

    /**
     * Registers the given Future to the token.
     *
     * @param future The Future to register.
     * @param <T>    Return type of the future.
     */
    public <T> void register(CompletableFuture<T> future) {
        Preconditions.checkNotNull(future, "future");
        if (future.isDone()) {
            return;
        }

        boolean autoCancel;
        synchronized (this.futures) {
            autoCancel = this.cancellationRequested;
            if (!autoCancel) {
                this.futures.add(future);
            }
        }

        if (autoCancel) {
            future.cancel(true);
            return;
        }

        future.whenComplete((r, ex) -> {
            synchronized (this.futures) {
                this.futures.remove(future);
            }
        });
    }

    /**
     * Cancels all registered futures. Subsequent calls have no further effect.
     */
    public void requestCancellation() {
        Collection<CompletableFuture<?>> toInvoke;
        synchronized (this.futures) {
            this.cancellationRequested = true;
            toInvoke = new ArrayList<>(this.futures);
            this.futures.clear();
        }

        toInvoke.forEach(f -> f.cancel(true));
    }

    /**
     * Gets a value indicating whether {@link #requestCancellation()} has been invoked.
     *
     * @return True if cancellation was requested.
     */
    public boolean isCancellationRequested() {
        synchronized (this.futures) {
            return this.cancellationRequested;
        }
    }

    @Override
    public String toString() {
        return "Cancelled = " + isCancellationRequested();
    }
}
