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
package io.hostmeta.agent.updater;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.Uninterruptibles;
import io.hostmeta.common.Exceptions;
import io.hostmeta.common.LoggerHelpers;
import io.hostmeta.common.concurrent.CancellationToken;
import io.hostmeta.common.concurrent.ExecutorServiceHelpers;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.concurrent.ThreadSafe;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Update source that periodically invokes a {@link MetadataQuery} on its own dedicated thread and commits every
 * result, resource mapping first and metadata second.
 * <p>
 * Between polls the thread waits on a stop signal rather than sleeping, so {@link #stopUpdater()} wakes it immediately
 * regardless of the period. A query that throws only loses its own cycle: the failure is logged and polling resumes
 * after the next period.
 */
@Slf4j
@ThreadSafe
public final class PollingMetadataUpdater implements UpdaterHooks {
    @Getter
    private final String name;
    @Getter
    private final Duration period;
    private final MetadataQuery queryMetadata;
    private final CancellationToken cancellation;
    private final CompletableFuture<Void> stopSignal;
    private final AtomicReference<Thread> pollThread;

    /**
     * Creates a new instance of the PollingMetadataUpdater class.
     *
     * @param name          The name of the update source.
     * @param period        The time to wait between the end of one poll and the start of the next.
     * @param queryMetadata The query to run on every poll.
     */
    public PollingMetadataUpdater(String name, Duration period, MetadataQuery queryMetadata) {
        this.name = Exceptions.checkNotNullOrEmpty(name, "name");
        this.period = Preconditions.checkNotNull(period, "period");
        this.queryMetadata = Preconditions.checkNotNull(queryMetadata, "queryMetadata");
        this.cancellation = new CancellationToken();
        this.stopSignal = new CompletableFuture<>();
        this.pollThread = new AtomicReference<>();
    }

    @Override
    public boolean validateConfiguration() {
        if (this.period.isNegative() || this.period.isZero()) {
            log.warn("{}: Polling period must be positive, but is {}.", this.name, this.period);
            return false;
        }
        return true;
    }

    @Override
    public void startUpdater(MetadataCommitter committer) {
        Preconditions.checkNotNull(committer, "committer");
        Thread thread = ExecutorServiceHelpers.getThreadFactory("updater-" + this.name)
                .newThread(() -> pollForMetadata(committer));
        Preconditions.checkState(this.pollThread.compareAndSet(null, thread), "%s: Already started.", this.name);
        this.cancellation.register(this.stopSignal);
        thread.start();
    }

    @Override
    public void stopUpdater() {
        this.cancellation.requestCancellation();
        Thread thread = this.pollThread.get();
        if (thread != null && thread != Thread.currentThread()) {
            // Stop must not return while the poll thread can still commit, even if the caller is interrupted.
            Uninterruptibles.joinUninterruptibly(thread);
        }
    }

    private void pollForMetadata(MetadataCommitter committer) {
        log.info("{}: Polling for metadata every {}.", this.name, this.period);
        do {
            pollOnce(committer);
        } while (awaitNextPoll());
        log.info("{}: Polling stopped.", this.name);
    }

    private void pollOnce(MetadataCommitter committer) {
        long traceId = LoggerHelpers.traceEnterWithContext(log, this.name, "pollOnce");
        List<ResourceMetadata> results;
        try {
            results = this.queryMetadata.query();
        } catch (Exception ex) {
            log.warn("{}: Metadata query failed; retrying in {}. {}", this.name, this.period, LoggerHelpers.exceptionSummary(log, ex));
            return;
        }

        if (results == null) {
            log.warn("{}: Metadata query returned no result list; retrying in {}.", this.name, this.period);
            return;
        }

        int committed = 0;
        try {
            for (ResourceMetadata result : results) {
                committer.updateResource(result);
                committer.updateMetadata(result);
                committed++;
            }
        } catch (RuntimeException ex) {
            log.warn("{}: Commit failed after {} of {} results; retrying in {}. {}",
                    this.name, committed, results.size(), this.period, LoggerHelpers.exceptionSummary(log, ex));
            return;
        }

        log.debug("{}: Committed {} results.", this.name, committed);
        LoggerHelpers.traceLeave(log, this.name, "pollOnce", traceId);
    }

    /**
     * Waits for one period or until stopped, whichever comes first.
     *
     * @return True if the next poll should run, false if polling must stop.
     */
    private boolean awaitNextPoll() {
        if (this.cancellation.isCancellationRequested()) {
            return false;
        }

        try {
            this.stopSignal.get(this.period.toMillis(), TimeUnit.MILLISECONDS);
            return false;
        } catch (TimeoutException ex) {
            return true;
        } catch (CancellationException | ExecutionException ex) {
            return false;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public String toString() {
        return String.format("PollingMetadataUpdater(%s, period=%s)", this.name, this.period);
    }
}
