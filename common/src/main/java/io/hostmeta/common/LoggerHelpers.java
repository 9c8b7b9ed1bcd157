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
package io.hostmeta.common;

import org.slf4j.Logger;

/**
 * Trace-level enter/leave logging with elapsed time.
 */
public final class LoggerHelpers {
    /**
     * Traces the fact that a method entry has occurred.
     *
     * @param log     The Logger to log to.
     * @param context Identifying context for the operation, such as the name of the owning object.
     * @param method  The name of the method.
     * @param args    The arguments to the method.
     * @return An identifier to pass to {@link #traceLeave}. This is the current System.nanoTime(), or 0 if tracing is off.
     */
    public static long traceEnterWithContext(Logger log, String context, String method, Object... args) {
        if (!log.isTraceEnabled()) {
            return 0;
        }

        long time = System.nanoTime();
        log.trace("ENTER {}::{}@{} {}.", context, method, time, args);
        return time;
    }

    /**
     * Traces the fact that a method has exited normally.
     *
     * @param log          The Logger to log to.
     * @param context      Identifying context for the operation.
     * @param method       The name of the method.
     * @param traceEnterId The correlation Id obtained from a traceEnterWithContext call.
     */
    public static void traceLeave(Logger log, String context, String method, long traceEnterId) {
        if (!log.isTraceEnabled()) {
            return;
        }

        long elapsedMicros = (System.nanoTime() - traceEnterId) / 1000;
        log.trace("LEAVE {}::{}@{} (elapsed={}us).", context, method, traceEnterId, elapsedMicros);
    }

    /**
     * Returns either the given {@link Throwable} or its message, depending on the current logging context.
     *
     * @param log The {@link Logger} to query.
     * @param e   The {@link Throwable} to return or process.
     * @return The given {@link Throwable} if debug logging is enabled, or {@link Throwable#toString()} otherwise.
     */
    public static Object exceptionSummary(Logger log, Throwable e) {
        if (log.isDebugEnabled()) {
            return e;
        } else {
            return e.toString();
        }
    }
}
