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
package io.hostmeta.agent.api;

import com.google.common.base.Preconditions;
import com.google.common.collect.ComparisonChain;
import io.hostmeta.common.Exceptions;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A route table key: an HTTP method and a path prefix. Keys order by method, then by prefix, so that within one method
 * a prefix always sorts before its own extensions.
 */
@Getter
@EqualsAndHashCode
public final class RouteKey implements Comparable<RouteKey> {
    private final String method;
    private final String prefix;

    public RouteKey(String method, String prefix) {
        this.method = Exceptions.checkNotNullOrEmpty(method, "method");
        this.prefix = Preconditions.checkNotNull(prefix, "prefix");
    }

    /**
     * Determines whether a request with the given method and path is routed by this key.
     *
     * @param requestMethod The request method. Compared exactly.
     * @param path          The request path.
     * @return True if the methods are equal and prefix is a literal prefix of path.
     */
    public boolean matches(String requestMethod, String path) {
        return this.method.equals(requestMethod) && path.startsWith(this.prefix);
    }

    @Override
    public int compareTo(RouteKey other) {
        return ComparisonChain.start()
                .compare(this.method, other.method)
                .compare(this.prefix, other.prefix)
                .result();
    }

    @Override
    public String toString() {
        return this.method + " " + this.prefix;
    }
}
