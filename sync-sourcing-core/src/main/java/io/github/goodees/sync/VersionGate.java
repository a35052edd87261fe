package io.github.goodees.sync;

/*-
 * #%L
 * sync-sourcing
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import java.util.concurrent.atomic.AtomicLong;

/**
 * Optimistic concurrency gate of single aggregate. The gate owns the version counter, and advances it by exactly one
 * for a caller, that presents the version it has read. Of all callers presenting the same version at most one
 * succeeds, the others are told their read was stale.
 *
 * <p>The gate never blocks and rejection is not an error, it is the expected outcome under contention.</p>
 */
public final class VersionGate {
    private final AtomicLong version;

    public VersionGate(long initialVersion) {
        if (initialVersion < 0) {
            throw new IllegalArgumentException("Version cannot be negative, was " + initialVersion);
        }
        this.version = new AtomicLong(initialVersion);
    }

    /**
     * Atomically advance the counter from {@code expectedVersion} to {@code expectedVersion + 1}.
     * @param expectedVersion the version the caller based its change on
     * @return accepted transition with the new version, or rejected transition when counter was at different version
     */
    public Transition tryAdvance(long expectedVersion) {
        long next = expectedVersion + 1;
        if (version.compareAndSet(expectedVersion, next)) {
            return new Transition(true, next);
        } else {
            return new Transition(false, expectedVersion);
        }
    }

    public long currentVersion() {
        return version.get();
    }

    @Override
    public String toString() {
        return "VersionGate[" + version.get() + "]";
    }

    /**
     * Outcome of {@link #tryAdvance(long)}.
     */
    public static final class Transition {
        private final boolean accepted;
        private final long version;

        Transition(boolean accepted, long version) {
            this.accepted = accepted;
            this.version = version;
        }

        public boolean isAccepted() {
            return accepted;
        }

        /**
         * @return the new version if accepted, the expected (attempted) version otherwise
         */
        public long getVersion() {
            return version;
        }

        @Override
        public String toString() {
            return (accepted ? "Accepted[" : "Rejected[") + version + "]";
        }
    }
}
