/*
 * Copyright (c) 2014 Denis Mikhalkin.
 *
 * This software is provided to you under the Apache License,
 * Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License.  You may obtain a copy of the
 * License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package com.denismo.rdnmigration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one migration run. Partial success is normal: check
 * {@link #getFailedEntries()} and re-run to retry only what failed.
 */
public final class MigrationResult {
    private final boolean success;
    private final MigrationMode mode;
    private final int entriesMigrated;
    private final List<FailedEntry> failedEntries;
    private final List<String> warnings;

    public MigrationResult(boolean success, MigrationMode mode, int entriesMigrated,
                           List<FailedEntry> failedEntries, List<String> warnings) {
        this.success = success;
        this.mode = mode;
        this.entriesMigrated = entriesMigrated;
        this.failedEntries = Collections.unmodifiableList(new ArrayList<FailedEntry>(failedEntries));
        this.warnings = Collections.unmodifiableList(new ArrayList<String>(warnings));
    }

    /**
     * A run that stopped before touching any entry.
     */
    static MigrationResult aborted(MigrationMode mode, String warning) {
        return new MigrationResult(false, mode, 0, Collections.<FailedEntry>emptyList(),
                Collections.singletonList(warning));
    }

    /**
     * A run that had nothing to do.
     */
    static MigrationResult nothingToDo(MigrationMode mode, String warning) {
        return new MigrationResult(true, mode, 0, Collections.<FailedEntry>emptyList(),
                Collections.singletonList(warning));
    }

    public boolean isSuccess() {
        return success;
    }

    public MigrationMode getMode() {
        return mode;
    }

    public int getEntriesMigrated() {
        return entriesMigrated;
    }

    public int getEntriesFailed() {
        return failedEntries.size();
    }

    public List<FailedEntry> getFailedEntries() {
        return failedEntries;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    @Override
    public String toString() {
        return "MigrationResult{success=" + success + ", mode=" + mode.getValue()
                + ", migrated=" + entriesMigrated + ", failed=" + failedEntries
                + ", warnings=" + warnings + "}";
    }
}
