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
 * Snapshot of what an RDN change would affect. Purely advisory:
 * {@link #isBlocking()} is always false.
 */
public final class MigrationCheck {
    private final String oldRdn;
    private final String newRdn;
    private final String baseDn;
    private final int entriesCount;
    private final List<String> entriesDns;
    private final boolean supportsNativeRename;
    private final MigrationMode recommendedMode;
    private final List<String> warnings;

    public MigrationCheck(String oldRdn, String newRdn, String baseDn, int entriesCount, List<String> entriesDns,
                          boolean supportsNativeRename, MigrationMode recommendedMode, List<String> warnings) {
        this.oldRdn = oldRdn;
        this.newRdn = newRdn;
        this.baseDn = baseDn;
        this.entriesCount = entriesCount;
        this.entriesDns = Collections.unmodifiableList(new ArrayList<String>(entriesDns));
        this.supportsNativeRename = supportsNativeRename;
        this.recommendedMode = recommendedMode;
        this.warnings = Collections.unmodifiableList(new ArrayList<String>(warnings));
    }

    public String getOldRdn() {
        return oldRdn;
    }

    public String getNewRdn() {
        return newRdn;
    }

    public String getBaseDn() {
        return baseDn;
    }

    /** All affected entries, not just the ones in {@link #getEntriesDns()}. */
    public int getEntriesCount() {
        return entriesCount;
    }

    /** Preview of the affected DNs, capped for display. */
    public List<String> getEntriesDns() {
        return entriesDns;
    }

    public boolean isSupportsNativeRename() {
        return supportsNativeRename;
    }

    public MigrationMode getRecommendedMode() {
        return recommendedMode;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public boolean isBlocking() {
        return false;
    }

    @Override
    public String toString() {
        return "MigrationCheck{" + oldRdn + " -> " + newRdn + " under " + baseDn
                + ", entries=" + entriesCount + ", recommended=" + recommendedMode.getValue()
                + ", warnings=" + warnings + "}";
    }
}
