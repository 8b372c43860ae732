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

/**
 * What happened when an RDN setting was changed.
 */
public final class RdnChangeOutcome {

    public enum Status {
        /** The setting does not name a container RDN. */
        NOT_AN_RDN_SETTING,
        /** No previous value, or the same RDN. */
        UNCHANGED,
        /** Nothing lives under the old RDN. */
        NO_IMPACT,
        /** Entries would be affected and the change was not confirmed. */
        CONFIRMATION_REQUIRED,
        MIGRATED,
        LEFT_ORPHANED
    }

    private final Status status;
    private final String setting;
    private final MigrationCheck check;
    private final MigrationResult result;

    RdnChangeOutcome(Status status, String setting, MigrationCheck check, MigrationResult result) {
        this.status = status;
        this.setting = setting;
        this.check = check;
        this.result = result;
    }

    public Status getStatus() {
        return status;
    }

    /** {@code plugin.key} of the changed setting. */
    public String getSetting() {
        return setting;
    }

    /** Null unless the impact was checked. */
    public MigrationCheck getCheck() {
        return check;
    }

    /** Null unless a migration (or an explicit orphaning) was run. */
    public MigrationResult getResult() {
        return result;
    }

    /**
     * Whether the caller may go on and store the new setting value.
     */
    public boolean isSettingChangeAllowed() {
        return status != Status.CONFIRMATION_REQUIRED;
    }

    @Override
    public String toString() {
        return "RdnChangeOutcome{" + setting + ": " + status + (result != null ? ", " + result : "") + "}";
    }
}
