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

import com.denismo.rdnmigration.config.CapabilityProbe;
import com.denismo.rdnmigration.config.MigrationSettings;
import com.denismo.rdnmigration.directory.DirectoryClient;

/**
 * Entry point for RDN changes: an advisory impact check and the migration
 * itself, both against the same directory.
 * <p>
 * {@link #checkRdnChange} is lenient and always returns a report.
 * {@link #migrateEntries} is strict about the batch as a whole and lenient
 * about single entries, see {@link MigrationExecutor}. Neither throws for
 * directory failures.
 */
public class RdnMigrationService {
    private final MigrationSettings settings;
    private final ImpactAnalyzer analyzer;
    private final MigrationExecutor executor;

    public RdnMigrationService(DirectoryClient client) {
        this(client, MigrationSettings.defaults());
    }

    public RdnMigrationService(DirectoryClient client, MigrationSettings settings) {
        this.settings = settings;
        CapabilityProbe probe = new CapabilityProbe(settings);
        this.analyzer = new ImpactAnalyzer(client, probe);
        this.executor = new MigrationExecutor(client, probe);
    }

    public MigrationSettings getSettings() {
        return settings;
    }

    /**
     * @param baseDn null for the directory's base
     * @param objectClassFilter null to count every entry
     */
    public MigrationCheck checkRdnChange(String oldRdn, String newRdn, String baseDn, String objectClassFilter) {
        return analyzer.check(oldRdn, newRdn, baseDn, objectClassFilter);
    }

    public MigrationResult migrateEntries(String oldRdn, String newRdn, String baseDn, MigrationMode mode,
                                          String objectClassFilter, boolean createContainer) {
        return executor.migrate(oldRdn, newRdn, baseDn, mode, objectClassFilter, createContainer);
    }

    /**
     * Migrates every entry under the directory's base with the mode picked by
     * configuration, creating the new containers as needed.
     */
    public MigrationResult migrateEntries(String oldRdn, String newRdn) {
        return migrateEntries(oldRdn, newRdn, null, null, null, true);
    }

    public static MigrationCheck checkRdnChangeImpact(DirectoryClient client, String oldRdn, String newRdn,
                                                      String baseDn, String objectClassFilter) {
        return new RdnMigrationService(client).checkRdnChange(oldRdn, newRdn, baseDn, objectClassFilter);
    }
}
