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
import com.denismo.rdnmigration.directory.DirectoryClient;
import com.denismo.rdnmigration.dn.DnUtils;
import com.denismo.rdnmigration.dn.RdnParts;
import com.denismo.rdnmigration.strategy.CopyThenDeleteRelocator;
import com.denismo.rdnmigration.strategy.EntryRelocator;
import com.denismo.rdnmigration.strategy.NativeRenameRelocator;
import org.apache.directory.api.ldap.model.entry.Entry;
import org.apache.directory.api.ldap.model.exception.LdapException;
import org.apache.directory.api.ldap.model.exception.LdapInvalidDnException;
import org.apache.directory.api.ldap.model.exception.LdapNoSuchObjectException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Moves the entries of every container named by the old RDN to the matching
 * container named by the new RDN.
 * <p>
 * Error policy: strict where the batch cannot be scoped, isolated everywhere
 * else. A malformed RDN or a failed container discovery aborts the run with
 * {@code success=false}. A container that cannot be created or searched is
 * skipped with a warning. An entry that cannot be moved is recorded in
 * {@link MigrationResult#getFailedEntries()} and the run carries on.
 * <p>
 * Containers are processed in the order the directory returns them, entries
 * one at a time in search order.
 */
public class MigrationExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(MigrationExecutor.class);

    private final DirectoryClient client;
    private final CapabilityProbe capabilityProbe;
    private final ContainerLocator locator;
    private final ContainerProvisioner provisioner;
    private final CopyThenDeleteRelocator copyThenDelete;
    private final NativeRenameRelocator nativeRename;

    public MigrationExecutor(DirectoryClient client, CapabilityProbe capabilityProbe) {
        this.client = client;
        this.capabilityProbe = capabilityProbe;
        this.locator = new ContainerLocator(client);
        this.provisioner = new ContainerProvisioner(client);
        this.copyThenDelete = new CopyThenDeleteRelocator(client);
        this.nativeRename = new NativeRenameRelocator(client, copyThenDelete);
    }

    /**
     * @param baseDn where to look; null for the directory's base
     * @param mode null to pick native rename when the directory allows it, copy-then-delete otherwise
     * @param objectClassFilter only move entries of this objectClass; null for all
     * @param createContainer create each new container if it does not exist yet
     */
    public MigrationResult migrate(String oldRdn, String newRdn, String baseDn, MigrationMode mode,
                                   String objectClassFilter, boolean createContainer) {
        String base = baseDn != null ? baseDn : client.getBaseDn();
        if (mode == null) {
            mode = capabilityProbe.supportsNativeRename() ? MigrationMode.NATIVE_RENAME : MigrationMode.COPY_THEN_DELETE;
        }

        if (mode == MigrationMode.LEAVE_ORPHANED) {
            LOG.warn("Leaving entries under " + oldRdn + " orphaned, " + newRdn + " will not see them");
            return MigrationResult.nothingToDo(mode, "Entries left in their old locations. "
                    + "They will not be visible in the application until manually migrated.");
        }

        RdnParts rdn;
        try {
            rdn = DnUtils.splitRdn(oldRdn);
            DnUtils.splitRdn(newRdn);
        } catch (LdapInvalidDnException e) {
            return MigrationResult.aborted(mode, e.getMessage());
        }

        List<String> containers;
        try {
            containers = locator.findContainers(base, rdn);
        } catch (LdapException e) {
            LOG.error("Unable to find containers matching " + oldRdn + " under " + base, e);
            return MigrationResult.aborted(mode, "Failed to find containers: " + e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Unexpected error finding containers matching " + oldRdn + " under " + base, e);
            return MigrationResult.aborted(mode, "Failed to find containers: " + describe(e));
        }

        if (containers.isEmpty()) {
            return MigrationResult.nothingToDo(mode, "No containers found matching the old RDN.");
        }

        EntryRelocator relocator = mode == MigrationMode.NATIVE_RENAME ? nativeRename : copyThenDelete;
        List<String> warnings = new ArrayList<String>();
        if (mode == MigrationMode.NATIVE_RENAME && !nativeRename.isNativeAvailable()) {
            warnings.add("Native rename is not available on this directory, entries were migrated with copy-then-delete.");
        }

        LOG.info("Migrating entries from " + containers.size() + " '" + oldRdn + "' containers to '" + newRdn
                + "' using " + mode.getValue());

        int migrated = 0;
        List<FailedEntry> failed = new ArrayList<FailedEntry>();
        for (String oldContainerDn : containers) {
            String newContainerDn;
            try {
                newContainerDn = DnUtils.rewriteRdnSegment(oldContainerDn, oldRdn, newRdn);
            } catch (LdapInvalidDnException e) {
                warnings.add(e.getMessage());
                continue;
            }

            if (createContainer) {
                try {
                    provisioner.ensureContainer(newContainerDn);
                } catch (LdapException e) {
                    LOG.warn("Unable to create container " + newContainerDn + ", skipping " + oldContainerDn, e);
                    warnings.add("Failed to create container " + newContainerDn + ": " + e.getMessage());
                    continue;
                } catch (RuntimeException e) {
                    LOG.warn("Unable to create container " + newContainerDn + ", skipping " + oldContainerDn, e);
                    warnings.add("Failed to create container " + newContainerDn + ": " + describe(e));
                    continue;
                }
            }

            List<Entry> entries;
            try {
                entries = locator.findEntries(oldContainerDn, objectClassFilter);
            } catch (LdapNoSuchObjectException e) {
                LOG.debug("Container {} is gone, nothing to migrate", oldContainerDn);
                continue;
            } catch (LdapException e) {
                LOG.warn("Unable to search container " + oldContainerDn, e);
                warnings.add("Failed to search container " + oldContainerDn + ": " + e.getMessage());
                continue;
            } catch (RuntimeException e) {
                LOG.warn("Unable to search container " + oldContainerDn, e);
                warnings.add("Failed to search container " + oldContainerDn + ": " + describe(e));
                continue;
            }

            List<String> movedSubtrees = new ArrayList<String>();
            for (Entry entry : entries) {
                String entryDn = ContainerLocator.dnOf(entry);
                if (entryDn == null) {
                    continue;
                }
                if (isBelowAny(entryDn, movedSubtrees)) {
                    migrated++;
                    LOG.debug("{} moved with its parent", entryDn);
                    continue;
                }
                try {
                    String newDn = relocator.relocate(entry, oldRdn, newRdn);
                    migrated++;
                    if (relocator.movesSubtrees()) {
                        movedSubtrees.add(entryDn);
                    }
                    LOG.info("Migrated " + entryDn + " to " + newDn + " (" + relocator.getMode().getValue() + ")");
                } catch (LdapException e) {
                    failed.add(failure(entryDn, e));
                } catch (RuntimeException e) {
                    failed.add(failure(entryDn, e));
                }
            }
        }

        LOG.info("Migration " + oldRdn + " -> " + newRdn + " finished: " + containers.size() + " containers, "
                + migrated + " migrated, " + failed.size() + " failed (" + mode.getValue() + ")");
        return new MigrationResult(failed.isEmpty(), mode, migrated, failed, warnings);
    }

    private static boolean isBelowAny(String dn, List<String> ancestors) {
        for (String ancestor : ancestors) {
            if (DnUtils.isDescendantOf(dn, ancestor)) {
                return true;
            }
        }
        return false;
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.toString();
    }

    private static FailedEntry failure(String dn, Exception e) {
        String error = describe(e);
        LOG.error("Unable to migrate " + dn + ": " + error);
        return new FailedEntry(dn, error);
    }
}
