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
import org.apache.directory.api.ldap.model.entry.Entry;
import org.apache.directory.api.ldap.model.exception.LdapException;
import org.apache.directory.api.ldap.model.exception.LdapInvalidDnException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports what an RDN change would affect before anything is moved.
 * <p>
 * Error policy: lenient. Every failure becomes a warning in the returned
 * {@link MigrationCheck}; {@link #check} never throws and never blocks the
 * change. Compare {@link MigrationExecutor}, which aborts when the scope of
 * the change cannot be established.
 */
public class ImpactAnalyzer {
    private static final Logger LOG = LoggerFactory.getLogger(ImpactAnalyzer.class);

    static final int PREVIEW_LIMIT = 10;

    private final DirectoryClient client;
    private final CapabilityProbe capabilityProbe;
    private final ContainerLocator locator;

    public ImpactAnalyzer(DirectoryClient client, CapabilityProbe capabilityProbe) {
        this.client = client;
        this.capabilityProbe = capabilityProbe;
        this.locator = new ContainerLocator(client);
    }

    /**
     * @param baseDn where to look; null for the directory's base
     * @param objectClassFilter only count entries of this objectClass; null for all
     */
    public MigrationCheck check(String oldRdn, String newRdn, String baseDn, String objectClassFilter) {
        String base = baseDn != null ? baseDn : client.getBaseDn();
        List<String> warnings = new ArrayList<String>();
        List<String> affectedDns = new ArrayList<String>();

        RdnParts rdn = null;
        try {
            rdn = DnUtils.splitRdn(oldRdn);
        } catch (LdapInvalidDnException e) {
            warnings.add(e.getMessage());
        }
        try {
            DnUtils.splitRdn(newRdn);
        } catch (LdapInvalidDnException e) {
            warnings.add(e.getMessage());
        }

        if (rdn != null) {
            try {
                List<String> containers = locator.findContainers(base, rdn);
                for (String containerDn : containers) {
                    try {
                        for (Entry entry : locator.findEntries(containerDn, objectClassFilter)) {
                            affectedDns.add(entry.getDn().getName());
                        }
                    } catch (LdapException e) {
                        LOG.debug("Unable to search container " + containerDn + ": " + e.getMessage());
                    }
                }

                if (containers.size() > 1) {
                    warnings.add("Found " + containers.size() + " containers matching '" + oldRdn
                            + "' (including nested contexts under other containers).");
                }
                if (!affectedDns.isEmpty()) {
                    warnings.add("Found " + affectedDns.size() + " total entries across all '" + oldRdn
                            + "' containers that will need migration.");
                }
            } catch (LdapException e) {
                LOG.warn("Unable to check entries affected by " + oldRdn + " under " + base, e);
                warnings.add("Could not check existing entries: " + e.getMessage());
            } catch (RuntimeException e) {
                LOG.error("Unexpected error checking entries affected by " + oldRdn + " under " + base, e);
                warnings.add("Could not check existing entries: " + e);
            }
        }

        int entriesCount = affectedDns.size();
        boolean supportsNativeRename = capabilityProbe.supportsNativeRename();

        MigrationMode recommendedMode;
        if (entriesCount == 0 || supportsNativeRename) {
            recommendedMode = MigrationMode.NATIVE_RENAME;
        } else {
            recommendedMode = MigrationMode.COPY_THEN_DELETE;
            warnings.add("Your LDAP server may not support modRDN operations. "
                    + "Migration will use the copy-delete method, which is slower but compatible.");
        }

        if (entriesCount > 0 && !supportsNativeRename) {
            warnings.add("WARNING: If you proceed without migration, entries will remain in their old locations "
                    + "and become orphaned. They will not be visible in the application.");
        }

        List<String> preview = affectedDns;
        if (entriesCount > PREVIEW_LIMIT) {
            preview = affectedDns.subList(0, PREVIEW_LIMIT);
            warnings.add("Showing first " + PREVIEW_LIMIT + " of " + entriesCount + " affected entries.");
        }

        LOG.info("RDN change " + oldRdn + " -> " + newRdn + " under " + base + " affects " + entriesCount
                + " entries, recommended mode " + recommendedMode.getValue());
        return new MigrationCheck(oldRdn, newRdn, base, entriesCount, preview, supportsNativeRename,
                recommendedMode, warnings);
    }
}
