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

package com.denismo.rdnmigration.strategy;

import com.denismo.rdnmigration.MigrationMode;
import com.denismo.rdnmigration.directory.DirectoryClient;
import com.denismo.rdnmigration.dn.DnUtils;
import org.apache.directory.api.ldap.model.entry.Entry;
import org.apache.directory.api.ldap.model.exception.LdapException;

/**
 * Moves the entry with a single ModDN request. Clients that cannot rename get
 * copy-then-delete instead; {@link #isNativeAvailable()} tells which one runs.
 */
public class NativeRenameRelocator implements EntryRelocator {
    private final DirectoryClient client;
    private final EntryRelocator fallback;

    public NativeRenameRelocator(DirectoryClient client, EntryRelocator fallback) {
        this.client = client;
        this.fallback = fallback;
    }

    @Override
    public MigrationMode getMode() {
        return MigrationMode.NATIVE_RENAME;
    }

    public boolean isNativeAvailable() {
        return client.supportsRename();
    }

    @Override
    public String relocate(Entry entry, String oldRdn, String newRdn) throws LdapException {
        if (!isNativeAvailable()) {
            return fallback.relocate(entry, oldRdn, newRdn);
        }
        String oldDn = entry.getDn().getName();
        String newDn = DnUtils.rewriteRdnSegment(oldDn, oldRdn, newRdn);
        client.rename(oldDn, newDn);
        return newDn;
    }

    @Override
    public boolean movesSubtrees() {
        return isNativeAvailable() || fallback.movesSubtrees();
    }
}
