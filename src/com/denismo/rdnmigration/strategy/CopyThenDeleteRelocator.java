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
import org.apache.directory.api.ldap.model.constants.SchemaConstants;
import org.apache.directory.api.ldap.model.entry.Attribute;
import org.apache.directory.api.ldap.model.entry.Entry;
import org.apache.directory.api.ldap.model.entry.Value;
import org.apache.directory.api.ldap.model.exception.LdapException;
import org.apache.directory.api.ldap.model.exception.LdapNoSuchObjectException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Re-creates the entry at its new DN, then deletes the original.
 * <p>
 * The delete only runs after the add succeeded, so a failed add leaves the
 * original untouched. A failed delete leaves the entry at both DNs; the
 * directory has no multi-operation transaction to prevent that, so the error
 * names both locations.
 */
public class CopyThenDeleteRelocator implements EntryRelocator {
    private static final Logger LOG = LoggerFactory.getLogger(CopyThenDeleteRelocator.class);

    private final DirectoryClient client;

    public CopyThenDeleteRelocator(DirectoryClient client) {
        this.client = client;
    }

    @Override
    public MigrationMode getMode() {
        return MigrationMode.COPY_THEN_DELETE;
    }

    @Override
    public String relocate(Entry entry, String oldRdn, String newRdn) throws LdapException {
        String oldDn = entry.getDn().getName();
        String newDn = DnUtils.rewriteRdnSegment(oldDn, oldRdn, newRdn);

        Entry source = entry;
        if (source.size() == 0) {
            source = client.lookup(oldDn, SchemaConstants.ALL_USER_ATTRIBUTES);
            if (source == null) {
                throw new LdapNoSuchObjectException("Entry not found: " + oldDn);
            }
        }

        List<String> objectClasses = new ArrayList<String>();
        List<Attribute> attributes = new ArrayList<Attribute>();
        for (Attribute attribute : source.getAttributes()) {
            String name = attribute.getUpId();
            if (OperationalAttributes.isOperational(name)) {
                continue;
            }
            if (SchemaConstants.OBJECT_CLASS_AT.equalsIgnoreCase(name)) {
                for (Value value : attribute) {
                    objectClasses.add(value.getString());
                }
            } else {
                attributes.add(attribute);
            }
        }

        client.add(newDn, objectClasses, attributes);
        LOG.debug("Copied {} to {}", oldDn, newDn);

        try {
            client.delete(oldDn);
        } catch (LdapException e) {
            throw new LdapException("Copied to " + newDn + " but could not delete " + oldDn
                    + ", the entry now exists at both locations: " + e.getMessage(), e);
        }
        return newDn;
    }

    @Override
    public boolean movesSubtrees() {
        return false;
    }
}
