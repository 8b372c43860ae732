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

import com.denismo.rdnmigration.directory.DirectoryClient;
import com.denismo.rdnmigration.dn.DnUtils;
import com.denismo.rdnmigration.dn.RdnParts;
import org.apache.directory.api.ldap.model.constants.SchemaConstants;
import org.apache.directory.api.ldap.model.entry.Entry;
import org.apache.directory.api.ldap.model.exception.LdapException;
import org.apache.directory.api.ldap.model.exception.LdapNoSuchObjectException;
import org.apache.directory.api.ldap.model.message.SearchScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Finds every container named by an RDN, at any depth under a base, and the
 * entries inside each one.
 */
class ContainerLocator {
    private static final Logger LOG = LoggerFactory.getLogger(ContainerLocator.class);

    static final String[] CONTAINER_OBJECT_CLASSES = { ContainerProvisioner.ORGANIZATIONAL_UNIT, ContainerProvisioner.CONTAINER };

    private final DirectoryClient client;

    ContainerLocator(DirectoryClient client) {
        this.client = client;
    }

    /**
     * DNs of all containers whose RDN is {@code rdn}, in directory order. A
     * missing base yields an empty list.
     *
     * @throws LdapException if the search itself fails
     */
    List<String> findContainers(String baseDn, RdnParts rdn) throws LdapException {
        String filter = containerFilter(rdn);
        List<Entry> found;
        try {
            found = client.search(baseDn, filter, SearchScope.SUBTREE, SchemaConstants.NO_ATTRIBUTE);
        } catch (LdapNoSuchObjectException e) {
            LOG.debug("Base {} does not exist, no containers match {}", baseDn, rdn);
            return Collections.emptyList();
        }
        List<String> containers = new ArrayList<String>();
        for (Entry entry : found) {
            String dn = dnOf(entry);
            if (dn != null) {
                containers.add(dn);
            }
        }
        if (!containers.isEmpty()) {
            LOG.debug("Found " + containers.size() + " containers matching " + rdn + ": "
                    + containers.subList(0, Math.min(5, containers.size())));
        }
        return containers;
    }

    /**
     * Entries anywhere below the container, the container itself excluded.
     * Only DNs are fetched.
     *
     * @throws LdapNoSuchObjectException if the container is gone
     */
    List<Entry> findEntries(String containerDn, String objectClassFilter) throws LdapException {
        List<Entry> found = client.search(containerDn, entryFilter(objectClassFilter), SearchScope.SUBTREE,
                SchemaConstants.NO_ATTRIBUTE);
        List<Entry> entries = new ArrayList<Entry>();
        for (Entry entry : found) {
            String dn = dnOf(entry);
            if (dn != null && !DnUtils.sameDn(dn, containerDn)) {
                entries.add(entry);
            }
        }
        return entries;
    }

    String containerFilter(RdnParts rdn) {
        StringBuilder filter = new StringBuilder("(&(|");
        for (String objectClass : CONTAINER_OBJECT_CLASSES) {
            filter.append('(').append(SchemaConstants.OBJECT_CLASS_AT).append('=').append(objectClass).append(')');
        }
        filter.append(")(").append(rdn.getAttribute()).append('=')
                .append(client.escapeFilterValue(DnUtils.unescapeValue(rdn.getValue())))
                .append("))");
        return filter.toString();
    }

    String entryFilter(String objectClassFilter) {
        if (objectClassFilter == null || objectClassFilter.isEmpty()) {
            return "(" + SchemaConstants.OBJECT_CLASS_AT + "=*)";
        }
        return "(" + SchemaConstants.OBJECT_CLASS_AT + "=" + client.escapeFilterValue(objectClassFilter) + ")";
    }

    static String dnOf(Entry entry) {
        if (entry == null || entry.getDn() == null) {
            return null;
        }
        String dn = entry.getDn().getName();
        return dn == null || dn.isEmpty() ? null : dn;
    }
}
