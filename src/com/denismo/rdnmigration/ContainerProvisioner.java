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
import org.apache.directory.api.ldap.model.entry.Attribute;
import org.apache.directory.api.ldap.model.entry.DefaultAttribute;
import org.apache.directory.api.ldap.model.exception.LdapException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;

/**
 * Creates a missing container from its own DN.
 */
public class ContainerProvisioner {
    private static final Logger LOG = LoggerFactory.getLogger(ContainerProvisioner.class);

    public static final String ORGANIZATIONAL_UNIT = "organizationalUnit";
    public static final String CONTAINER = "container";

    private final DirectoryClient client;

    public ContainerProvisioner(DirectoryClient client) {
        this.client = client;
    }

    /**
     * Creates {@code containerDn} unless it exists. {@code ou=} containers become
     * organizationalUnit entries, {@code cn=} containers become container entries.
     *
     * @return true if the container was created
     * @throws LdapException if the naming attribute is neither ou nor cn, or the add fails
     */
    public boolean ensureContainer(String containerDn) throws LdapException {
        if (client.lookup(containerDn, SchemaConstants.NO_ATTRIBUTE) != null) {
            return false;
        }

        RdnParts rdn = DnUtils.splitRdn(DnUtils.firstRdn(containerDn));
        String objectClass;
        if (rdn.isAttribute(SchemaConstants.OU_AT)) {
            objectClass = ORGANIZATIONAL_UNIT;
        } else if (rdn.isAttribute(SchemaConstants.CN_AT)) {
            objectClass = CONTAINER;
        } else {
            throw new LdapException("Unknown RDN type: " + rdn.getAttribute());
        }

        Attribute naming = new DefaultAttribute(rdn.getAttribute(), DnUtils.unescapeValue(rdn.getValue()));
        client.add(containerDn, Collections.singletonList(objectClass), Collections.singletonList(naming));
        LOG.info("Created container " + containerDn);
        return true;
    }
}
