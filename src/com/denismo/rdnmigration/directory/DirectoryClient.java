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

package com.denismo.rdnmigration.directory;

import org.apache.directory.api.ldap.model.entry.Attribute;
import org.apache.directory.api.ldap.model.entry.Entry;
import org.apache.directory.api.ldap.model.exception.LdapException;
import org.apache.directory.api.ldap.model.message.SearchScope;

import java.util.Collection;
import java.util.List;

/**
 * The directory operations the migration engine relies on. DNs are passed as
 * strings in the form the directory returned them.
 * <p>
 * A missing object is reported with
 * {@link org.apache.directory.api.ldap.model.exception.LdapNoSuchObjectException};
 * every other failure is an {@link LdapException}.
 */
public interface DirectoryClient {

    /**
     * The DN searched when a caller does not name one.
     */
    String getBaseDn();

    /**
     * @throws org.apache.directory.api.ldap.model.exception.LdapNoSuchObjectException if the base does not exist
     */
    List<Entry> search(String baseDn, String filter, SearchScope scope, String... attributes) throws LdapException;

    /**
     * @return the entry, or null if nothing exists at {@code dn}
     */
    Entry lookup(String dn, String... attributes) throws LdapException;

    void add(String dn, Collection<String> objectClasses, Collection<Attribute> attributes) throws LdapException;

    void delete(String dn) throws LdapException;

    /**
     * Whether {@link #rename(String, String)} is wired to a real ModDN operation.
     */
    boolean supportsRename();

    /**
     * Moves the entry, with everything beneath it, to {@code newDn} in one operation.
     */
    void rename(String oldDn, String newDn) throws LdapException;

    /**
     * Escapes a value for use inside a search filter assertion.
     */
    String escapeFilterValue(String value);
}
