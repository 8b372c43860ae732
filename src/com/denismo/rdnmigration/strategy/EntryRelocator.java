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
import org.apache.directory.api.ldap.model.entry.Entry;
import org.apache.directory.api.ldap.model.exception.LdapException;

/**
 * Moves a single entry from beneath the old RDN to beneath the new one.
 */
public interface EntryRelocator {

    MigrationMode getMode();

    /**
     * @param entry the entry to move; may carry only its DN
     * @return the entry's new DN
     * @throws LdapException if the entry could not be moved; nothing else is affected
     */
    String relocate(Entry entry, String oldRdn, String newRdn) throws LdapException;

    /**
     * True when moving an entry also moves everything beneath it.
     */
    boolean movesSubtrees();
}
