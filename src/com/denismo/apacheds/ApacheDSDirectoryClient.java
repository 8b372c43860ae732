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

package com.denismo.apacheds;

import com.denismo.rdnmigration.directory.DirectoryClient;
import org.apache.directory.api.ldap.model.constants.SchemaConstants;
import org.apache.directory.api.ldap.model.cursor.Cursor;
import org.apache.directory.api.ldap.model.cursor.CursorException;
import org.apache.directory.api.ldap.model.entry.Attribute;
import org.apache.directory.api.ldap.model.entry.DefaultEntry;
import org.apache.directory.api.ldap.model.entry.Entry;
import org.apache.directory.api.ldap.model.entry.Value;
import org.apache.directory.api.ldap.model.exception.LdapException;
import org.apache.directory.api.ldap.model.exception.LdapNoSuchObjectException;
import org.apache.directory.api.ldap.model.filter.ExprNode;
import org.apache.directory.api.ldap.model.filter.FilterEncoder;
import org.apache.directory.api.ldap.model.filter.FilterParser;
import org.apache.directory.api.ldap.model.message.AliasDerefMode;
import org.apache.directory.api.ldap.model.message.SearchScope;
import org.apache.directory.api.ldap.model.name.Dn;
import org.apache.directory.api.ldap.model.name.Rdn;
import org.apache.directory.api.ldap.model.schema.SchemaManager;
import org.apache.directory.server.core.api.CoreSession;
import org.apache.directory.server.core.api.DirectoryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.text.ParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * {@link DirectoryClient} backed by an ApacheDS {@link CoreSession}, normally
 * the admin session of an embedded {@link DirectoryService}. Writes go through
 * the session so the interceptor chain stamps entryUUID, entryCSN and the
 * timestamps on copied entries.
 */
public class ApacheDSDirectoryClient implements DirectoryClient {
    private static final Logger LOG = LoggerFactory.getLogger(ApacheDSDirectoryClient.class);

    private final CoreSession session;
    private final SchemaManager schemaManager;
    private final String baseDn;

    public ApacheDSDirectoryClient(DirectoryService service, String baseDn) {
        this(service.getAdminSession(), service.getSchemaManager(), baseDn);
    }

    public ApacheDSDirectoryClient(CoreSession session, SchemaManager schemaManager, String baseDn) {
        this.session = session;
        this.schemaManager = schemaManager;
        this.baseDn = baseDn;
    }

    @Override
    public String getBaseDn() {
        return baseDn;
    }

    @Override
    public List<Entry> search(String baseDn, String filter, SearchScope scope, String... attributes) throws LdapException {
        Dn dn = toDn(baseDn);
        ExprNode filterNode = parseFilter(filter);
        Cursor<Entry> cursor = session.search(dn, scope, filterNode, AliasDerefMode.NEVER_DEREF_ALIASES,
                returning(attributes));
        List<Entry> entries = new ArrayList<Entry>();
        try {
            cursor.beforeFirst();
            while (cursor.next()) {
                entries.add(cursor.get());
            }
        } catch (CursorException e) {
            throw new LdapException("Unable to read search results under " + baseDn, e);
        } finally {
            close(cursor);
        }
        LOG.debug("Search {} {} under {} returned {} entries", scope, filter, baseDn, entries.size());
        return entries;
    }

    @Override
    public Entry lookup(String dn, String... attributes) throws LdapException {
        try {
            return session.lookup(toDn(dn), returning(attributes));
        } catch (LdapNoSuchObjectException e) {
            // Fallthrough
        }
        return null;
    }

    @Override
    public void add(String dn, Collection<String> objectClasses, Collection<Attribute> attributes) throws LdapException {
        Entry entry = new DefaultEntry(schemaManager, toDn(dn));
        entry.add(SchemaConstants.OBJECT_CLASS_AT, objectClasses.toArray(new String[objectClasses.size()]));
        for (Attribute attribute : attributes) {
            for (Value value : attribute) {
                if (value.isHumanReadable()) {
                    entry.add(attribute.getUpId(), value.getString());
                } else {
                    entry.add(attribute.getUpId(), value.getBytes());
                }
            }
        }
        session.add(entry);
    }

    @Override
    public void delete(String dn) throws LdapException {
        session.delete(toDn(dn));
    }

    @Override
    public boolean supportsRename() {
        return true;
    }

    @Override
    public void rename(String oldDn, String newDn) throws LdapException {
        Dn from = toDn(oldDn);
        Dn to = toDn(newDn);
        Rdn newRdn = to.getRdn();
        Dn newParent = to.getParent();
        if (from.getRdn().equals(newRdn)) {
            session.move(from, newParent);
        } else if (from.getParent().equals(newParent)) {
            session.rename(from, newRdn, true);
        } else {
            session.moveAndRename(from, newParent, newRdn, true);
        }
    }

    @Override
    public String escapeFilterValue(String value) {
        return FilterEncoder.encodeFilterValue(value);
    }

    private Dn toDn(String dn) throws LdapException {
        return new Dn(schemaManager, dn);
    }

    private ExprNode parseFilter(String filter) throws LdapException {
        try {
            return FilterParser.parse(schemaManager, filter);
        } catch (ParseException e) {
            throw new LdapException("Invalid search filter " + filter, e);
        }
    }

    private static String[] returning(String... attributes) {
        if (attributes == null || attributes.length == 0) {
            return new String[] { SchemaConstants.ALL_USER_ATTRIBUTES };
        }
        return attributes;
    }

    private static void close(Cursor<?> cursor) {
        try {
            cursor.close();
        } catch (IOException e) {
            LOG.warn("Unable to close search cursor", e);
        }
    }
}
