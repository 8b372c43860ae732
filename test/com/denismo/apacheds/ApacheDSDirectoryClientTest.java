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

import org.apache.directory.api.ldap.model.cursor.Cursor;
import org.apache.directory.api.ldap.model.cursor.CursorException;
import org.apache.directory.api.ldap.model.entry.Attribute;
import org.apache.directory.api.ldap.model.entry.DefaultAttribute;
import org.apache.directory.api.ldap.model.entry.DefaultEntry;
import org.apache.directory.api.ldap.model.entry.Entry;
import org.apache.directory.api.ldap.model.exception.LdapException;
import org.apache.directory.api.ldap.model.exception.LdapNoSuchObjectException;
import org.apache.directory.api.ldap.model.filter.ExprNode;
import org.apache.directory.api.ldap.model.message.AliasDerefMode;
import org.apache.directory.api.ldap.model.message.SearchScope;
import org.apache.directory.api.ldap.model.name.Dn;
import org.apache.directory.api.ldap.model.name.Rdn;
import org.apache.directory.api.ldap.model.schema.SchemaManager;
import org.apache.directory.server.core.api.CoreSession;
import org.apache.directory.server.core.api.DirectoryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Runs the adapter without a schema, so DNs and filters are parsed as plain
 * text.
 */
@ExtendWith(MockitoExtension.class)
class ApacheDSDirectoryClientTest {
    private static final String BASE = "dc=example,dc=com";
    private static final String ALICE = "uid=alice,ou=people,dc=example,dc=com";

    @Mock
    private CoreSession session;

    @Mock
    private DirectoryService service;

    @Mock
    private Cursor<Entry> cursor;

    private ApacheDSDirectoryClient client;

    @BeforeEach
    void setUp() {
        client = new ApacheDSDirectoryClient(session, null, BASE);
    }

    @Test
    void searchDrainsAndClosesTheCursor() throws Exception {
        Entry first = new DefaultEntry(ALICE);
        Entry second = new DefaultEntry("uid=bob,ou=people,dc=example,dc=com");
        when(session.search(any(Dn.class), eq(SearchScope.SUBTREE), any(ExprNode.class),
                eq(AliasDerefMode.NEVER_DEREF_ALIASES), eq("1.1"))).thenReturn(cursor);
        when(cursor.next()).thenReturn(true, true, false);
        when(cursor.get()).thenReturn(first, second);

        List<Entry> found = client.search("ou=people,dc=example,dc=com", "(objectClass=*)", SearchScope.SUBTREE, "1.1");

        assertThat(found).containsExactly(first, second);
        ArgumentCaptor<Dn> base = ArgumentCaptor.forClass(Dn.class);
        verify(session).search(base.capture(), eq(SearchScope.SUBTREE), any(ExprNode.class),
                eq(AliasDerefMode.NEVER_DEREF_ALIASES), eq("1.1"));
        assertThat(base.getValue().getName()).isEqualTo("ou=people,dc=example,dc=com");
        verify(cursor).beforeFirst();
        verify(cursor).close();
    }

    @Test
    void searchWithoutAttributesAsksForUserAttributes() throws Exception {
        when(session.search(any(Dn.class), eq(SearchScope.ONELEVEL), any(ExprNode.class),
                eq(AliasDerefMode.NEVER_DEREF_ALIASES), eq("*"))).thenReturn(cursor);
        when(cursor.next()).thenReturn(false);

        assertThat(client.search(BASE, "(ou=people)", SearchScope.ONELEVEL)).isEmpty();
    }

    @Test
    void cursorFailureIsAnLdapException() throws Exception {
        when(session.search(any(Dn.class), eq(SearchScope.SUBTREE), any(ExprNode.class),
                eq(AliasDerefMode.NEVER_DEREF_ALIASES), eq("1.1"))).thenReturn(cursor);
        when(cursor.next()).thenThrow(new CursorException("broken"));

        assertThatThrownBy(() -> client.search(BASE, "(objectClass=*)", SearchScope.SUBTREE, "1.1"))
                .isInstanceOf(LdapException.class)
                .hasMessage("Unable to read search results under " + BASE)
                .hasCauseInstanceOf(CursorException.class);
        verify(cursor).close();
    }

    @Test
    void cursorCloseFailureDoesNotLoseResults() throws Exception {
        Entry first = new DefaultEntry(ALICE);
        when(session.search(any(Dn.class), eq(SearchScope.SUBTREE), any(ExprNode.class),
                eq(AliasDerefMode.NEVER_DEREF_ALIASES), eq("1.1"))).thenReturn(cursor);
        when(cursor.next()).thenReturn(true, false);
        when(cursor.get()).thenReturn(first);
        doThrow(new IOException("already closed")).when(cursor).close();

        assertThat(client.search(BASE, "(objectClass=*)", SearchScope.SUBTREE, "1.1")).containsExactly(first);
    }

    @Test
    void malformedFilterIsRejectedBeforeSearching() {
        assertThatThrownBy(() -> client.search(BASE, "(oops)", SearchScope.SUBTREE, "1.1"))
                .isInstanceOf(LdapException.class)
                .hasMessage("Invalid search filter (oops)");
        verifyNoInteractions(session);
    }

    @Test
    void lookupOfMissingEntryIsNull() throws Exception {
        when(session.lookup(any(Dn.class), eq("1.1"))).thenThrow(new LdapNoSuchObjectException("gone"));

        assertThat(client.lookup("ou=users,dc=example,dc=com", "1.1")).isNull();
    }

    @Test
    void lookupReturnsTheEntry() throws Exception {
        Entry alice = new DefaultEntry(ALICE, "uid: alice");
        when(session.lookup(any(Dn.class), eq("*"))).thenReturn(alice);

        assertThat(client.lookup(ALICE)).isSameAs(alice);
    }

    @Test
    void addCopiesTextAndBinaryValues() throws Exception {
        byte[] photo = new byte[] { 1, 2, 3 };
        List<Attribute> attributes = Arrays.<Attribute>asList(
                new DefaultAttribute("cn", "Alice", "Alice Smith"),
                new DefaultAttribute("jpegPhoto", photo));

        client.add(ALICE, Arrays.asList("top", "inetOrgPerson"), attributes);

        ArgumentCaptor<Entry> added = ArgumentCaptor.forClass(Entry.class);
        verify(session).add(added.capture());
        Entry entry = added.getValue();
        assertThat(entry.getDn().getName()).isEqualTo(ALICE);
        assertThat(entry.hasObjectClass("top", "inetOrgPerson")).isTrue();
        assertThat(entry.get("cn").size()).isEqualTo(2);
        assertThat(entry.contains("cn", "Alice Smith")).isTrue();
        assertThat(entry.get("jpegPhoto").getBytes()).isEqualTo(photo);
    }

    @Test
    void deleteGoesThroughTheSession() throws Exception {
        client.delete(ALICE);

        ArgumentCaptor<Dn> deleted = ArgumentCaptor.forClass(Dn.class);
        verify(session).delete(deleted.capture());
        assertThat(deleted.getValue().getName()).isEqualTo(ALICE);
    }

    @Test
    void renameUnderSameParentIsAModRdn() throws Exception {
        client.rename(ALICE, "uid=alice2,ou=people,dc=example,dc=com");

        ArgumentCaptor<Dn> dn = ArgumentCaptor.forClass(Dn.class);
        ArgumentCaptor<Rdn> rdn = ArgumentCaptor.forClass(Rdn.class);
        verify(session).rename(dn.capture(), rdn.capture(), eq(true));
        assertThat(dn.getValue().getName()).isEqualTo(ALICE);
        assertThat(rdn.getValue().getName()).isEqualTo("uid=alice2");
    }

    @Test
    void renameToNewParentIsAMove() throws Exception {
        client.rename(ALICE, "uid=alice,ou=users,dc=example,dc=com");

        ArgumentCaptor<Dn> dn = ArgumentCaptor.forClass(Dn.class);
        ArgumentCaptor<Dn> parent = ArgumentCaptor.forClass(Dn.class);
        verify(session).move(dn.capture(), parent.capture());
        assertThat(dn.getValue().getName()).isEqualTo(ALICE);
        assertThat(parent.getValue().getName()).isEqualTo("ou=users,dc=example,dc=com");
    }

    @Test
    void renameToNewParentAndRdnIsAMoveAndRename() throws Exception {
        client.rename(ALICE, "uid=alice2,ou=users,dc=example,dc=com");

        ArgumentCaptor<Dn> parent = ArgumentCaptor.forClass(Dn.class);
        ArgumentCaptor<Rdn> rdn = ArgumentCaptor.forClass(Rdn.class);
        verify(session).moveAndRename(any(Dn.class), parent.capture(), rdn.capture(), eq(true));
        assertThat(parent.getValue().getName()).isEqualTo("ou=users,dc=example,dc=com");
        assertThat(rdn.getValue().getName()).isEqualTo("uid=alice2");
    }

    @Test
    void filterValuesAreEscaped() {
        assertThat(client.escapeFilterValue("a*b(c)")).isEqualTo("a\\2Ab\\28c\\29");
        assertThat(client.supportsRename()).isTrue();
        assertThat(client.getBaseDn()).isEqualTo(BASE);
    }

    @Test
    void usesTheAdminSessionOfTheService() throws Exception {
        when(service.getAdminSession()).thenReturn(session);
        when(service.getSchemaManager()).thenReturn((SchemaManager) null);

        new ApacheDSDirectoryClient(service, BASE).delete(ALICE);

        verify(session).delete(any(Dn.class));
    }
}
