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

package com.denismo.rdnmigration.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MigrationSettingsTest {

    @Mock
    private ConfigSource source;

    @TempDir
    Path tempDir;

    @Test
    void defaultsWithoutSource() {
        MigrationSettings settings = MigrationSettings.defaults();

        assertThat(settings.allowModRdn()).isTrue();
        assertThat(settings.migrateOnRdnChange()).isFalse();
        assertThat(settings.requireRdnChangeConfirmation()).isTrue();
    }

    @Test
    void failingSourceDegradesToDefault() throws Exception {
        when(source.getValue(eq("ldap"), eq("allow_modrdn"), any())).thenThrow(new IllegalStateException("db down"));

        assertThat(new MigrationSettings(source).allowModRdn()).isTrue();
    }

    @Test
    void nullValueDegradesToDefault() throws Exception {
        when(source.getValue(eq("ldap"), eq("rdn_change_confirmation"), any())).thenReturn(null);

        assertThat(new MigrationSettings(source).requireRdnChangeConfirmation()).isTrue();
    }

    @Test
    void stringValuesAreCoerced() throws Exception {
        when(source.getValue(eq("ldap"), eq("allow_modrdn"), any())).thenReturn("No");
        when(source.getValue(eq("ldap"), eq("migrate_on_rdn_change"), any())).thenReturn(" YES ");

        MigrationSettings settings = new MigrationSettings(source);

        assertThat(settings.allowModRdn()).isFalse();
        assertThat(settings.migrateOnRdnChange()).isTrue();
    }

    @Test
    void toBoolean_acceptsBooleanLikeValues() {
        assertThat(MigrationSettings.toBoolean(Boolean.TRUE)).isTrue();
        assertThat(MigrationSettings.toBoolean(Boolean.FALSE)).isFalse();
        assertThat(MigrationSettings.toBoolean("true")).isTrue();
        assertThat(MigrationSettings.toBoolean("TRUE")).isTrue();
        assertThat(MigrationSettings.toBoolean("1")).isTrue();
        assertThat(MigrationSettings.toBoolean("yes")).isTrue();
        assertThat(MigrationSettings.toBoolean("false")).isFalse();
        assertThat(MigrationSettings.toBoolean("0")).isFalse();
        assertThat(MigrationSettings.toBoolean("on")).isFalse();
        assertThat(MigrationSettings.toBoolean("")).isFalse();
        assertThat(MigrationSettings.toBoolean(1)).isTrue();
        assertThat(MigrationSettings.toBoolean(0)).isFalse();
        assertThat(MigrationSettings.toBoolean(0.5d)).isTrue();
        assertThat(MigrationSettings.toBoolean(Collections.emptyList())).isFalse();
        assertThat(MigrationSettings.toBoolean(Arrays.asList("x"))).isTrue();
        assertThat(MigrationSettings.toBoolean(Collections.singletonMap("k", "v"))).isTrue();
        assertThat(MigrationSettings.toBoolean(new Object())).isTrue();
        assertThat(MigrationSettings.toBoolean(null)).isFalse();
    }

    @Test
    void capabilityProbeFollowsAllowModRdn() throws Exception {
        when(source.getValue(eq("ldap"), eq("allow_modrdn"), any())).thenReturn(Boolean.FALSE);

        assertThat(new CapabilityProbe(new MigrationSettings(source)).supportsNativeRename()).isFalse();
        assertThat(new CapabilityProbe(MigrationSettings.defaults()).supportsNativeRename()).isTrue();
    }

    @Test
    void propertiesFileIsRead() throws IOException {
        File file = tempDir.resolve("rdn_migration.conf").toFile();
        Files.write(file.toPath(), Arrays.asList("ldap.allow_modrdn=false", "ldap.migrate_on_rdn_change=1"),
                StandardCharsets.UTF_8);

        MigrationSettings settings = new MigrationSettings(PropertiesConfigSource.load(file));

        assertThat(settings.allowModRdn()).isFalse();
        assertThat(settings.migrateOnRdnChange()).isTrue();
        assertThat(settings.requireRdnChangeConfirmation()).isTrue();
    }

    @Test
    void missingPropertiesFileGivesDefaults() {
        PropertiesConfigSource config = PropertiesConfigSource.load(tempDir.resolve("absent.conf").toFile());

        assertThat(config.getValue("ldap", "allow_modrdn", "fallback")).isEqualTo("fallback");
        assertThat(new MigrationSettings(config).allowModRdn()).isTrue();
    }

    @Test
    void propertiesPathComesFromSystemProperty() throws IOException {
        File file = tempDir.resolve("custom.conf").toFile();
        Files.write(file.toPath(), Collections.singletonList("ldap.rdn_change_confirmation=no"), StandardCharsets.UTF_8);
        String previous = System.getProperty(PropertiesConfigSource.PROPERTIES_PATH_PROPERTY);
        System.setProperty(PropertiesConfigSource.PROPERTIES_PATH_PROPERTY, file.getAbsolutePath());
        try {
            assertThat(new MigrationSettings(PropertiesConfigSource.load()).requireRdnChangeConfirmation()).isFalse();
        } finally {
            if (previous == null) {
                System.clearProperty(PropertiesConfigSource.PROPERTIES_PATH_PROPERTY);
            } else {
                System.setProperty(PropertiesConfigSource.PROPERTIES_PATH_PROPERTY, previous);
            }
        }
    }
}
