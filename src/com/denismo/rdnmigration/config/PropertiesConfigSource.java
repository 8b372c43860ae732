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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Reads {@code <category>.<key>} values from a properties file, e.g.
 * <pre>
 * ldap.allow_modrdn=false
 * ldap.rdn_change_confirmation=true
 * </pre>
 */
public class PropertiesConfigSource implements ConfigSource {
    private static final Logger LOG = LoggerFactory.getLogger(PropertiesConfigSource.class);

    public static final String PROPERTIES_PATH_PROPERTY = "rdnMigrationPropertiesPath";
    public static final String DEFAULT_PROPERTIES_PATH = "/etc/rdn_migration.conf";

    private final Properties properties;

    public PropertiesConfigSource(Properties properties) {
        this.properties = properties;
    }

    /**
     * Loads the file named by the {@value #PROPERTIES_PATH_PROPERTY} system property.
     */
    public static PropertiesConfigSource load() {
        return load(new File(System.getProperty(PROPERTIES_PATH_PROPERTY, DEFAULT_PROPERTIES_PATH)));
    }

    /**
     * A missing or unreadable file yields an empty source, so every setting takes its default.
     */
    public static PropertiesConfigSource load(File propsFile) {
        Properties props = new Properties();
        if (propsFile.exists()) {
            try (InputStream in = new FileInputStream(propsFile)) {
                props.load(in);
                LOG.info("Loaded RDN migration config from " + propsFile);
            } catch (IOException e) {
                LOG.error("Unable to read RDN migration config file " + propsFile, e);
                props = new Properties();
            }
        } else {
            LOG.debug("No RDN migration config at {}, using defaults", propsFile);
        }
        return new PropertiesConfigSource(props);
    }

    @Override
    public Object getValue(String category, String key, Object defaultValue) {
        String value = properties.getProperty(category + "." + key);
        return value == null ? defaultValue : value;
    }
}
