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

import java.util.Collection;
import java.util.Locale;
import java.util.Map;

/**
 * Typed view of the {@code ldap} settings that drive RDN migration. Every read
 * is best-effort: a missing source, a missing key or a failing source all give
 * the documented default.
 */
public class MigrationSettings {
    private static final Logger LOG = LoggerFactory.getLogger(MigrationSettings.class);

    public static final String CATEGORY = "ldap";
    public static final String ALLOW_MODRDN = "allow_modrdn";
    public static final String MIGRATE_ON_RDN_CHANGE = "migrate_on_rdn_change";
    public static final String RDN_CHANGE_CONFIRMATION = "rdn_change_confirmation";

    private final ConfigSource source;

    /**
     * @param source may be null, in which case only defaults are returned
     */
    public MigrationSettings(ConfigSource source) {
        this.source = source;
    }

    public static MigrationSettings defaults() {
        return new MigrationSettings(null);
    }

    /** Defaults to true: most directory servers implement ModDN. */
    public boolean allowModRdn() {
        return getBoolean(ALLOW_MODRDN, true);
    }

    public boolean migrateOnRdnChange() {
        return getBoolean(MIGRATE_ON_RDN_CHANGE, false);
    }

    public boolean requireRdnChangeConfirmation() {
        return getBoolean(RDN_CHANGE_CONFIRMATION, true);
    }

    boolean getBoolean(String key, boolean defaultValue) {
        if (source == null) {
            return defaultValue;
        }
        try {
            Object value = source.getValue(CATEGORY, key, defaultValue);
            return value == null ? defaultValue : toBoolean(value);
        } catch (Exception e) {
            LOG.debug("Unable to read " + CATEGORY + "." + key + ", using " + defaultValue, e);
            return defaultValue;
        }
    }

    /**
     * Booleans as is; strings {@code true}, {@code 1} and {@code yes} in any case;
     * numbers when non-zero; collections and maps when non-empty; any other
     * object is true.
     */
    public static boolean toBoolean(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            String s = ((String) value).trim().toLowerCase(Locale.ROOT);
            return s.equals("true") || s.equals("1") || s.equals("yes");
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0;
        }
        if (value instanceof Collection) {
            return !((Collection<?>) value).isEmpty();
        }
        if (value instanceof Map) {
            return !((Map<?, ?>) value).isEmpty();
        }
        return true;
    }
}
