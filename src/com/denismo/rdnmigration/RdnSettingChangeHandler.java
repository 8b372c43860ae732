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

import com.denismo.rdnmigration.config.MigrationSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reacts to a change of a setting that names the container RDN of a family of
 * entries, e.g. the {@code sudoers_rdn} of the sudo plugin.
 * <p>
 * An unconfirmed change with impact is held back when
 * {@code ldap.rdn_change_confirmation} is on. A confirmed change either
 * migrates the entries or, when migration is declined, records them as left
 * orphaned.
 */
public class RdnSettingChangeHandler {
    private static final Logger LOG = LoggerFactory.getLogger(RdnSettingChangeHandler.class);

    private static final Map<String, String> WELL_KNOWN_SETTINGS;

    static {
        Map<String, String> settings = new LinkedHashMap<String, String>();
        settings.put("dns.dns_rdn", "dNSZone");
        settings.put("dhcp.dhcp_rdn", "dhcpService");
        settings.put("sudo.sudoers_rdn", "sudoRole");
        settings.put("systems.systems_rdn", "device");
        WELL_KNOWN_SETTINGS = Collections.unmodifiableMap(settings);
    }

    private final RdnMigrationService service;
    private final Map<String, String> rdnSettings;

    public RdnSettingChangeHandler(RdnMigrationService service) {
        this(service, WELL_KNOWN_SETTINGS);
    }

    /**
     * @param rdnSettings {@code plugin.key} to the objectClass of the entries living under that RDN
     */
    public RdnSettingChangeHandler(RdnMigrationService service, Map<String, String> rdnSettings) {
        this.service = service;
        this.rdnSettings = rdnSettings;
    }

    public static Map<String, String> wellKnownSettings() {
        return WELL_KNOWN_SETTINGS;
    }

    public boolean isRdnSetting(String plugin, String key) {
        return rdnSettings.containsKey(settingName(plugin, key));
    }

    /**
     * @param currentRdn the stored value, null if the setting was never set
     * @param confirmed whether the operator has seen the impact and agreed to it
     * @param migrate whether to move the entries; null for {@code ldap.migrate_on_rdn_change}
     */
    public RdnChangeOutcome handle(String plugin, String key, String currentRdn, String newRdn,
                                   boolean confirmed, Boolean migrate) {
        String setting = settingName(plugin, key);
        String objectClass = rdnSettings.get(setting);
        if (objectClass == null) {
            return new RdnChangeOutcome(RdnChangeOutcome.Status.NOT_AN_RDN_SETTING, setting, null, null);
        }
        if (currentRdn == null || currentRdn.equalsIgnoreCase(newRdn)) {
            return new RdnChangeOutcome(RdnChangeOutcome.Status.UNCHANGED, setting, null, null);
        }

        MigrationCheck check = service.checkRdnChange(currentRdn, newRdn, null, objectClass);
        if (check.getEntriesCount() == 0) {
            LOG.debug("No {} entries under {}, {} can change freely", objectClass, currentRdn, setting);
            return new RdnChangeOutcome(RdnChangeOutcome.Status.NO_IMPACT, setting, check, null);
        }

        MigrationSettings settings = service.getSettings();
        if (!confirmed && settings.requireRdnChangeConfirmation()) {
            LOG.info("Change of " + setting + " from " + currentRdn + " to " + newRdn + " affects "
                    + check.getEntriesCount() + " entries, confirmation required");
            return new RdnChangeOutcome(RdnChangeOutcome.Status.CONFIRMATION_REQUIRED, setting, check, null);
        }

        boolean doMigrate = migrate != null ? migrate : settings.migrateOnRdnChange();
        if (!doMigrate) {
            MigrationResult result = service.migrateEntries(currentRdn, newRdn, null, MigrationMode.LEAVE_ORPHANED,
                    objectClass, false);
            return new RdnChangeOutcome(RdnChangeOutcome.Status.LEFT_ORPHANED, setting, check, result);
        }

        MigrationResult result = service.migrateEntries(currentRdn, newRdn, null, check.getRecommendedMode(),
                objectClass, true);
        LOG.info("Change of " + setting + " from " + currentRdn + " to " + newRdn + " migrated "
                + result.getEntriesMigrated() + " entries, " + result.getEntriesFailed() + " failed");
        return new RdnChangeOutcome(RdnChangeOutcome.Status.MIGRATED, setting, check, result);
    }

    private static String settingName(String plugin, String key) {
        return plugin + "." + key;
    }
}
