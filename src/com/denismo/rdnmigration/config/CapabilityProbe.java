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

/**
 * Decides whether entries may be moved with a native ModDN operation.
 * <p>
 * The answer comes from configuration only and is never an error: a wrong
 * "true" costs a fallback to copy-then-delete later, not data.
 */
public class CapabilityProbe {
    private static final Logger LOG = LoggerFactory.getLogger(CapabilityProbe.class);

    private final MigrationSettings settings;

    public CapabilityProbe(MigrationSettings settings) {
        this.settings = settings;
    }

    public boolean supportsNativeRename() {
        boolean allowed = settings.allowModRdn();
        LOG.debug("Native rename allowed: {}", allowed);
        return allowed;
    }
}
