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

/**
 * How entries are moved when a container RDN changes.
 */
public enum MigrationMode {
    /** Native ModDN, one operation per entry. Preferred. */
    NATIVE_RENAME("modrdn"),
    /** Re-create at the new DN, then delete the old entry. */
    COPY_THEN_DELETE("copy_delete"),
    /** Move nothing; entries stay reachable only at their old location. */
    LEAVE_ORPHANED("leave_orphaned");

    private final String value;

    MigrationMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static MigrationMode fromValue(String value) {
        for (MigrationMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value) || mode.name().equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown migration mode: " + value);
    }
}
