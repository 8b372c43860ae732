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
 * One entry that could not be migrated, with the reason.
 */
public final class FailedEntry {
    private final String dn;
    private final String error;

    public FailedEntry(String dn, String error) {
        this.dn = dn;
        this.error = error;
    }

    public String getDn() {
        return dn;
    }

    public String getError() {
        return error;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FailedEntry)) return false;
        FailedEntry other = (FailedEntry) o;
        return dn.equals(other.dn) && error.equals(other.error);
    }

    @Override
    public int hashCode() {
        return 31 * dn.hashCode() + error.hashCode();
    }

    @Override
    public String toString() {
        return dn + ": " + error;
    }
}
