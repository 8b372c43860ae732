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

package com.denismo.rdnmigration.dn;

/**
 * The two halves of an {@code attribute=value} RDN. The value is kept in its
 * DN-escaped form; use {@link DnUtils#unescapeValue(String)} for the raw value.
 */
public final class RdnParts {
    private final String attribute;
    private final String value;

    public RdnParts(String attribute, String value) {
        this.attribute = attribute;
        this.value = value;
    }

    public String getAttribute() {
        return attribute;
    }

    public String getValue() {
        return value;
    }

    public boolean isAttribute(String name) {
        return attribute.equalsIgnoreCase(name);
    }

    @Override
    public String toString() {
        return attribute + "=" + value;
    }
}
