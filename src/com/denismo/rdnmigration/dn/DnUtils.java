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

import org.apache.directory.api.ldap.model.exception.LdapInvalidDnException;
import org.apache.directory.api.ldap.model.name.Rdn;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * String level helpers for RDNs and DNs.
 *
 * The migration rewrites DNs as text so that everything except the replaced
 * RDN keeps the exact form the directory returned. All matching is bounded by
 * unescaped commas or by the ends of the string, never by a bare substring
 * search.
 */
public final class DnUtils {
    private static final Pattern ATTRIBUTE_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9-]*|[0-9]+(\\.[0-9]+)*");

    private DnUtils() {
    }

    /**
     * Splits {@code attribute=value}.
     *
     * @throws LdapInvalidDnException if the RDN does not have exactly one unescaped
     *         {@code =} between a valid attribute name and a non-empty value
     */
    public static RdnParts splitRdn(String rdn) throws LdapInvalidDnException {
        if (rdn == null) {
            throw invalidRdn(rdn);
        }
        int separator = -1;
        for (int i = 0; i < rdn.length(); i++) {
            char c = rdn.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '=') {
                if (separator >= 0) {
                    throw invalidRdn(rdn);
                }
                separator = i;
            } else if (c == ',' || c == ';' || c == '+') {
                // more than one naming component
                throw invalidRdn(rdn);
            }
        }
        if (separator <= 0 || separator == rdn.length() - 1) {
            throw invalidRdn(rdn);
        }
        String attribute = rdn.substring(0, separator);
        if (!ATTRIBUTE_NAME.matcher(attribute).matches()) {
            throw invalidRdn(rdn);
        }
        return new RdnParts(attribute, rdn.substring(separator + 1));
    }

    public static String childDn(String cn, String parentDn) {
        return childDn("cn", cn, parentDn);
    }

    public static String childDn(String attribute, String value, String parentDn) {
        return attribute + "=" + Rdn.escapeValue(value) + "," + parentDn;
    }

    /**
     * Everything after the first unescaped comma, exactly as written, or
     * {@code fallback} for a single component DN.
     */
    public static String parentDn(String dn, String fallback) {
        int comma = indexOfUnescaped(dn, ',', 0);
        if (comma < 0) {
            return fallback;
        }
        return dn.substring(comma + 1);
    }

    /**
     * The leftmost RDN of a DN, in its original form.
     */
    public static String firstRdn(String dn) {
        int comma = indexOfUnescaped(dn, ',', 0);
        return comma < 0 ? dn : dn.substring(0, comma);
    }

    /**
     * Replaces the {@code oldRdn} component of {@code dn} with {@code newRdn}.
     * <p>
     * Lookup order: the first embedded {@code ,oldRdn,}; a terminal
     * {@code ,oldRdn}; a leading {@code oldRdn,} (or the whole DN), which is
     * how a container's own DN is rewritten. Matching ignores case, the rest of
     * the DN is copied unchanged.
     *
     * @throws LdapInvalidDnException if {@code oldRdn} is not a component of {@code dn}
     */
    public static String rewriteRdnSegment(String dn, String oldRdn, String newRdn) throws LdapInvalidDnException {
        if (dn == null || oldRdn == null || oldRdn.isEmpty() || newRdn == null) {
            throw new LdapInvalidDnException("Could not calculate new DN for: " + dn);
        }
        int length = oldRdn.length();

        int from = 0;
        while (true) {
            int comma = indexOfUnescaped(dn, ',', from);
            if (comma < 0) {
                break;
            }
            int end = comma + 1 + length;
            if (end < dn.length() && dn.charAt(end) == ','
                    && dn.regionMatches(true, comma + 1, oldRdn, 0, length)) {
                return dn.substring(0, comma + 1) + newRdn + dn.substring(end);
            }
            from = comma + 1;
        }

        int terminal = dn.length() - length - 1;
        if (terminal >= 0 && dn.charAt(terminal) == ',' && !isEscaped(dn, terminal)
                && dn.regionMatches(true, terminal + 1, oldRdn, 0, length)) {
            return dn.substring(0, terminal + 1) + newRdn;
        }

        if (dn.regionMatches(true, 0, oldRdn, 0, length)
                && (dn.length() == length || (dn.charAt(length) == ',' && !isEscaped(dn, length)))) {
            return newRdn + dn.substring(length);
        }

        throw new LdapInvalidDnException("Could not calculate new DN for: " + dn);
    }

    public static boolean sameDn(String dn, String other) {
        return dn != null && dn.equalsIgnoreCase(other);
    }

    /**
     * True when {@code dn} lies strictly below {@code ancestorDn}.
     */
    public static boolean isDescendantOf(String dn, String ancestorDn) {
        int offset = dn.length() - ancestorDn.length() - 1;
        return offset > 0
                && dn.charAt(offset) == ','
                && !isEscaped(dn, offset)
                && dn.regionMatches(true, offset + 1, ancestorDn, 0, ancestorDn.length());
    }

    /**
     * Removes DN escaping ({@code \,} and {@code \hh} pairs) from an RDN value.
     */
    public static String unescapeValue(String value) {
        if (value.indexOf('\\') < 0) {
            return value;
        }
        Object unescaped = Rdn.unescapeValue(value);
        if (unescaped instanceof byte[]) {
            return new String((byte[]) unescaped, StandardCharsets.UTF_8);
        }
        return (String) unescaped;
    }

    static int indexOfUnescaped(String value, char target, int from) {
        for (int i = from; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == target) {
                return i;
            }
        }
        return -1;
    }

    static boolean isEscaped(String value, int index) {
        int backslashes = 0;
        for (int i = index - 1; i >= 0 && value.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }

    private static LdapInvalidDnException invalidRdn(String rdn) {
        return new LdapInvalidDnException("Invalid RDN format: " + rdn);
    }
}
