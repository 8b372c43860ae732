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

package com.denismo.rdnmigration.strategy;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Server maintained attributes that must not be copied to a re-created entry.
 */
public final class OperationalAttributes {
    private static final Set<String> NAMES = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
            "dn",
            "createtimestamp",
            "modifytimestamp",
            "creatorsname",
            "modifiersname",
            "entryuuid",
            "entrycsn",
            "entrydn",
            "entryparentid",
            "structuralobjectclass",
            "subschemasubentry",
            "hassubordinates",
            "numsubordinates",
            "nbchildren",
            "nbsubordinates")));

    private OperationalAttributes() {
    }

    public static boolean isOperational(String attributeName) {
        return attributeName != null && NAMES.contains(attributeName.toLowerCase(Locale.ROOT));
    }

    public static Set<String> names() {
        return NAMES;
    }
}
