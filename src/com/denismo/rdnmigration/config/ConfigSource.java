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

/**
 * Generic, loosely typed access to configuration values. Implementations may
 * fail; callers that need a typed value go through {@link MigrationSettings}.
 */
public interface ConfigSource {

    /**
     * @return the configured value, or {@code defaultValue} when the key is absent
     */
    Object getValue(String category, String key, Object defaultValue) throws Exception;
}
