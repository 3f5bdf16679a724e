/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.rugo.registry;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.rugo.registry.bridge.BridgeModule;

/**
 * Immutable snapshot of every module a compile may reference: curated modules by name and
 * bridged Go packages by import path. Built once with {@link #builder()} and handed to the
 * generator.
 */
public final class ModuleRegistry {

    private final ImmutableMap<String, CuratedModule> curated;

    private final ImmutableMap<String, BridgeModule> bridges;

    private ModuleRegistry(final Map<String, CuratedModule> curated, final Map<String, BridgeModule> bridges) {
        this.curated = ImmutableMap.copyOf(curated);
        this.bridges = ImmutableMap.copyOf(bridges);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ModuleRegistry empty() {
        return builder().build();
    }

    public Optional<CuratedModule> curatedModule(final String name) {
        return Optional.ofNullable(curated.get(name));
    }

    public Optional<BridgeModule> bridgeModule(final String importPath) {
        return Optional.ofNullable(bridges.get(importPath));
    }

    public Collection<CuratedModule> curatedModules() {
        return curated.values();
    }

    public Collection<BridgeModule> bridgeModules() {
        return bridges.values();
    }

    public static final class Builder {

        private final Map<String, CuratedModule> curated = new LinkedHashMap<>();

        private final Map<String, BridgeModule> bridges = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder curated(final CuratedModule module) {
            Preconditions.checkArgument(!curated.containsKey(module.getName()),
                "module %s registered twice", module.getName());
            curated.put(module.getName(), module);
            return this;
        }

        public Builder curated(final Collection<CuratedModule> modules) {
            modules.forEach(this::curated);
            return this;
        }

        public Builder bridge(final BridgeModule module) {
            Preconditions.checkArgument(!bridges.containsKey(module.getImportPath()),
                "package %s registered twice", module.getImportPath());
            bridges.put(module.getImportPath(), module);
            return this;
        }

        public ModuleRegistry build() {
            return new ModuleRegistry(curated, bridges);
        }
    }
}
