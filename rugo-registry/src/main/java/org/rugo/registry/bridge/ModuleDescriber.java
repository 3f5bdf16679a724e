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

package org.rugo.registry.bridge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * Read-only report of the bridging decision for every exported function of a module.
 */
public class ModuleDescriber {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public ModuleDescription describe(final BridgeModule module) {
        ModuleDescription description = new ModuleDescription();
        description.setImportPath(module.getImportPath());
        description.setPackageName(module.getPackageName());
        for (BridgeFunction fn : module.getFunctions()) {
            FunctionDescription f = new FunctionDescription();
            f.setGoName(fn.getGoName());
            f.setRugoName(fn.getRugoName());
            f.setBridged(fn.isBridgeable());
            f.setTier(fn.getTier().name().toLowerCase());
            f.setSignature(fn.isBridgeable() ? fn.signature() : null);
            f.setReason(fn.getReason());
            f.setDoc(fn.getDoc());
            description.getFunctions().add(f);
        }
        return description;
    }

    public String toJson(final BridgeModule module) throws JsonProcessingException {
        return MAPPER.writeValueAsString(describe(module));
    }

    @Data
    public static class ModuleDescription {

        private String importPath;

        private String packageName;

        private List<FunctionDescription> functions = new ArrayList<>();
    }

    @Data
    public static class FunctionDescription {

        private String goName;

        private String rugoName;

        private boolean bridged;

        private String tier;

        private String signature;

        private String reason;

        private String doc;
    }
}
