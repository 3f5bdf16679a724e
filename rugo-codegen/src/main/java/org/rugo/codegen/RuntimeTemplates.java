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

package org.rugo.codegen;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.Version;
import java.io.IOException;
import java.io.StringWriter;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;

/**
 * Renders the Go runtime prologue and the program skeleton from the FreeMarker templates under
 * {@code /templates}.
 */
public class RuntimeTemplates {

    static final String CORE = "runtime_core.ftl";
    static final String TASK = "runtime_task.ftl";
    static final String BRIDGE = "runtime_bridge.ftl";
    static final String PROGRAM = "program.ftl";

    static Configuration configuration = new Configuration(new Version("2.3.28"));

    static {
        configuration.setEncoding(Locale.ENGLISH, "UTF-8");
        configuration.setClassLoaderForTemplateLoading(RuntimeTemplates.class.getClassLoader(), "/templates");
    }

    /**
     * @return the runtime helper text: the core helpers, then task support and bridge
     * conversions when the program needs them
     */
    public String runtime(final boolean tasks, final boolean bridge) {
        StringBuilder sb = new StringBuilder(render(CORE, Collections.emptyMap()));
        if (tasks) {
            sb.append('\n').append(render(TASK, Collections.emptyMap()));
        }
        if (bridge) {
            sb.append('\n').append(render(BRIDGE, Collections.emptyMap()));
        }
        return sb.toString();
    }

    public String program(final Map<String, Object> model) {
        return render(PROGRAM, model);
    }

    String render(final String templateName, final Map<String, Object> model) {
        Template template;
        try {
            template = configuration.getTemplate(templateName);
        } catch (IOException e) {
            throw new IllegalStateException("Template " + templateName + " not found", e);
        }
        StringWriter out = new StringWriter();
        try {
            template.process(model, out);
        } catch (TemplateException | IOException e) {
            throw new IllegalStateException("Failed to render template " + templateName, e);
        }
        return out.toString();
    }
}
