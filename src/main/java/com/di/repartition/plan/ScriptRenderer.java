package com.di.repartition.plan;

import java.nio.file.Path;

/**
 * Boundary to the external template renderer that turns a validated table plan into SQL scripts.
 * Rendering itself lives outside this application.
 */
public interface ScriptRenderer {

    /**
     * Renders one named template for one table.
     *
     * @param templateName template identifier, e.g. {@code 10_create_table.sql}
     * @param context      resolved per-table context
     * @param outputDir    directory the rendered file goes to
     * @return path of the written file
     */
    Path render(String templateName, ScriptRenderContext context, Path outputDir);
}
