package com.shapekit.core.codegen.generator;

import com.shapekit.core.codegen.JavaWriter;

/**
 * Renders the builder of a structure into the structure's class body.
 *
 * <p>Client and server generation differ in how much a builder validates, so each target
 * supplies its own implementation.
 */
public interface BuilderGenerator {

    /**
     * Renders the nested {@code Builder} class and any types it depends on.
     *
     * @param writer writer positioned inside the structure's class body
     */
    void render(JavaWriter writer);

    /**
     * Renders the static {@code builder()} factory on the structure.
     *
     * @param writer writer positioned inside the structure's class body
     */
    void renderConvenienceMethod(JavaWriter writer);
}
