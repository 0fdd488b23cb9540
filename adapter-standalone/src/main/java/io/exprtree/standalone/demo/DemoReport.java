package io.exprtree.standalone.demo;

import io.exprtree.core.model.Expression;

/**
 * What a demo run produced.
 *
 * @param original   the hand-built tree
 * @param copy       its deep copy
 * @param result     value of {@code original}
 * @param copyResult value of {@code copy}
 */
public record DemoReport(Expression original, Expression copy, double result, double copyResult) {}
