package com.dumpgraph.core.parser.builder;

/**
 * One {@code arg} element of a function.
 *
 * @param position 1-based argument position
 * @param variableId identifier of the argument variable, null if reserved or absent
 */
public record FunctionArgument(int position, String variableId) {}
