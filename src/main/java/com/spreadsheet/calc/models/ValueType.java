package com.spreadsheet.calc.models;

/**
 * Enumerates the kinds of value a cell can hold.
 */
public enum ValueType {
    NUMBER,
    STRING,
    BOOLEAN,
    EMPTY,
    ERROR,
    ARRAY
}
