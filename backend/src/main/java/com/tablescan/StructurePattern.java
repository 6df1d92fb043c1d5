package com.tablescan;

/** Structural element of a printed table that the remover isolates with its own kernel. */
public enum StructurePattern {
    VERTICAL_LINES,
    HORIZONTAL_LINES,
    ICONS
}
