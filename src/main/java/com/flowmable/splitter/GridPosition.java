package com.flowmable.splitter;

/**
 * Row/column coordinate of a grid cell, both 0-based.
 */
public record GridPosition(int row, int col) {}
