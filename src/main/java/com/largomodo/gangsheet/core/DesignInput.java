package com.largomodo.gangsheet.core;

import java.nio.file.Path;

/**
 * One asset file of a job and how many copies of it to print.
 *
 * @param file   asset file on disk
 * @param copies requested copies
 */
public record DesignInput(Path file, int copies) {
}
