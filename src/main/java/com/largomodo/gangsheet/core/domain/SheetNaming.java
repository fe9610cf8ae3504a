package com.largomodo.gangsheet.core.domain;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns distinct file names to a job's sheets.
 * <p>
 * Full-length overflow sheets share dimensions, so the conventional
 * {@code gangsheet_<W>x<H>} name repeats; the second and later occurrences get
 * {@code _2}, {@code _3}, ... suffixes.
 */
public class SheetNaming {

    private SheetNaming() {
    }

    /**
     * @param sheets    sheets in production order
     * @param extension file extension without the dot
     * @return one distinct file name per sheet, same order
     */
    public static List<String> uniqueFileNames(List<Sheet> sheets, String extension) {
        Map<String, Integer> seen = new HashMap<>();
        List<String> names = new ArrayList<>(sheets.size());
        for (Sheet sheet : sheets) {
            String name = sheet.fileName(extension);
            int occurrence = seen.merge(name, 1, Integer::sum);
            if (occurrence > 1) {
                name = name.substring(0, name.length() - extension.length() - 1)
                        + "_" + occurrence + "." + extension;
            }
            names.add(name);
        }
        return names;
    }
}
