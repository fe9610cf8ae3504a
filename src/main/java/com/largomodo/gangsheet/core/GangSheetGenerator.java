package com.largomodo.gangsheet.core;

import com.largomodo.gangsheet.core.domain.CopyQueue;
import com.largomodo.gangsheet.core.domain.Design;
import com.largomodo.gangsheet.core.domain.Sheet;
import com.largomodo.gangsheet.core.domain.SheetConstraints;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point of the layout engine: turns validated designs into laid out sheets.
 * <p>
 * Pure and synchronous; safe to call from any thread as long as each call gets
 * its own arguments.
 */
public class GangSheetGenerator {

    private final SheetPaginator paginator;

    public GangSheetGenerator(SheetPaginator paginator) {
        this.paginator = paginator;
    }

    /**
     * Lays out every requested copy of every design.
     *
     * @param designs     one or more designs in request order
     * @param constraints sheet geometry
     * @param rotate      whether to turn every copy 90°
     * @return sheets in production order; never empty for a valid request
     * @throws InvalidQuantityException if designs is null or empty
     */
    public List<Sheet> generateLayout(List<Design> designs, SheetConstraints constraints, boolean rotate) {
        if (designs == null || designs.isEmpty()) {
            throw new InvalidQuantityException("At least one design is required");
        }
        if (constraints == null) {
            throw new IllegalArgumentException("Sheet constraints must not be null");
        }

        List<Design> oriented = new ArrayList<>(designs.size());
        for (Design design : designs) {
            oriented.add(design.withRotated(rotate));
        }

        return paginator.paginate(CopyQueue.of(oriented), constraints);
    }
}
