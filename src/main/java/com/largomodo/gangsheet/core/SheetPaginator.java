package com.largomodo.gangsheet.core;

import com.largomodo.gangsheet.core.domain.CopyQueue;
import com.largomodo.gangsheet.core.domain.PackResult;
import com.largomodo.gangsheet.core.domain.Sheet;
import com.largomodo.gangsheet.core.domain.SheetConstraints;
import com.largomodo.gangsheet.core.domain.SheetPacker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Drives a {@link SheetPacker} across a copy queue until every copy is placed.
 * <p>
 * Invariant: the copies on all returned sheets add up to the queue's initial size.
 * Termination relies on the packer consuming at least one copy per call; a call
 * that makes no progress is reported as {@link PackingStalledException} instead
 * of looping forever.
 */
public class SheetPaginator {

    private static final Logger log = LoggerFactory.getLogger(SheetPaginator.class);

    private final SheetPacker packer;

    public SheetPaginator(SheetPacker packer) {
        this.packer = packer;
    }

    /**
     * Packs the whole queue into sheets, advancing the queue as it goes.
     *
     * @param queue       copies to place; left empty on return
     * @param constraints sheet geometry
     * @return sheets in production order, empty if the queue was empty
     * @throws PackingStalledException if the packer returns without consuming a copy
     */
    public List<Sheet> paginate(CopyQueue queue, SheetConstraints constraints) {
        List<Sheet> sheets = new ArrayList<>();

        while (!queue.isEmpty()) {
            int remainingBefore = queue.remainingCount();
            PackResult result = packer.packOneSheet(queue.remaining(), constraints);

            if (result.consumed() <= 0) {
                throw new PackingStalledException(
                        "Packer placed no copies on sheet " + (sheets.size() + 1)
                                + " with " + remainingBefore + " copies remaining");
            }
            if (result.consumed() > remainingBefore) {
                throw new PackingStalledException(
                        "Packer reported " + result.consumed() + " copies consumed but only "
                                + remainingBefore + " remained");
            }

            queue.advance(result.consumed());
            sheets.add(result.sheet());

            log.debug("Sheet {}: {} copies, {} remaining, length {}\"",
                    sheets.size(), result.consumed(), queue.remainingCount(),
                    result.sheet().heightInches());
        }

        log.info("Laid out {} copies on {} sheet(s)", queue.initialSize(), sheets.size());
        return sheets;
    }
}
