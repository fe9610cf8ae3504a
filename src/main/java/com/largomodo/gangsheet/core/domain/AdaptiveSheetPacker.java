package com.largomodo.gangsheet.core.domain;

import java.util.List;

/**
 * Default packer: grid layout for single-size queues, shelf layout for mixed ones.
 * <p>
 * The mode is re-evaluated per sheet. Once the queue has moved past the last
 * design of a different size, the remaining sheets switch to the denser
 * uniform grid.
 */
public class AdaptiveSheetPacker implements SheetPacker {

    private final SheetPacker uniform;
    private final SheetPacker shelf;

    public AdaptiveSheetPacker() {
        this(new UniformGridPacker(), new ShelfPacker());
    }

    public AdaptiveSheetPacker(SheetPacker uniform, SheetPacker shelf) {
        this.uniform = uniform;
        this.shelf = shelf;
    }

    @Override
    public PackResult packOneSheet(List<Design> remaining, SheetConstraints constraints) {
        FitCheck.requireNonEmpty(remaining);
        return switch (LayoutMode.select(remaining)) {
            case UNIFORM -> uniform.packOneSheet(remaining, constraints);
            case SHELF -> shelf.packOneSheet(remaining, constraints);
        };
    }
}
