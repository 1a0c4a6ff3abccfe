package org.dxworks.ralfgen.model;

import java.util.List;

/**
 * The grouped Block -> Register -> Field hierarchy built from one sheet.
 */
public final class RegisterModel {

    private final List<RalfBlock> blocks;
    private final int skippedRows;

    public RegisterModel(List<RalfBlock> blocks, int skippedRows) {
        this.blocks = List.copyOf(blocks);
        this.skippedRows = skippedRows;
    }

    public List<RalfBlock> getBlocks() {
        return blocks;
    }

    /**
     * Rows that contributed no field (reserved, unnamed or with an unusable bit range).
     */
    public int getSkippedRows() {
        return skippedRows;
    }

    public int getRegisterCount() {
        return blocks.stream().mapToInt(b -> b.getRegisters().size()).sum();
    }

    public int getFieldCount() {
        return blocks.stream()
            .flatMap(b -> b.getRegisters().stream())
            .mapToInt(r -> r.getFields().size())
            .sum();
    }
}
