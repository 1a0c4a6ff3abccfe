package org.dxworks.ralfgen.emitter;

import org.dxworks.ralfgen.Column;
import org.dxworks.ralfgen.decoder.FieldMaterializer;
import org.dxworks.ralfgen.decoder.IntegerLiterals;
import org.dxworks.ralfgen.model.RalfBlock;
import org.dxworks.ralfgen.model.RalfField;
import org.dxworks.ralfgen.model.RalfRegister;
import org.dxworks.ralfgen.model.RegisterModel;
import org.dxworks.ralfgen.model.Row;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Groups normalized rows into blocks and registers, keeping the order in which each block and
 * each register first appears. Rows are never sorted.
 *
 * Blocks are keyed by their rendered name, so rows without a BlockName join an explicit TOP block.
 *
 * A register is created for every distinct (RegName, RegOffset) pair even when none of its rows
 * yields a field, so a register holding only reserved bits is still emitted.
 */
public final class RegisterModelBuilder {

    static final String DEFAULT_BLOCK_NAME = "TOP";

    private RegisterModelBuilder() {}

    public static RegisterModel build(List<Row> rows, boolean hierarchyPresent) {
        Map<String, Map<RegisterKey, List<RalfField>>> blocks = new LinkedHashMap<>();
        int skipped = 0;

        for (Row row : rows) {
            RegisterKey key = new RegisterKey(row.get(Column.REG_NAME), row.get(Column.REG_OFFSET));
            List<RalfField> fields = blocks
                .computeIfAbsent(blockName(row.get(Column.BLOCK_NAME)), k -> new LinkedHashMap<>())
                .computeIfAbsent(key, k -> new ArrayList<>());

            Optional<RalfField> field = FieldMaterializer.materialize(row, hierarchyPresent);
            if (field.isPresent()) {
                fields.add(field.get());
            } else {
                skipped++;
            }
        }

        List<RalfBlock> result = new ArrayList<>(blocks.size());
        for (Map.Entry<String, Map<RegisterKey, List<RalfField>>> block : blocks.entrySet()) {
            List<RalfRegister> registers = new ArrayList<>(block.getValue().size());
            for (Map.Entry<RegisterKey, List<RalfField>> register : block.getValue().entrySet()) {
                RegisterKey key = register.getKey();
                registers.add(new RalfRegister(key.name, offsetHex(key.offset), register.getValue()));
            }
            result.add(new RalfBlock(block.getKey(), registers));
        }
        return new RegisterModel(result, skipped);
    }

    private static String blockName(String name) {
        return name.isBlank() ? DEFAULT_BLOCK_NAME : name;
    }

    /**
     * Unparseable and negative offsets render as 0.
     */
    static String offsetHex(String offset) {
        BigInteger value = IntegerLiterals.parse(offset)
            .filter(v -> v.signum() >= 0)
            .orElse(BigInteger.ZERO);
        return value.toString(16).toUpperCase(Locale.ROOT);
    }

    private static final class RegisterKey {
        private final String name;
        private final String offset;

        RegisterKey(String name, String offset) {
            this.name = name;
            this.offset = offset;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof RegisterKey)) return false;
            RegisterKey other = (RegisterKey) o;
            return name.equals(other.name) && offset.equals(other.offset);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, offset);
        }
    }
}
