package org.dxworks.ralfgen;

import org.dxworks.ralfgen.emitter.RalfEmitter;
import org.dxworks.ralfgen.emitter.RegisterModelBuilder;
import org.dxworks.ralfgen.model.RegisterModel;
import org.dxworks.ralfgen.model.Row;
import org.dxworks.ralfgen.model.RowTable;
import org.dxworks.ralfgen.normalizer.RowNormalizer;

import java.util.List;

/**
 * In-memory conversion of a loaded sheet into RALF text. Performs no I/O.
 */
public final class RalfGenerator {

    private RalfGenerator() {}

    public static Result generate(RowTable table, int bytesPerWord) {
        List<Row> normalized = RowNormalizer.normalize(table);
        RegisterModel model = RegisterModelBuilder.build(normalized, table.hasColumn(Column.HIERARCHY));
        return new Result(model, RalfEmitter.emit(model, bytesPerWord));
    }

    public static final class Result {
        private final RegisterModel model;
        private final String text;

        Result(RegisterModel model, String text) {
            this.model = model;
            this.text = text;
        }

        public RegisterModel getModel() {
            return model;
        }

        public String getText() {
            return text;
        }
    }
}
