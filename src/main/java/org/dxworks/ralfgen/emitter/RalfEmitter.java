package org.dxworks.ralfgen.emitter;

import org.dxworks.ralfgen.model.RalfBlock;
import org.dxworks.ralfgen.model.RalfField;
import org.dxworks.ralfgen.model.RalfRegister;
import org.dxworks.ralfgen.model.RegisterModel;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a register model as RALF text.
 *
 * <pre>
 * block GPIO {
 *   bytes 4;
 *     register CTRL @'h10 {
 *         field EN @0 {
 *            bits 8;
 *            access rw;
 *            reset 8'h1;
 *         }
 *     }
 *
 * }
 * </pre>
 *
 * Blocks are separated by one empty line and the text does not end with a newline.
 */
public final class RalfEmitter {

    private static final String BLOCK_BODY_INDENT = "  ";
    private static final String REGISTER_INDENT = "    ";
    private static final String FIELD_INDENT = "        ";
    private static final String FIELD_BODY_INDENT = "           ";

    private RalfEmitter() {}

    public static String emit(RegisterModel model, int bytesPerWord) {
        List<String> lines = new ArrayList<>();
        boolean firstBlock = true;

        for (RalfBlock block : model.getBlocks()) {
            if (!firstBlock) {
                lines.add("");
            }
            firstBlock = false;

            lines.add("block " + block.getName() + " {");
            lines.add(BLOCK_BODY_INDENT + "bytes " + bytesPerWord + ";");
            for (RalfRegister register : block.getRegisters()) {
                emitRegister(register, lines);
            }
            lines.add("}");
        }

        return String.join("\n", lines);
    }

    private static void emitRegister(RalfRegister register, List<String> lines) {
        lines.add(REGISTER_INDENT + "register " + register.getName() + " @'h" + register.getOffsetHex() + " {");
        for (RalfField field : register.getFields()) {
            emitField(field, lines);
        }
        lines.add(REGISTER_INDENT + "}");
        lines.add("");
    }

    private static void emitField(RalfField field, List<String> lines) {
        lines.add(FIELD_INDENT + "field " + field.getName() + " @" + field.getLsb() + " {");
        lines.add(FIELD_BODY_INDENT + "bits " + field.getWidth() + ";");
        lines.add(FIELD_BODY_INDENT + "access " + field.getAccess() + ";");
        field.getReset().ifPresent(reset -> lines.add(FIELD_BODY_INDENT + "reset " + reset + ";"));
        lines.add(FIELD_INDENT + "}");
    }
}
