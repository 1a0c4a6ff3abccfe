package org.dxworks.ralfgen;

import org.dxworks.ralfgen.loader.SpreadsheetLoader;
import org.dxworks.ralfgen.model.RegisterModel;
import org.dxworks.ralfgen.model.RowTable;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class App {

    public static void main(String[] args) {
        int status = run(args, RalfgenConfig.load(), System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    public static int run(String[] args, RalfgenConfig config, PrintStream out, PrintStream err) {
        CommandLineOptions options;
        try {
            options = CommandLineOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            printUsage(err);
            return 2;
        }

        Path input = options.getExcel();
        if (!Files.exists(input)) {
            err.println("Error: Input path does not exist: " + input);
            return 1;
        }

        RalfgenConfig effective = RalfgenConfig.with(
                options.getBytesPerWord() != null ? options.getBytesPerWord() : config.getBytesPerWord(),
                options.getSheet() != null ? options.getSheet() : config.getSheet());
        String sheet = effective.getSheet();
        int bytesPerWord = effective.getBytesPerWord();

        out.println("Reading " + input.toAbsolutePath() + (sheet != null ? " [sheet " + sheet + "]" : ""));

        try {
            RalfGenerator.Result result = convert(input, sheet, bytesPerWord);
            writeOutput(options.getOut(), result.getText());

            RegisterModel model = result.getModel();
            out.println("Blocks: " + model.getBlocks().size()
                    + ", registers: " + model.getRegisterCount()
                    + ", fields: " + model.getFieldCount()
                    + ", rows without field: " + model.getSkippedRows());
            out.println("Generated RALF: " + options.getOut());
            return 0;
        } catch (SchemaException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException | IllegalArgumentException e) {
            err.println("Error: failed to convert " + input + ": " + e.getMessage());
            return 1;
        }
    }

    /**
     * Loads the sheet and renders it. Nothing is written; a missing column fails here, before any output exists.
     */
    public static RalfGenerator.Result convert(Path workbook, String sheet, int bytesPerWord) throws IOException {
        RowTable table = SpreadsheetLoader.load(workbook, sheet);
        return RalfGenerator.generate(table, bytesPerWord);
    }

    private static void writeOutput(Path output, String text) throws IOException {
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }
        Files.writeString(output, text, StandardCharsets.UTF_8);
    }

    private static void printUsage(PrintStream err) {
        err.println("Usage: java -jar ralfgen.jar --excel <workbook> --out <output-file> [--sheet <name|index>] [--bytes <n>]");
        err.println("  --excel: Path to the .xlsx/.xls register sheet");
        err.println("  --out:   Path to the RALF file to write");
        err.println("  --sheet: Sheet name or zero-based index (default: first sheet)");
        err.println("  --bytes: Value of the block 'bytes' declaration (default: 4)");
    }
}
