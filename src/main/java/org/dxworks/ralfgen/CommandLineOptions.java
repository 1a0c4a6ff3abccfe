package org.dxworks.ralfgen;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Parsed command line. Unset optional values are null and fall back to the configuration.
 */
public final class CommandLineOptions {

    private final Path excel;
    private final Path out;
    private final String sheet;
    private final Integer bytesPerWord;

    private CommandLineOptions(Path excel, Path out, String sheet, Integer bytesPerWord) {
        this.excel = excel;
        this.out = out;
        this.sheet = sheet;
        this.bytesPerWord = bytesPerWord;
    }

    public Path getExcel() {
        return excel;
    }

    public Path getOut() {
        return out;
    }

    public String getSheet() {
        return sheet;
    }

    public Integer getBytesPerWord() {
        return bytesPerWord;
    }

    /**
     * @throws IllegalArgumentException on unknown options, missing values or a missing required option
     */
    public static CommandLineOptions parse(String[] args) {
        Path excel = null;
        Path out = null;
        String sheet = null;
        Integer bytesPerWord = null;

        for (int i = 0; i < args.length; i++) {
            String option = args[i];
            switch (option) {
                case "--excel":
                    excel = Paths.get(value(args, ++i, option));
                    break;
                case "--out":
                    out = Paths.get(value(args, ++i, option));
                    break;
                case "--sheet":
                    sheet = value(args, ++i, option);
                    break;
                case "--bytes":
                    String bytes = value(args, ++i, option);
                    try {
                        bytesPerWord = Integer.parseInt(bytes.trim());
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("--bytes expects an integer, got: " + bytes, e);
                    }
                    if (bytesPerWord <= 0) {
                        throw new IllegalArgumentException("--bytes must be positive, got: " + bytes);
                    }
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + option);
            }
        }

        if (excel == null) throw new IllegalArgumentException("Missing required option --excel");
        if (out == null) throw new IllegalArgumentException("Missing required option --out");

        return new CommandLineOptions(excel, out, sheet, bytesPerWord);
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }
}
