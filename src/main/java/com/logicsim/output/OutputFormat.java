package com.logicsim.output;

/**
 * Output formats selectable from the command line.
 */
public enum OutputFormat {
    TABLE,
    CSV,
    JSON;

    public TableWriter createWriter(boolean booleanWords, boolean compact) {
        return switch (this) {
            case TABLE -> new TableFormatter(booleanWords);
            case CSV -> new CsvExporter();
            case JSON -> new JsonTableWriter(!compact);
        };
    }
}
