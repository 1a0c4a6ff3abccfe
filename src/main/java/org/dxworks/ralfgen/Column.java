package org.dxworks.ralfgen;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

public enum Column {
    BLOCK_NAME("BlockName", true, true),
    REG_NAME("RegName", true, true),
    REG_OFFSET("RegOffset", true, true),
    BIT("Bit", true, false),
    FIELD_NAME("FieldName", true, false),
    ACCESS("Access", true, false),
    RESET_VALUE("ResetValue", true, false),
    DESCRIPTION("Description", true, false),
    HIERARCHY("Hierarchy", false, true);

    private final String name;
    private final boolean required;
    private final boolean fillDown;

    Column(String name, boolean required, boolean fillDown) {
        this.name = name;
        this.required = required;
        this.fillDown = fillDown;
    }

    public String getName() {
        return name;
    }

    public boolean isRequired() {
        return required;
    }

    /**
     * Whether empty cells of this column inherit the value of the closest non-empty cell above them.
     */
    public boolean isFillDown() {
        return fillDown;
    }

    public static List<Column> requiredColumns() {
        return Arrays.stream(values())
            .filter(Column::isRequired)
            .collect(Collectors.toList());
    }

    public static List<Column> fillDownColumns() {
        return Arrays.stream(values())
            .filter(Column::isFillDown)
            .collect(Collectors.toList());
    }
}
