package org.dxworks.ralfgen.model;

import java.util.List;

public final class RalfRegister {

    private final String name;
    private final String offsetHex;
    private final List<RalfField> fields;

    public RalfRegister(String name, String offsetHex, List<RalfField> fields) {
        this.name = name;
        this.offsetHex = offsetHex;
        this.fields = List.copyOf(fields);
    }

    public String getName() {
        return name;
    }

    /**
     * Offset as uppercase hexadecimal digits without any prefix.
     */
    public String getOffsetHex() {
        return offsetHex;
    }

    public List<RalfField> getFields() {
        return fields;
    }
}
