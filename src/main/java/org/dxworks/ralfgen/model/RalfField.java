package org.dxworks.ralfgen.model;

import java.util.Optional;

public final class RalfField {

    private final String name;
    private final int lsb;
    private final int width;
    private final String access;
    private final String reset; // width-qualified literal, e.g. 8'h1

    public RalfField(String name, int lsb, int width, String access, String reset) {
        this.name = name;
        this.lsb = lsb;
        this.width = width;
        this.access = access;
        this.reset = reset;
    }

    public String getName() {
        return name;
    }

    public int getLsb() {
        return lsb;
    }

    public int getWidth() {
        return width;
    }

    public String getAccess() {
        return access;
    }

    public Optional<String> getReset() {
        return Optional.ofNullable(reset);
    }
}
