package org.dxworks.ralfgen.model;

import java.util.List;

public final class RalfBlock {

    private final String name;
    private final List<RalfRegister> registers;

    public RalfBlock(String name, List<RalfRegister> registers) {
        this.name = name;
        this.registers = List.copyOf(registers);
    }

    public String getName() {
        return name;
    }

    public List<RalfRegister> getRegisters() {
        return registers;
    }
}
