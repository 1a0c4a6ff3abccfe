package org.dxworks.ralfgen.emitter;

import org.dxworks.ralfgen.model.RalfBlock;
import org.dxworks.ralfgen.model.RalfRegister;
import org.dxworks.ralfgen.model.RegisterModel;
import org.dxworks.ralfgen.model.Row;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.dxworks.ralfgen.TestUtils.HEADER;
import static org.dxworks.ralfgen.TestUtils.row;
import static org.junit.jupiter.api.Assertions.*;

public class RegisterModelBuilderTest {

    @Test
    void keepsFirstSeenOrderWithoutSorting() {
        RegisterModel model = RegisterModelBuilder.build(List.of(
                row(HEADER, "UART", "TX", "0x8", "0", "DATA"),
                row(HEADER, "GPIO", "CTRL", "0x0", "0", "EN"),
                row(HEADER, "UART", "CFG", "0x0", "0", "BAUD"),
                row(HEADER, "UART", "TX", "0x8", "1", "VALID")), false);

        assertEquals(List.of("UART", "GPIO"), blockNames(model));
        RalfBlock uart = model.getBlocks().get(0);
        assertEquals(List.of("TX", "CFG"), registerNames(uart));
        assertEquals(List.of("DATA", "VALID"), uart.getRegisters().get(0).getFields().stream()
                .map(f -> f.getName()).collect(Collectors.toList()));
    }

    @Test
    void registerIsIdentifiedByNameAndOffset() {
        RegisterModel model = RegisterModelBuilder.build(List.of(
                row(HEADER, "DMA", "CH_CTRL", "0x0", "0", "EN"),
                row(HEADER, "DMA", "CH_CTRL", "0x40", "0", "EN")), false);

        List<RalfRegister> registers = model.getBlocks().get(0).getRegisters();
        assertEquals(2, registers.size());
        assertEquals("0", registers.get(0).getOffsetHex());
        assertEquals("40", registers.get(1).getOffsetHex());
    }

    @Test
    void registerWithoutFieldsIsStillEmitted() {
        RegisterModel model = RegisterModelBuilder.build(List.of(
                row(HEADER, "GPIO", "PAD", "0x4", "31:0", "Reserved")), false);

        RalfRegister register = model.getBlocks().get(0).getRegisters().get(0);
        assertEquals("PAD", register.getName());
        assertTrue(register.getFields().isEmpty());
        assertEquals(1, model.getSkippedRows());
    }

    @Test
    void emptyBlockNameDefaultsToTop() {
        RegisterModel model = RegisterModelBuilder.build(List.of(
                row(HEADER, "", "CTRL", "0x0", "0", "EN")), false);

        assertEquals(List.of("TOP"), blockNames(model));
    }

    @Test
    void unnamedRowsJoinExplicitTopBlock() {
        RegisterModel model = RegisterModelBuilder.build(List.of(
                row(HEADER, "", "R", "0x0", "0", "F"),
                row(HEADER, "TOP", "S", "0x4", "0", "G")), false);

        assertEquals(List.of("TOP"), blockNames(model));
        assertEquals(List.of("R", "S"), registerNames(model.getBlocks().get(0)));
    }

    @Test
    void offsetRendering() {
        assertEquals("10", RegisterModelBuilder.offsetHex("0x10"));
        assertEquals("10", RegisterModelBuilder.offsetHex("16"));
        assertEquals("FFFF0000", RegisterModelBuilder.offsetHex("0xffff0000"));
        assertEquals("0", RegisterModelBuilder.offsetHex(""));
        assertEquals("0", RegisterModelBuilder.offsetHex("base+4"));
        assertEquals("0", RegisterModelBuilder.offsetHex("-4"));
    }

    @Test
    void countsRowsAndFields() {
        List<Row> rows = List.of(
                row(HEADER, "GPIO", "CTRL", "0x0", "7:0", "EN"),
                row(HEADER, "GPIO", "CTRL", "0x0", "8", "Reserved"),
                row(HEADER, "GPIO", "STAT", "0x4", "", "BUSY"),
                row(HEADER, "GPIO", "STAT", "0x4", "1", "DONE"));

        RegisterModel model = RegisterModelBuilder.build(rows, false);

        assertEquals(1, model.getBlocks().size());
        assertEquals(2, model.getRegisterCount());
        assertEquals(2, model.getFieldCount());
        assertEquals(2, model.getSkippedRows());
    }

    private static List<String> blockNames(RegisterModel model) {
        return model.getBlocks().stream().map(RalfBlock::getName).collect(Collectors.toList());
    }

    private static List<String> registerNames(RalfBlock block) {
        return block.getRegisters().stream().map(RalfRegister::getName).collect(Collectors.toList());
    }
}
