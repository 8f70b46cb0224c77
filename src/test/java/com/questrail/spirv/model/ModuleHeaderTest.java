package com.questrail.spirv.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ModuleHeaderTest
{
    @Test
    void splitsVersionAndGenerator()
    {
        ModuleHeader header = new ModuleHeader(ModuleHeader.MAGIC_NUMBER, 0x00010500, 0xFFFF0028, -1, 0);

        assertEquals(1, header.majorVersion());
        assertEquals(5, header.minorVersion());
        assertEquals(0xFFFF, header.generatorVendor());
        assertEquals(0x28, header.generatorVersion());
        assertTrue(header.toString().contains("bound=4294967295"));
        assertTrue(header.toString().contains("version=1.5"));
    }
}
