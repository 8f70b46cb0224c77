package com.questrail.spirv.model;

/**
 * The five-word SPIR-V module header.
 *
 * <h2>Layout</h2>
 * <pre>
 *   word 0 : magic number (0x07230203)
 *   word 1 : version      (0 | major | minor | 0, one byte each)
 *   word 2 : generator    (vendor id in the high 16 bits, tool version in the low 16)
 *   word 3 : bound        (every id in the module is below this value)
 *   word 4 : reserved     (schema; required to be 0 by the format, not validated here)
 * </pre>
 *
 * <p>Values are kept exactly as read from the binary.</p>
 */
public record ModuleHeader(
        int magic,
        int version,
        int generator,
        int bound,
        int reserved
) {
    /** SPIR-V magic number in native (little-endian) word order. */
    public static final int MAGIC_NUMBER = 0x07230203;

    /** Number of words occupied by the header. */
    public static final int WORD_COUNT = 5;

    public int majorVersion() {
        return (version >>> 16) & 0xFF;
    }

    public int minorVersion() {
        return (version >>> 8) & 0xFF;
    }

    /**
     * Registered vendor id of the tool that produced the module.
     */
    public int generatorVendor() {
        return generator >>> 16;
    }

    /**
     * Vendor-specific tool version.
     */
    public int generatorVersion() {
        return generator & 0xFFFF;
    }

    @Override
    public String toString() {
        return "ModuleHeader[" +
                "version=" + majorVersion() + "." + minorVersion() +
                ", generator=0x" + Integer.toHexString(generator) +
                ", bound=" + Integer.toUnsignedString(bound) +
                ", reserved=" + reserved +
                ']';
    }
}
