package com.questrail.spirv.consumer;

/**
 * Indicates that a well-formed instruction stream does not follow the SPIR-V
 * logical module layout expected by {@link ModuleLoader}.
 *
 * This typically reflects:
 * <ul>
 *   <li>Functions that nest or never end</li>
 *   <li>Labels or block instructions outside a function</li>
 *   <li>Instructions between a block terminator and the next label</li>
 *   <li>A second memory model</li>
 * </ul>
 */
public final class ModuleLoadException extends RuntimeException
{
    public ModuleLoadException(String message) {
        super(message);
    }
}
