package com.questrail.spirv.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * SpirvModule
 * -----------------------------------------------------------------------------
 * A decoded module arranged in the SPIR-V logical layout.
 *
 * <p>Sections, in layout order:</p>
 * <ol>
 *   <li>capabilities</li>
 *   <li>extensions</li>
 *   <li>extended instruction set imports</li>
 *   <li>memory model</li>
 *   <li>entry points</li>
 *   <li>execution modes</li>
 *   <li>debug instructions (sources, strings, names)</li>
 *   <li>annotations (decorations)</li>
 *   <li>types, constants and global variables</li>
 *   <li>functions</li>
 * </ol>
 */
public final class SpirvModule
{
    private final ModuleHeader header;
    private final List<Instruction> capabilities;
    private final List<Instruction> extensions;
    private final List<Instruction> extInstImports;
    private final Instruction memoryModel;
    private final List<Instruction> entryPoints;
    private final List<Instruction> executionModes;
    private final List<Instruction> debugs;
    private final List<Instruction> annotations;
    private final List<Instruction> typesGlobalValues;
    private final List<SpirvFunction> functions;

    public SpirvModule(ModuleHeader header,
                       List<Instruction> capabilities,
                       List<Instruction> extensions,
                       List<Instruction> extInstImports,
                       Instruction memoryModel,
                       List<Instruction> entryPoints,
                       List<Instruction> executionModes,
                       List<Instruction> debugs,
                       List<Instruction> annotations,
                       List<Instruction> typesGlobalValues,
                       List<SpirvFunction> functions) {

        this.header = Objects.requireNonNull(header, "header");
        this.capabilities = List.copyOf(capabilities);
        this.extensions = List.copyOf(extensions);
        this.extInstImports = List.copyOf(extInstImports);
        this.memoryModel = memoryModel;
        this.entryPoints = List.copyOf(entryPoints);
        this.executionModes = List.copyOf(executionModes);
        this.debugs = List.copyOf(debugs);
        this.annotations = List.copyOf(annotations);
        this.typesGlobalValues = List.copyOf(typesGlobalValues);
        this.functions = List.copyOf(functions);
    }

    public ModuleHeader header() {
        return header;
    }

    public List<Instruction> capabilities() {
        return capabilities;
    }

    public List<Instruction> extensions() {
        return extensions;
    }

    public List<Instruction> extInstImports() {
        return extInstImports;
    }

    public Optional<Instruction> memoryModel() {
        return Optional.ofNullable(memoryModel);
    }

    public List<Instruction> entryPoints() {
        return entryPoints;
    }

    public List<Instruction> executionModes() {
        return executionModes;
    }

    public List<Instruction> debugs() {
        return debugs;
    }

    public List<Instruction> annotations() {
        return annotations;
    }

    public List<Instruction> typesGlobalValues() {
        return typesGlobalValues;
    }

    public List<SpirvFunction> functions() {
        return functions;
    }

    /**
     * Every instruction of the module in layout order.
     */
    public List<Instruction> allInstructions() {
        List<Instruction> all = new ArrayList<>();
        all.addAll(capabilities);
        all.addAll(extensions);
        all.addAll(extInstImports);
        if (memoryModel != null) {
            all.add(memoryModel);
        }
        all.addAll(entryPoints);
        all.addAll(executionModes);
        all.addAll(debugs);
        all.addAll(annotations);
        all.addAll(typesGlobalValues);
        for (SpirvFunction function : functions) {
            all.add(function.definition());
            all.addAll(function.parameters());
            for (BasicBlock block : function.blocks()) {
                all.add(block.label());
                all.addAll(block.instructions());
            }
            all.add(function.end());
        }
        return all;
    }

    @Override
    public String toString() {
        return "SpirvModule[" +
                "header=" + header +
                ", capabilities=" + capabilities.size() +
                ", typesGlobalValues=" + typesGlobalValues.size() +
                ", functions=" + functions.size() +
                ']';
    }
}
