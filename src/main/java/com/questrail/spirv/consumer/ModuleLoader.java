package com.questrail.spirv.consumer;

import com.questrail.spirv.model.BasicBlock;
import com.questrail.spirv.model.Instruction;
import com.questrail.spirv.model.ModuleHeader;
import com.questrail.spirv.model.SpirvFunction;
import com.questrail.spirv.model.SpirvModule;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * ModuleLoader
 * =============================================================================
 * {@link SpirvConsumer} that assembles the decoded stream into a
 * {@link SpirvModule}.
 *
 * <h2>Placement rules</h2>
 * <ul>
 *   <li>Outside a function, each instruction goes to its layout section;
 *       types, constants, global variables, {@code OpUndef} and line
 *       information go to the types/global-values section.</li>
 *   <li>{@code OpFunction} opens a function; {@code OpFunctionParameter} is
 *       accepted only before its first block.</li>
 *   <li>{@code OpLabel} opens a block; a terminator instruction closes it.</li>
 *   <li>{@code OpFunctionEnd} closes the function and must not appear inside
 *       an open block.</li>
 * </ul>
 *
 * <p>Violations end the parse with {@link ConsumerAction#fail(Throwable)}
 * carrying a {@link ModuleLoadException}. Operand-level consistency (id
 * references, types) is not checked.</p>
 *
 * <p>A loader may be reused for consecutive parses; {@link #initialize()}
 * discards any previous state.</p>
 */
public final class ModuleLoader implements SpirvConsumer
{
    private static final Set<String> DEBUG_OPS = Set.of(
            "OpSourceContinued", "OpSource", "OpSourceExtension",
            "OpString", "OpName", "OpMemberName", "OpModuleProcessed");

    private static final Set<String> ANNOTATION_OPS = Set.of(
            "OpDecorate", "OpMemberDecorate", "OpDecorationGroup",
            "OpGroupDecorate", "OpGroupMemberDecorate");

    private static final Set<String> GLOBAL_VALUE_OPS = Set.of(
            "OpVariable", "OpUndef", "OpLine", "OpNoLine");

    private static final Set<String> TERMINATOR_OPS = Set.of(
            "OpBranch", "OpBranchConditional", "OpSwitch", "OpReturn",
            "OpReturnValue", "OpKill", "OpUnreachable");

    private ModuleHeader header;
    private List<Instruction> capabilities;
    private List<Instruction> extensions;
    private List<Instruction> extInstImports;
    private Instruction memoryModel;
    private List<Instruction> entryPoints;
    private List<Instruction> executionModes;
    private List<Instruction> debugs;
    private List<Instruction> annotations;
    private List<Instruction> typesGlobalValues;
    private List<SpirvFunction> functions;

    // Function under construction, if any.
    private Instruction functionDefinition;
    private List<Instruction> parameters;
    private List<BasicBlock> blocks;

    // Block under construction, if any.
    private Instruction blockLabel;
    private List<Instruction> blockInstructions;

    private SpirvModule module;

    @Override
    public ConsumerAction initialize() {
        header = null;
        capabilities = new ArrayList<>();
        extensions = new ArrayList<>();
        extInstImports = new ArrayList<>();
        memoryModel = null;
        entryPoints = new ArrayList<>();
        executionModes = new ArrayList<>();
        debugs = new ArrayList<>();
        annotations = new ArrayList<>();
        typesGlobalValues = new ArrayList<>();
        functions = new ArrayList<>();
        functionDefinition = null;
        blockLabel = null;
        module = null;
        return ConsumerAction.proceed();
    }

    @Override
    public ConsumerAction consumeHeader(ModuleHeader header) {
        this.header = header;
        return ConsumerAction.proceed();
    }

    @Override
    public ConsumerAction consumeInstruction(Instruction instruction) {
        try {
            if (functionDefinition == null) {
                placeModuleLevel(instruction);
            } else {
                placeInFunction(instruction);
            }
            return ConsumerAction.proceed();
        } catch (ModuleLoadException e) {
            return ConsumerAction.fail(e);
        }
    }

    @Override
    public ConsumerAction finish() {
        if (functionDefinition != null) {
            return ConsumerAction.fail(new ModuleLoadException(
                    "Function %" + resultIdOf(functionDefinition) + " has no OpFunctionEnd"));
        }
        module = new SpirvModule(header, capabilities, extensions, extInstImports, memoryModel,
                entryPoints, executionModes, debugs, annotations, typesGlobalValues, functions);
        return ConsumerAction.proceed();
    }

    /**
     * Returns the module assembled by the last successful parse.
     *
     * @throws IllegalStateException if no parse has finished successfully
     */
    public SpirvModule module() {
        if (module == null) {
            throw new IllegalStateException("No module has been loaded");
        }
        return module;
    }

    // ========================================================================
    // Placement
    // ========================================================================

    private void placeModuleLevel(Instruction inst) {
        final String op = inst.opname();

        switch (op) {
            case "OpCapability" -> capabilities.add(inst);
            case "OpExtension" -> extensions.add(inst);
            case "OpExtInstImport" -> extInstImports.add(inst);
            case "OpMemoryModel" -> {
                if (memoryModel != null) {
                    throw new ModuleLoadException("Module declares more than one OpMemoryModel");
                }
                memoryModel = inst;
            }
            case "OpEntryPoint" -> entryPoints.add(inst);
            case "OpExecutionMode" -> executionModes.add(inst);
            case "OpFunction" -> {
                functionDefinition = inst;
                parameters = new ArrayList<>();
                blocks = new ArrayList<>();
            }
            default -> {
                if (DEBUG_OPS.contains(op)) {
                    debugs.add(inst);
                } else if (ANNOTATION_OPS.contains(op)) {
                    annotations.add(inst);
                } else if (isTypeOrGlobalValue(op)) {
                    typesGlobalValues.add(inst);
                } else {
                    throw new ModuleLoadException(op + " is not allowed outside a function");
                }
            }
        }
    }

    private void placeInFunction(Instruction inst) {
        final String op = inst.opname();

        switch (op) {
            case "OpFunction" -> throw new ModuleLoadException(
                    "Nested OpFunction inside function %" + resultIdOf(functionDefinition));
            case "OpFunctionParameter" -> {
                if (!blocks.isEmpty() || blockLabel != null) {
                    throw new ModuleLoadException("OpFunctionParameter after the first block");
                }
                parameters.add(inst);
            }
            case "OpLabel" -> {
                if (blockLabel != null) {
                    throw new ModuleLoadException(
                            "OpLabel %" + resultIdOf(inst) + " inside unterminated block %"
                                    + resultIdOf(blockLabel));
                }
                blockLabel = inst;
                blockInstructions = new ArrayList<>();
            }
            case "OpFunctionEnd" -> {
                if (blockLabel != null) {
                    throw new ModuleLoadException(
                            "OpFunctionEnd inside unterminated block %" + resultIdOf(blockLabel));
                }
                functions.add(new SpirvFunction(functionDefinition, parameters, blocks, inst));
                functionDefinition = null;
            }
            default -> {
                if (blockLabel == null) {
                    throw new ModuleLoadException(op + " outside a basic block");
                }
                blockInstructions.add(inst);
                if (TERMINATOR_OPS.contains(op)) {
                    blocks.add(new BasicBlock(blockLabel, blockInstructions));
                    blockLabel = null;
                }
            }
        }
    }

    private static boolean isTypeOrGlobalValue(String op) {
        return op.startsWith("OpType")
                || op.startsWith("OpConstant")
                || op.startsWith("OpSpecConstant")
                || GLOBAL_VALUE_OPS.contains(op);
    }

    private static String resultIdOf(Instruction inst) {
        return inst.resultId().isPresent()
                ? Integer.toUnsignedString(inst.resultId().getAsInt())
                : "?";
    }
}
