package com.questrail.spirv.testing;

import static com.questrail.spirv.testing.SpirvBinaryBuilder.concat;
import static com.questrail.spirv.testing.SpirvBinaryBuilder.ints;
import static com.questrail.spirv.testing.SpirvBinaryBuilder.string;

/**
 * Hand-assembled modules shared by loader tests.
 */
public final class SampleModules
{
    private SampleModules() {}

    /**
     * Minimal fragment shader, in layout order:
     *
     * <pre>
     *          OpCapability Shader
     *     %1 = OpExtInstImport "GLSL.std.450"
     *          OpMemoryModel Logical GLSL450
     *          OpEntryPoint Fragment %4 "main"
     *          OpExecutionMode %4 OriginUpperLeft
     *          OpSource GLSL 450
     *          OpName %4 "main"
     *          OpDecorate %9 Location 0
     *     %2 = OpTypeVoid
     *     %3 = OpTypeFunction %2
     *     %4 = OpFunction %2 None %3
     *     %5 = OpLabel
     *          OpBranch %6
     *     %6 = OpLabel
     *          OpReturn
     *          OpFunctionEnd
     * </pre>
     */
    public static SpirvBinaryBuilder fragmentShader()
    {
        return SpirvBinaryBuilder.module()
                .inst(17, 1)
                .inst(11, concat(ints(1), string("GLSL.std.450")))
                .inst(14, 0, 1)
                .inst(15, concat(ints(4, 4), string("main")))
                .inst(16, 4, 7)
                .inst(3, 2, 450)
                .inst(5, concat(ints(4), string("main")))
                .inst(71, 9, 30, 0)
                .inst(19, 2)
                .inst(33, 3, 2)
                .inst(54, 2, 4, 0, 3)
                .inst(248, 5)
                .inst(249, 6)
                .inst(248, 6)
                .inst(253)
                .inst(56);
    }

    /** Instruction count of {@link #fragmentShader()}. */
    public static final int FRAGMENT_SHADER_INSTRUCTIONS = 16;
}
