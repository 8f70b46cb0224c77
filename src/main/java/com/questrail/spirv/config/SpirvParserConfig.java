package com.questrail.spirv.config;

import com.questrail.spirv.grammar.GrammarTable;
import com.questrail.spirv.grammar.JsonGrammarTable;
import com.questrail.spirv.internal.time.SystemWallClock;
import com.questrail.spirv.internal.time.WallClock;
import com.questrail.spirv.observability.NullObservabilitySink;
import com.questrail.spirv.observability.SpirvParseObservabilitySink;

import java.util.Objects;

/**
 * Aggregated configuration for a {@link com.questrail.spirv.codec.SpirvBinaryParser}.
 *
 * @param grammar           opcode and operand-kind tables
 * @param observabilitySink receives one event per parse
 * @param clock             timestamps observability events
 * @param strictSchemaWord  reject modules whose reserved header word is not zero;
 *                          off by default, where the word is read but not checked
 */
public record SpirvParserConfig(
    GrammarTable grammar,
    SpirvParseObservabilitySink observabilitySink,
    WallClock clock,
    boolean strictSchemaWord
) {
    public SpirvParserConfig {
        Objects.requireNonNull(grammar, "grammar");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        Objects.requireNonNull(clock, "clock");
    }

    /**
     * Bundled core grammar, no observability, lenient header.
     */
    public static SpirvParserConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private GrammarTable grammar;
        private SpirvParseObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private WallClock clock = SystemWallClock.INSTANCE;
        private boolean strictSchemaWord = false;

        public Builder withGrammar(GrammarTable grammar) {
            this.grammar = grammar;
            return this;
        }

        public Builder withObservabilitySink(SpirvParseObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public Builder withClock(WallClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withStrictSchemaWord(boolean strictSchemaWord) {
            this.strictSchemaWord = strictSchemaWord;
            return this;
        }

        public SpirvParserConfig build() {
            GrammarTable g = (grammar != null) ? grammar : JsonGrammarTable.bundled();
            return new SpirvParserConfig(g, observabilitySink, clock, strictSchemaWord);
        }
    }
}
