package com.questrail.spirv.codec.impl;

import com.questrail.spirv.codec.WordDecodeException;
import com.questrail.spirv.codec.WordDecodeException.Reason;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.util.ByteProcessor;

import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * WordCursor
 * -----------------------------------------------------------------------------
 * Forward-only reader of little-endian 32-bit words over a complete binary.
 *
 * <h2>Word window</h2>
 * <p>{@link #setLimit(int)} opens a window of at most {@code n} further words.
 * While the window is open every read is charged against it, and a read that
 * would cross it fails with {@link Reason#LIMIT_REACHED} without consuming
 * anything. The parser uses the window to confine operand decoding to the
 * current instruction and to detect words left over after the grammar is
 * satisfied.</p>
 *
 * <h2>Netty containment rule</h2>
 * <p>The backing {@link ByteBuf} never leaves this class. {@link #close()}
 * releases it.</p>
 *
 * <p>Not thread-safe; one cursor belongs to one parse.</p>
 */
final class WordCursor implements AutoCloseable
{
    static final int WORD_BYTES = 4;

    private static final int NO_LIMIT = -1;

    private final ByteBuf buffer;

    /** Words left in the current window, or {@link #NO_LIMIT}. */
    private int limit = NO_LIMIT;

    WordCursor(byte[] binary)
    {
        this.buffer = Unpooled.wrappedBuffer(binary);
    }

    /**
     * Reads the next word.
     *
     * @throws WordDecodeException {@link Reason#LIMIT_REACHED} if the window is
     *         drained, {@link Reason#STREAM_EXPECTED} if fewer than four bytes remain
     */
    int nextWord() throws WordDecodeException
    {
        require(1);
        charge(1);
        return buffer.readIntLE();
    }

    /**
     * Reads exactly {@code n} words. Nothing is consumed when fewer are available.
     */
    int[] nextWords(int n) throws WordDecodeException
    {
        if (n < 0) {
            throw new IllegalArgumentException("word count must not be negative (was " + n + ")");
        }
        require(n);
        charge(n);
        final int[] words = new int[n];
        for (int i = 0; i < n; i++) {
            words[i] = buffer.readIntLE();
        }
        return words;
    }

    /**
     * Reads an identifier reference. Encoded exactly like {@link #nextWord()}.
     */
    int nextIdentifier() throws WordDecodeException
    {
        return nextWord();
    }

    /**
     * Reads a two-word literal, low-order word first.
     */
    long nextInt64() throws WordDecodeException
    {
        final int[] words = nextWords(2);
        return (words[0] & 0xFFFF_FFFFL) | ((long) words[1] << 32);
    }

    /**
     * Reads a NUL-terminated UTF-8 string, consuming every word up to and
     * including the one that holds the terminator.
     */
    String nextString() throws WordDecodeException
    {
        final int start = buffer.readerIndex();

        int scanWords = buffer.readableBytes() / WORD_BYTES;
        if (limit != NO_LIMIT) {
            scanWords = Math.min(scanWords, limit);
        }

        final int nul = scanWords == 0
                ? -1
                : buffer.forEachByte(start, scanWords * WORD_BYTES, ByteProcessor.FIND_NUL);
        if (nul < 0) {
            throw new WordDecodeException(Reason.STRING_UNTERMINATED, start,
                    "missing NUL terminator in string literal");
        }

        final String value;
        try {
            value = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(buffer.nioBuffer(start, nul - start))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new WordDecodeException(Reason.STRING_INVALID, start,
                    "string literal is not valid UTF-8");
        }

        final int words = (nul - start) / WORD_BYTES + 1;
        charge(words);
        buffer.skipBytes(words * WORD_BYTES);
        return value;
    }

    /**
     * Current position in words from the start of the binary.
     */
    int offset()
    {
        return buffer.readerIndex() / WORD_BYTES;
    }

    /**
     * Current position in bytes from the start of the binary.
     */
    int byteOffset()
    {
        return buffer.readerIndex();
    }

    /**
     * Complete words left in the binary, ignoring any window.
     */
    int remainingWords()
    {
        return buffer.readableBytes() / WORD_BYTES;
    }

    boolean hasWord()
    {
        return buffer.readableBytes() >= WORD_BYTES;
    }

    /**
     * True when one to three trailing bytes remain: a truncated word.
     */
    boolean hasPartialWord()
    {
        final int readable = buffer.readableBytes();
        return readable > 0 && readable < WORD_BYTES;
    }

    /**
     * Opens a window of at most {@code words} further words.
     */
    void setLimit(int words)
    {
        if (words < 0) {
            throw new IllegalArgumentException("limit must not be negative (was " + words + ")");
        }
        this.limit = words;
    }

    void clearLimit()
    {
        this.limit = NO_LIMIT;
    }

    /**
     * True when a window is open and fully consumed.
     */
    boolean limitReached()
    {
        return limit == 0;
    }

    /**
     * Words left in the open window; {@link #remainingWords()} when none is open.
     */
    int limitRemaining()
    {
        return limit == NO_LIMIT ? remainingWords() : limit;
    }

    @Override
    public void close()
    {
        buffer.release();
    }

    private void require(int words) throws WordDecodeException
    {
        if (limit != NO_LIMIT && words > limit) {
            throw new WordDecodeException(Reason.LIMIT_REACHED, buffer.readerIndex(),
                    "instruction has " + limit + " word(s) left, " + words + " needed");
        }
        if (buffer.readableBytes() < words * WORD_BYTES) {
            throw new WordDecodeException(Reason.STREAM_EXPECTED, buffer.readerIndex(),
                    "binary has " + buffer.readableBytes() + " byte(s) left, "
                            + (words * WORD_BYTES) + " needed");
        }
    }

    private void charge(int words)
    {
        if (limit != NO_LIMIT) {
            limit -= words;
        }
    }
}
