package io.nosqlbench.streamconvert.split;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.nosqlbench.streamconvert.IntegrityException;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;

/// Incremental structural tokenizer that finds the boundaries of top-level JSON values in a
/// byte stream without parsing them.
///
/// ## Structure tracking
///
/// The scanner keeps only a stack of open brackets and the in-string / escape state. That is
/// enough to know where a value ends:
///
/// - brackets inside strings are ignored,
/// - `\"` does not end a string but `\\"` does,
/// - strings may span lines,
/// - a bare scalar (`42`, `true`, `null`) ends at whitespace, `,`, or a bracket.
///
/// Whatever lies between the boundaries is not validated. A value such as `{"a": tru}` is returned
/// as-is and rejected later by the record parser as a single bad record.
///
/// ## Source layouts
///
/// - [SourceFormat#JSON_ARRAY]: the elements of the single top-level array, with the separating
///   commas and the closing bracket checked.
/// - [SourceFormat#JSON_LINES]: every non-blank line is one record. A line that is not
///   structurally one complete value (an unclosed bracket, a stray closer, two values) is still
///   returned as a record, with [#valueProblem()] saying what is wrong with it. Only a last line
///   cut off by the end of the input inside a string or a bracket is a structural error.
/// - [SourceFormat#JSON_STREAM]: every whitespace separated top-level value, so pretty-printed
///   multi-line records work.
///
/// [SourceFormat#AUTO] picks between array and lines from the first non-whitespace byte. A leading
/// UTF-8 byte order mark is skipped.
///
/// ## Usage
///
/// ```java
/// try (JsonValueScanner scanner = new JsonValueScanner(in, SourceFormat.AUTO)) {
///     while (scanner.next()) {
///         consume(scanner.valueBuffer(), scanner.valueLength(), scanner.valueOffset());
///     }
/// }
/// ```
///
/// The value buffer is reused; its contents are only valid until the next call to [#next()].
/// Structural errors are reported as [IntegrityException] with the byte offset of the problem.
/// For a value cut off by the end of the input, that is the offset where the value started.
public final class JsonValueScanner implements Closeable {

    private static final int READ_BUFFER = 64 * 1024;
    private static final int EOF = -1;

    private enum Phase {
        START,
        ARRAY_FIRST,
        ARRAY_NEXT,
        LINES,
        STREAM,
        END
    }

    private final InputStream in;
    private final SourceFormat requested;
    private final byte[] buffer = new byte[READ_BUFFER];
    private int pos;
    private int limit;
    private long consumed;

    private Phase phase = Phase.START;
    private SourceFormat format;

    private byte[] value = new byte[4096];
    private int valueLength;
    private long valueOffset;
    private String valueProblem;
    private byte[] openers = new byte[64];

    public JsonValueScanner(InputStream in, SourceFormat requested) {
        this.in = in;
        this.requested = requested;
    }

    /// Advances to the next top-level value.
    ///
    /// @return false once the input is exhausted
    /// @throws IntegrityException if the input is structurally broken at this point
    public boolean next() throws IOException, IntegrityException {
        while (true) {
            switch (phase) {
                case START -> start();
                case ARRAY_FIRST -> {
                    int c = skipWhitespace();
                    if (c == ']') {
                        read();
                        finishArray();
                        return false;
                    }
                    if (c == EOF) {
                        throw new IntegrityException("missing closing ']' of the top-level array", consumed);
                    }
                    readValue();
                    phase = Phase.ARRAY_NEXT;
                    return true;
                }
                case ARRAY_NEXT -> {
                    int c = skipWhitespace();
                    if (c == ']') {
                        read();
                        finishArray();
                        return false;
                    }
                    if (c == EOF) {
                        throw new IntegrityException("missing closing ']' of the top-level array", consumed);
                    }
                    if (c != ',') {
                        throw new IntegrityException("expected ',' or ']' between array elements but found "
                            + describe(c), consumed);
                    }
                    read();
                    int after = skipWhitespace();
                    if (after == EOF) {
                        throw new IntegrityException("missing closing ']' of the top-level array", consumed);
                    }
                    if (after == ']' || after == ',') {
                        throw new IntegrityException("expected an array element but found " + describe(after), consumed);
                    }
                    readValue();
                    return true;
                }
                case LINES -> {
                    int c = skipWhitespace();
                    if (c == EOF) {
                        phase = Phase.END;
                        return false;
                    }
                    readLine();
                    return true;
                }
                case STREAM -> {
                    int c = skipWhitespace();
                    if (c == EOF) {
                        phase = Phase.END;
                        return false;
                    }
                    readValue();
                    return true;
                }
                case END -> {
                    return false;
                }
            }
        }
    }

    /// The source layout in effect. Detection happens on the first call to [#next()]; before
    /// that an [SourceFormat#AUTO] scanner reports [SourceFormat#AUTO].
    public SourceFormat format() {
        return format != null ? format : requested;
    }

    public byte[] valueBuffer() {
        return value;
    }

    public int valueLength() {
        return valueLength;
    }

    /// Why the current JSON-lines record is not a single well-formed value, or null when it is.
    /// Always null outside [SourceFormat#JSON_LINES].
    public String valueProblem() {
        return valueProblem;
    }

    /// Byte offset of the current value's first byte in the input, counting a skipped BOM.
    public long valueOffset() {
        return valueOffset;
    }

    /// Byte offset just past the current value.
    public long valueEndOffset() {
        return valueOffset + valueLength;
    }

    /// Number of input bytes consumed so far.
    public long position() {
        return consumed;
    }

    @Override
    public void close() throws IOException {
        in.close();
    }

    private void start() throws IOException, IntegrityException {
        skipBom();
        int c = skipWhitespace();
        if (c == EOF) {
            format = requested == SourceFormat.AUTO ? SourceFormat.JSON_LINES : requested;
            phase = Phase.END;
            return;
        }
        format = switch (requested) {
            case AUTO -> c == '[' ? SourceFormat.JSON_ARRAY : SourceFormat.JSON_LINES;
            case JSON_ARRAY, JSON_LINES, JSON_STREAM -> requested;
        };
        if (format == SourceFormat.JSON_ARRAY) {
            if (c != '[') {
                throw new IntegrityException("expected '[' to open a JSON array but found " + describe(c), consumed);
            }
            read();
            phase = Phase.ARRAY_FIRST;
        } else {
            phase = format == SourceFormat.JSON_STREAM ? Phase.STREAM : Phase.LINES;
        }
    }

    private void finishArray() throws IOException, IntegrityException {
        int c = skipWhitespace();
        if (c != EOF) {
            throw new IntegrityException("unexpected content after the top-level array: " + describe(c), consumed);
        }
        phase = Phase.END;
    }

    private void skipBom() throws IOException {
        if (fill(3) >= 3
            && (buffer[pos] & 0xFF) == 0xEF
            && (buffer[pos + 1] & 0xFF) == 0xBB
            && (buffer[pos + 2] & 0xFF) == 0xBF) {
            pos += 3;
            consumed += 3;
        }
    }

    /// Reads one complete value starting at the current (non-whitespace) byte into the value buffer.
    private void readValue() throws IOException, IntegrityException {
        valueLength = 0;
        valueOffset = consumed;
        valueProblem = null;
        int c = peek();
        switch (c) {
            case '{', '[' -> readContainer();
            case '"' -> {
                append(read());
                readStringBody();
            }
            case '}', ']' -> throw new IntegrityException("unbalanced closing " + describe(c), consumed);
            case ',' -> throw new IntegrityException("unexpected ',' where a value was expected", consumed);
            default -> readScalar();
        }
    }

    /// Reads the rest of the current line into the value buffer, checking it with the same
    /// structural rules [#readValue()] applies, so that a line without a problem can be copied
    /// into a chunk array verbatim.
    private void readLine() throws IOException, IntegrityException {
        valueLength = 0;
        valueOffset = consumed;
        valueProblem = null;
        int depth = 0;
        int values = 0;
        boolean inString = false;
        boolean escaped = false;
        boolean inScalar = false;
        boolean terminated = false;
        while (true) {
            int c = read();
            if (c == EOF) {
                break;
            }
            if (c == '\n') {
                terminated = true;
                break;
            }
            append(c);
            if (valueProblem != null) {
                continue;
            }
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (isWhitespace(c)) {
                inScalar = false;
                continue;
            }
            switch (c) {
                case '"' -> {
                    if (depth == 0) {
                        values++;
                        inScalar = false;
                    }
                    inString = true;
                }
                case '{', '[' -> {
                    if (depth == 0) {
                        values++;
                        inScalar = false;
                    }
                    if (depth == openers.length) {
                        openers = Arrays.copyOf(openers, depth * 2);
                    }
                    openers[depth++] = (byte) c;
                }
                case '}', ']' -> {
                    byte expected = (byte) (c == '}' ? '{' : '[');
                    if (depth == 0 || openers[depth - 1] != expected) {
                        valueProblem = "unbalanced closing " + describe(c) + " at column " + valueLength;
                    } else {
                        depth--;
                    }
                }
                case ',' -> {
                    if (depth == 0) {
                        valueProblem = "unexpected ',' at column " + valueLength;
                    }
                }
                default -> {
                    if (depth == 0 && !inScalar) {
                        values++;
                        inScalar = true;
                    }
                }
            }
            if (values > 1 && valueProblem == null) {
                valueProblem = "more than one value on the line";
            }
        }
        while (valueLength > 0 && isWhitespace(value[valueLength - 1])) {
            valueLength--;
        }
        if (valueProblem != null) {
            return;
        }
        if (inString || depth > 0) {
            String what = inString ? "inside a string" : "with " + depth + " unclosed bracket(s)";
            if (!terminated) {
                throw new IntegrityException("truncated value: input ended " + what, valueOffset);
            }
            valueProblem = "line ends " + what;
        }
    }

    private void readContainer() throws IOException, IntegrityException {
        int depth = 0;
        while (true) {
            int c = read();
            if (c == EOF) {
                throw new IntegrityException("truncated value: input ended with " + depth + " unclosed bracket(s)",
                    valueOffset);
            }
            append(c);
            switch (c) {
                case '"' -> readStringBody();
                case '{', '[' -> {
                    if (depth == openers.length) {
                        openers = Arrays.copyOf(openers, depth * 2);
                    }
                    openers[depth++] = (byte) c;
                }
                case '}', ']' -> {
                    byte expected = (byte) (c == '}' ? '{' : '[');
                    if (depth == 0 || openers[depth - 1] != expected) {
                        throw new IntegrityException("unbalanced closing " + describe(c), consumed - 1);
                    }
                    depth--;
                    if (depth == 0) {
                        return;
                    }
                }
                default -> {
                }
            }
        }
    }

    /// Consumes through the closing quote of a string whose opening quote was already appended.
    private void readStringBody() throws IOException, IntegrityException {
        boolean escaped = false;
        while (true) {
            int c = read();
            if (c == EOF) {
                throw new IntegrityException("truncated value: input ended inside a string", valueOffset);
            }
            append(c);
            if (escaped) {
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (c == '"') {
                return;
            }
        }
    }

    private void readScalar() throws IOException {
        while (true) {
            int c = peek();
            if (c == EOF || isWhitespace(c) || c == ',' || c == ']' || c == '}' || c == '[' || c == '{') {
                return;
            }
            append(read());
        }
    }

    private void append(int c) {
        if (valueLength == value.length) {
            value = Arrays.copyOf(value, value.length * 2);
        }
        value[valueLength++] = (byte) c;
    }

    private int skipWhitespace() throws IOException {
        while (true) {
            int c = peek();
            if (c == EOF || !isWhitespace(c)) {
                return c;
            }
            read();
        }
    }

    private static boolean isWhitespace(int c) {
        return c == ' ' || c == '\n' || c == '\r' || c == '\t';
    }

    private int peek() throws IOException {
        if (pos == limit && fill(1) == 0) {
            return EOF;
        }
        return buffer[pos] & 0xFF;
    }

    private int read() throws IOException {
        if (pos == limit && fill(1) == 0) {
            return EOF;
        }
        consumed++;
        return buffer[pos++] & 0xFF;
    }

    /// Ensures at least `wanted` bytes are buffered when the input has them.
    /// @return the number of buffered bytes
    private int fill(int wanted) throws IOException {
        if (limit - pos >= wanted) {
            return limit - pos;
        }
        if (pos > 0) {
            System.arraycopy(buffer, pos, buffer, 0, limit - pos);
            limit -= pos;
            pos = 0;
        }
        while (limit < wanted) {
            int n = in.read(buffer, limit, buffer.length - limit);
            if (n < 0) {
                break;
            }
            limit += n;
        }
        return limit - pos;
    }

    private static String describe(int c) {
        if (c == EOF) {
            return "end of input";
        }
        if (c >= 0x20 && c < 0x7F) {
            return "'" + (char) c + "'";
        }
        return String.format("byte 0x%02X", c);
    }
}
