/*
 * Copyright 2010 - 2023 JetBrains s.r.o.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package jetbrains.plaintree.printer;

import jetbrains.plaintree.util.Line;
import jetbrains.plaintree.util.LineIterator;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.util.Iterator;
import java.util.List;

/**
 * {@linkplain Appendable} writing the content of the innermost item of a stack of open items. Each
 * line of the content is preceded by the prefixes and paddings of all depths of the stack. The
 * stack is a list of {@linkplain ItemWriterState states}, the first one is a top-level item, and
 * the last one is the item being written. The writer modifies the states, but doesn't add or remove
 * them.
 * <pre>
 *     final StringBuilder sb = new StringBuilder();
 *     final List&lt;ItemWriterState&gt; states = new ArrayList&lt;&gt;();
 *     states.add(new ItemWriterState(true, StandardEdgeConfig.ASCII));
 *     new ItemWriter(sb, states).append("foo\n\nbar");
 *     // "`-- foo\n\n    bar"
 * </pre>
 * Drawing is deferred until line content is known: a line is written only if it has content or
 * is followed by a line feed, and an empty line ends right after its last visible ruled line unless
 * trailing whitespace is requested.
 */
public class ItemWriter implements Appendable {

    @NotNull
    private final Appendable out;
    @NotNull
    private final List<ItemWriterState> states;
    private final boolean emitTrailingWhitespace;

    public ItemWriter(@NotNull final Appendable out, @NotNull final List<ItemWriterState> states) {
        this(out, states, false);
    }

    public ItemWriter(@NotNull final Appendable out,
                      @NotNull final List<ItemWriterState> states,
                      final boolean emitTrailingWhitespace) {
        this.out = out;
        this.states = states;
        this.emitTrailingWhitespace = emitTrailingWhitespace;
    }

    @Override
    public ItemWriter append(@Nullable final CharSequence csq) throws IOException {
        final CharSequence text = csq == null ? "null" : csq;
        writeLines(new LineIterator(text));
        return this;
    }

    @Override
    public ItemWriter append(@Nullable final CharSequence csq, final int start, final int end) throws IOException {
        final CharSequence text = csq == null ? "null" : csq;
        writeLines(new LineIterator(text, start, end));
        return this;
    }

    @Override
    public ItemWriter append(final char c) throws IOException {
        return append(String.valueOf(c));
    }

    /**
     * @return {@code true} if nothing is written on the current line
     */
    public boolean isAtLineHead() {
        return states.isEmpty() || states.get(states.size() - 1).isAtLineHead();
    }

    /**
     * Terminates the current line unless nothing is written on it, so that following output starts on
     * a new line.
     */
    public void goToNextLine() throws IOException {
        if (!isAtLineHead()) {
            append('\n');
        }
        assert isAtLineHead();
    }

    private void writeLines(@NotNull final Iterator<Line> lines) throws IOException {
        while (lines.hasNext()) {
            final Line line = lines.next();
            final boolean last = line.isLast();
            // a trailing line feed doesn't start a line until its content arrives
            if (last && line.isEmpty()) {
                break;
            }
            writePrefixAndPadding(line.isEmpty());
            out.append(line.getContent());
            if (!last) {
                out.append('\n');
                resetLineState();
            }
        }
    }

    private void writePrefixAndPadding(final boolean lineIsEmpty) throws IOException {
        if (states.isEmpty()) {
            return;
        }
        final boolean emitLastPadding = emitTrailingWhitespace || !lineIsEmpty;
        final int lastSignificant;
        if (emitLastPadding) {
            lastSignificant = states.size() - 1;
        } else {
            lastSignificant = lastNonWhitespacePrefix();
            if (lastSignificant < 0) {
                return;
            }
        }
        for (int i = 0; i < lastSignificant; ++i) {
            final ItemWriterState state = states.get(i);
            if (state.getEdgeStatus() == LineEdgeStatus.LINE_START) {
                state.writePrefix(out);
            }
            if (state.getEdgeStatus() == LineEdgeStatus.PREFIX_EMITTED) {
                state.writePadding(out);
            }
            assert state.getEdgeStatus() == LineEdgeStatus.PADDING_EMITTED;
        }
        final ItemWriterState lastState = states.get(lastSignificant);
        if (lastState.getEdgeStatus() == LineEdgeStatus.LINE_START) {
            lastState.writePrefix(out);
        }
        if (emitLastPadding && lastState.getEdgeStatus() == LineEdgeStatus.PREFIX_EMITTED) {
            lastState.writePadding(out);
        }
    }

    private int lastNonWhitespacePrefix() {
        for (int i = states.size() - 1; i >= 0; --i) {
            if (!states.get(i).isPrefixWhitespace()) {
                return i;
            }
        }
        return -1;
    }

    private void resetLineState() {
        for (final ItemWriterState state : states) {
            state.resetLineState();
        }
    }
}
