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
package jetbrains.plaintree.util;

import org.jetbrains.annotations.NotNull;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazily splits text by line feeds ({@code '\n'}) into {@linkplain Line lines}. The last yielded line
 * is marked with {@linkplain Line#isLast()}. Joining the contents of all yielded lines with
 * {@code '\n'} gives the source text back, so text ending with a line feed yields an empty last line,
 * and empty text yields no lines at all.
 *
 * <p>Line contents are {@linkplain CharSequence#subSequence(int, int) sub-sequences} of the source
 * text, nothing is copied.
 */
public class LineIterator implements Iterator<Line> {

    private static final char LINE_FEED = '\n';

    @NotNull
    private final CharSequence text;
    private final int end;
    private int start;

    public LineIterator(@NotNull final CharSequence text) {
        this(text, 0, text.length());
    }

    public LineIterator(@NotNull final CharSequence text, final int start, final int end) {
        if (start < 0 || start > end || end > text.length()) {
            throw new IndexOutOfBoundsException("start " + start + ", end " + end + ", length " + text.length());
        }
        this.text = text;
        this.end = end;
        // empty text has no lines
        this.start = start == end ? -1 : start;
    }

    public static Iterable<Line> lines(@NotNull final CharSequence text) {
        return new Iterable<Line>() {
            @NotNull
            @Override
            public Iterator<Line> iterator() {
                return new LineIterator(text);
            }
        };
    }

    @Override
    public boolean hasNext() {
        return start >= 0;
    }

    @Override
    public Line next() {
        if (start < 0) {
            throw new NoSuchElementException();
        }
        final int lineStart = start;
        int i = lineStart;
        while (i < end && text.charAt(i) != LINE_FEED) {
            ++i;
        }
        final boolean last = i == end;
        start = last ? -1 : i + 1;
        return new Line(text.subSequence(lineStart, i), last);
    }
}
