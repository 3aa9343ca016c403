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

import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

public class LineIteratorTest {

    @Test
    public void empty() {
        Assert.assertFalse(new LineIterator("").hasNext());
    }

    @Test
    public void singleLine() {
        Assert.assertEquals(Arrays.asList(new Line("foo", true)), collect("foo"));
    }

    @Test
    public void trailingLineFeed() {
        Assert.assertEquals(Arrays.asList(new Line("foo", false), new Line("", true)), collect("foo\n"));
    }

    @Test
    public void singleLineFeed() {
        Assert.assertEquals(Arrays.asList(new Line("", false), new Line("", true)), collect("\n"));
    }

    @Test
    public void consecutiveLineFeeds() {
        Assert.assertEquals(Arrays.asList(
            new Line("baz", false),
            new Line("", false),
            new Line("baz2", true)), collect("baz\n\nbaz2"));
    }

    @Test
    public void carriageReturnIsContent() {
        Assert.assertEquals(Arrays.asList(new Line("a\r", false), new Line("b", true)), collect("a\r\nb"));
    }

    @Test
    public void restoreSource() {
        final String[] sources = {"", "\n", "\n\n", "a", "a\n", "a\n\n", "\na", "a\nb\n\nc", "\n\nx\n"};
        for (final String source : sources) {
            final StringBuilder restored = new StringBuilder();
            int count = 0;
            for (final Line line : LineIterator.lines(source)) {
                if (count++ > 0) {
                    restored.append('\n');
                }
                restored.append(line.getContent());
            }
            Assert.assertEquals(source, restored.toString());
        }
    }

    @Test
    public void onlyLastLineIsMarked() {
        final List<Line> lines = collect("1\n2\n3\n4");
        Assert.assertEquals(4, lines.size());
        for (int i = 0; i < lines.size(); ++i) {
            Assert.assertEquals(i == lines.size() - 1, lines.get(i).isLast());
        }
    }

    @Test
    public void subRange() {
        final List<Line> lines = new ArrayList<>();
        final Iterator<Line> it = new LineIterator("xxa\nbyy", 2, 5);
        while (it.hasNext()) {
            lines.add(it.next());
        }
        Assert.assertEquals(Arrays.asList(new Line("a", false), new Line("b", true)), lines);
    }

    @Test(expected = NoSuchElementException.class)
    public void exhausted() {
        final Iterator<Line> it = new LineIterator("foo");
        it.next();
        it.next();
    }

    @Test
    public void iterableRestarts() {
        final Iterable<Line> lines = LineIterator.lines("a\nb");
        Assert.assertEquals(collect(lines), collect(lines));
    }

    private static List<Line> collect(final String text) {
        return collect(LineIterator.lines(text));
    }

    private static List<Line> collect(final Iterable<Line> lines) {
        final List<Line> result = new ArrayList<>();
        for (final Line line : lines) {
            result.add(line);
        }
        return result;
    }
}
