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
package jetbrains.plaintree.edge;

import jetbrains.plaintree.InvalidSettingException;
import org.jetbrains.annotations.NotNull;
import org.junit.Assert;
import org.junit.Test;

import java.io.IOException;

import static jetbrains.plaintree.edge.PrefixPart.PADDING;
import static jetbrains.plaintree.edge.PrefixPart.PREFIX;

public class StandardEdgeConfigTest {

    @Test
    public void ascii() {
        // lastChild, firstLine, prefix, padding
        assertEdges(StandardEdgeConfig.ASCII, false, true, "|--", " ");
        assertEdges(StandardEdgeConfig.ASCII, true, true, "`--", " ");
        assertEdges(StandardEdgeConfig.ASCII, false, false, "|", "   ");
        assertEdges(StandardEdgeConfig.ASCII, true, false, "", "    ");
    }

    @Test
    public void unicodeSingleWidth() {
        assertEdges(StandardEdgeConfig.UNICODE_SINGLE_WIDTH, false, true, "├──", " ");
        assertEdges(StandardEdgeConfig.UNICODE_SINGLE_WIDTH, true, true, "└──", " ");
        assertEdges(StandardEdgeConfig.UNICODE_SINGLE_WIDTH, false, false, "│", "   ");
        assertEdges(StandardEdgeConfig.UNICODE_SINGLE_WIDTH, true, false, "", "    ");
    }

    @Test
    public void unicodeDoubleWidth() {
        assertEdges(StandardEdgeConfig.UNICODE_DOUBLE_WIDTH, false, true, "├─", " ");
        assertEdges(StandardEdgeConfig.UNICODE_DOUBLE_WIDTH, true, true, "└─", " ");
        assertEdges(StandardEdgeConfig.UNICODE_DOUBLE_WIDTH, false, false, "│", "   ");
        assertEdges(StandardEdgeConfig.UNICODE_DOUBLE_WIDTH, true, false, "", "     ");
    }

    @Test
    public void prefixWhitespace() {
        for (final StandardEdgeConfig edge : StandardEdgeConfig.values()) {
            for (final boolean lastChild : new boolean[]{false, true}) {
                for (final boolean firstLine : new boolean[]{false, true}) {
                    final String drawn = edge.getEdge(lastChild, firstLine, PREFIX) + edge.getEdge(lastChild, firstLine, PADDING);
                    Assert.assertEquals(drawn.trim().isEmpty(), edge.isPrefixWhitespace(lastChild, firstLine));
                }
            }
        }
    }

    @Test
    public void writeEdge() throws IOException {
        final StringBuilder sb = new StringBuilder();
        StandardEdgeConfig.ASCII.writeEdge(sb, false, true, PREFIX);
        StandardEdgeConfig.ASCII.writeEdge(sb, false, true, PADDING);
        Assert.assertEquals("|-- ", sb.toString());
    }

    @Test
    public void sameEdgesEachTime() {
        for (final StandardEdgeConfig edge : StandardEdgeConfig.values()) {
            for (final PrefixPart part : PrefixPart.values()) {
                Assert.assertEquals(edge.getEdge(true, true, part), edge.getEdge(true, true, part));
                Assert.assertEquals(edge.getEdge(false, false, part), edge.getEdge(false, false, part));
            }
        }
    }

    @Test
    public void forName() {
        Assert.assertSame(StandardEdgeConfig.ASCII, StandardEdgeConfig.forName("ascii"));
        Assert.assertSame(StandardEdgeConfig.UNICODE_SINGLE_WIDTH, StandardEdgeConfig.forName("Unicode"));
        Assert.assertSame(StandardEdgeConfig.UNICODE_DOUBLE_WIDTH, StandardEdgeConfig.forName(" unicode-wide "));
        for (final StandardEdgeConfig edge : StandardEdgeConfig.values()) {
            Assert.assertSame(edge, StandardEdgeConfig.forName(edge.getName()));
        }
    }

    @Test(expected = InvalidSettingException.class)
    public void forUnknownName() {
        StandardEdgeConfig.forName("utf-16");
    }

    private static void assertEdges(@NotNull final EdgeConfig edge,
                                    final boolean lastChild,
                                    final boolean firstLine,
                                    @NotNull final String prefix,
                                    @NotNull final String padding) {
        Assert.assertEquals(prefix, edge.getEdge(lastChild, firstLine, PREFIX));
        Assert.assertEquals(padding, edge.getEdge(lastChild, firstLine, PADDING));
    }
}
