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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.junit.Assert;
import org.junit.Test;

import static jetbrains.plaintree.edge.PrefixPart.PADDING;
import static jetbrains.plaintree.edge.PrefixPart.PREFIX;

public class UnicodeEdgeConfigBuilderTest {

    private static final EdgeStyle NARROW = EdgeStyle.solid(EdgeWidth.NARROW);
    private static final EdgeStyle BOLD = EdgeStyle.solid(EdgeWidth.BOLD);
    private static final EdgeStyle DOUBLE = EdgeStyle.doubleLine();

    @Test
    public void defaultsMatchStandardConfigs() {
        assertSameEdges(StandardEdgeConfig.UNICODE_SINGLE_WIDTH, new UnicodeEdgeConfigBuilder().build());
        assertSameEdges(StandardEdgeConfig.UNICODE_DOUBLE_WIDTH, new UnicodeEdgeConfigBuilder(AmbiWidth.DOUBLE).build());
    }

    @Test
    public void boldWithDashedHorizontal() {
        final UnicodeEdgeConfig edge = new UnicodeEdgeConfigBuilder()
            .vertical(BOLD)
            .horizontal(EdgeStyle.dashed(EdgeWidth.BOLD, DashLevel.TRIPLE))
            .build();
        Assert.assertEquals("┣┅┅", edge.getEdge(false, true, PREFIX));
        Assert.assertEquals("┗┅┅", edge.getEdge(true, true, PREFIX));
        Assert.assertEquals("┃", edge.getEdge(false, false, PREFIX));
        Assert.assertEquals("", edge.getEdge(true, false, PREFIX));
    }

    @Test
    public void dashedVerticalContinuation() {
        final UnicodeEdgeConfig edge = new UnicodeEdgeConfigBuilder()
            .verticalForward(EdgeStyle.dashed(EdgeWidth.NARROW, DashLevel.QUADRUPLE))
            .build();
        Assert.assertEquals('├', edge.getPrecedingFirstFirst());
        Assert.assertEquals('┊', edge.getPrecedingSucceedingFirst());
    }

    @Test
    public void roundCorner() {
        final UnicodeEdgeConfig edge = new UnicodeEdgeConfigBuilder().corner(CornerStyle.ROUND).build();
        Assert.assertEquals("╰──", edge.getEdge(true, true, PREFIX));
        Assert.assertEquals("├──", edge.getEdge(false, true, PREFIX));
    }

    @Test
    public void doubleLines() {
        final UnicodeEdgeConfig edge = new UnicodeEdgeConfigBuilder(AmbiWidth.DOUBLE)
            .vertical(DOUBLE)
            .horizontal(DOUBLE)
            .build();
        Assert.assertEquals("╠═", edge.getEdge(false, true, PREFIX));
        Assert.assertEquals("╚═", edge.getEdge(true, true, PREFIX));
        Assert.assertEquals("║", edge.getEdge(false, false, PREFIX));
        Assert.assertEquals("     ", edge.getEdge(true, false, PADDING));
        Assert.assertEquals(AmbiWidth.DOUBLE, edge.getAmbiWidth());
    }

    @Test(expected = UnsupportedEdgeCombinationException.class)
    public void doubleBackwardWithDashedForward() {
        new UnicodeEdgeConfigBuilder()
            .verticalBackward(DOUBLE)
            .verticalForward(EdgeStyle.dashed(EdgeWidth.NARROW, DashLevel.DOUBLE))
            .build();
    }

    @Test(expected = UnsupportedEdgeCombinationException.class)
    public void dashedBackwardWithDoubleForward() {
        new UnicodeEdgeConfigBuilder()
            .verticalBackward(EdgeStyle.dashed(EdgeWidth.BOLD, DashLevel.TRIPLE))
            .verticalForward(DOUBLE)
            .build();
    }

    @Test
    public void roundCornerIsNarrowOnly() {
        Assert.assertNull(new UnicodeEdgeConfigBuilder().corner(CornerStyle.ROUND).horizontal(BOLD).tryBuild());
        Assert.assertNull(new UnicodeEdgeConfigBuilder().corner(CornerStyle.ROUND).vertical(DOUBLE).horizontal(DOUBLE).tryBuild());
    }

    @Test
    public void allCombinations() {
        int supported = 0;
        int total = 0;
        for (final AmbiWidth ambiWidth : AmbiWidth.values()) {
            for (final EdgeStyle backward : EdgeStyle.values()) {
                for (final EdgeStyle forward : EdgeStyle.values()) {
                    for (final EdgeStyle horizontal : EdgeStyle.values()) {
                        for (final CornerStyle corner : CornerStyle.values()) {
                            ++total;
                            final UnicodeEdgeConfigBuilder builder = new UnicodeEdgeConfigBuilder(ambiWidth)
                                .verticalBackward(backward)
                                .verticalForward(forward)
                                .horizontal(horizontal)
                                .corner(corner);
                            final UnicodeEdgeConfig edge = builder.tryBuild();
                            // dashes never decide if a junction exists
                            final UnicodeEdgeConfig solid = new UnicodeEdgeConfigBuilder(ambiWidth)
                                .verticalBackward(undashed(backward))
                                .verticalForward(undashed(forward))
                                .horizontal(undashed(horizontal))
                                .corner(corner)
                                .tryBuild();
                            Assert.assertEquals(solid == null, edge == null);
                            if (edge == null) {
                                assertBuildFails(builder);
                                continue;
                            }
                            ++supported;
                            assertDrawable(edge, ambiWidth);
                        }
                    }
                }
            }
        }
        Assert.assertEquals(2 * 9 * 9 * 9 * 2, total);
        Assert.assertTrue(supported > 0);
        Assert.assertTrue(supported < total);
    }

    @Test
    public void mixedDoubleAndDashedNeverBuilds() {
        for (final EdgeStyle style : EdgeStyle.values()) {
            if (!style.isDashed()) {
                continue;
            }
            Assert.assertNull(new UnicodeEdgeConfigBuilder().verticalBackward(DOUBLE).verticalForward(style).tryBuild());
            Assert.assertNull(new UnicodeEdgeConfigBuilder().verticalBackward(style).verticalForward(DOUBLE).tryBuild());
        }
    }

    @Test
    public void edgeStyles() {
        Assert.assertEquals(9, EdgeStyle.values().size());
        Assert.assertEquals(NARROW, EdgeStyle.solid(EdgeWidth.NARROW));
        Assert.assertTrue(NARROW.isSolid());
        Assert.assertTrue(DOUBLE.isDouble());
        Assert.assertNull(DOUBLE.getWidth());
        final EdgeStyle dashed = EdgeStyle.dashed(EdgeWidth.BOLD, DashLevel.DOUBLE);
        Assert.assertTrue(dashed.isDashed());
        Assert.assertFalse(dashed.isSolid());
        Assert.assertEquals(DashLevel.DOUBLE, dashed.getDashLevel());
        Assert.assertEquals("Dashed(BOLD, DOUBLE)", dashed.toString());
    }

    private static void assertBuildFails(@NotNull final UnicodeEdgeConfigBuilder builder) {
        try {
            builder.build();
            Assert.fail("UnsupportedEdgeCombinationException expected");
        } catch (UnsupportedEdgeCombinationException e) {
            Assert.assertTrue(e.getMessage().startsWith("No box drawing character"));
        }
    }

    private static void assertDrawable(@NotNull final UnicodeEdgeConfig edge, @NotNull final AmbiWidth ambiWidth) {
        final int prefixLength = ambiWidth == AmbiWidth.SINGLE ? 3 : 2;
        for (final boolean lastChild : new boolean[]{false, true}) {
            final String prefix = edge.getEdge(lastChild, true, PREFIX);
            Assert.assertEquals(prefixLength, prefix.length());
            for (int i = 0; i < prefix.length(); ++i) {
                Assert.assertTrue(isBoxDrawing(prefix.charAt(i)));
            }
        }
        Assert.assertTrue(isBoxDrawing(edge.getPrecedingSucceedingFirst()));
        Assert.assertFalse(edge.isPrefixWhitespace(false, false));
        Assert.assertTrue(edge.isPrefixWhitespace(true, false));
    }

    private static boolean isBoxDrawing(final char c) {
        return c >= '─' && c <= '╿';
    }

    private static EdgeStyle undashed(@NotNull final EdgeStyle style) {
        final EdgeWidth width = style.getWidth();
        return width == null ? style : EdgeStyle.solid(width);
    }

    private static void assertSameEdges(@NotNull final EdgeConfig expected, @Nullable final EdgeConfig actual) {
        Assert.assertNotNull(actual);
        for (final boolean lastChild : new boolean[]{false, true}) {
            for (final boolean firstLine : new boolean[]{false, true}) {
                for (final PrefixPart part : PrefixPart.values()) {
                    Assert.assertEquals(expected.getEdge(lastChild, firstLine, part), actual.getEdge(lastChild, firstLine, part));
                }
                Assert.assertEquals(expected.isPrefixWhitespace(lastChild, firstLine), actual.isPrefixWhitespace(lastChild, firstLine));
            }
        }
    }
}
