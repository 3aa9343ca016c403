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

import jetbrains.plaintree.AbstractConfig;
import jetbrains.plaintree.ConfigurationStrategy;
import jetbrains.plaintree.PlainTreeException;
import jetbrains.plaintree.edge.StandardEdgeConfig;
import jetbrains.plaintree.util.Pair;
import org.jetbrains.annotations.NotNull;

/**
 * Specifies settings of {@linkplain TreePrinter}. Default settings are specified by {@linkplain #DEFAULT}
 * which is immutable. A {@code TreePrinterConfig} created by the no-arg constructor reads settings from
 * system properties, e.g. {@code -Dplaintree.edge=unicode}.
 * <pre>
 *     final TreePrinter&lt;StringBuilder&gt; printer = TreePrinters.newInstance(new StringBuilder(),
 *         new TreePrinterConfig().setEmitTrailingWhitespace(true));
 * </pre>
 * The printer reads its settings once, on creation.
 */
@SuppressWarnings({"WeakerAccess", "AutoBoxing", "AutoUnboxing"})
public class TreePrinterConfig extends AbstractConfig {

    public static final TreePrinterConfig DEFAULT = new TreePrinterConfig(ConfigurationStrategy.IGNORE) {
        @Override
        public TreePrinterConfig setMutable(boolean isMutable) {
            if (!this.isMutable() && isMutable) {
                throw new PlainTreeException("Can't make TreePrinterConfig.DEFAULT mutable");
            }
            return super.setMutable(isMutable);
        }
    }.setMutable(false);

    /**
     * If is set to {@code true}, an empty line of an item gets full paddings of all depths. Otherwise,
     * an empty line ends right after the last visible ruled line. Default value is {@code false}.
     */
    public static final String EMIT_TRAILING_WHITESPACE = "plaintree.emitTrailingWhitespace";

    /**
     * If is set to {@code true}, closing a node terminates its last line with a line feed. Otherwise,
     * the line feed is written only if something follows, so the tree doesn't end with a line feed.
     * Default value is {@code true}.
     */
    public static final String EMIT_TRAILING_NEWLINE = "plaintree.emitTrailingNewline";

    /**
     * Name of the {@linkplain StandardEdgeConfig} used by {@linkplain #getItemStyle(boolean)}: "ascii",
     * "unicode" or "unicode-wide". Default value is "ascii".
     */
    public static final String EDGE = "plaintree.edge";

    public TreePrinterConfig() {
        this(ConfigurationStrategy.SYSTEM_PROPERTY);
    }

    @SuppressWarnings({"rawtypes", "unchecked"})
    public TreePrinterConfig(@NotNull final ConfigurationStrategy strategy) {
        super(new Pair[]{
            new Pair(EMIT_TRAILING_WHITESPACE, false),
            new Pair(EMIT_TRAILING_NEWLINE, true),
            new Pair(EDGE, StandardEdgeConfig.ASCII.getName())
        }, strategy);
    }

    @Override
    public TreePrinterConfig setSetting(@NotNull final String key, @NotNull final Object value) {
        if (EDGE.equals(key)) {
            // fail fast on unknown names
            StandardEdgeConfig.forName(value.toString());
        }
        return (TreePrinterConfig) super.setSetting(key, value);
    }

    @Override
    public TreePrinterConfig setMutable(final boolean isMutable) {
        return (TreePrinterConfig) super.setMutable(isMutable);
    }

    public boolean getEmitTrailingWhitespace() {
        return (Boolean) getSetting(EMIT_TRAILING_WHITESPACE);
    }

    public TreePrinterConfig setEmitTrailingWhitespace(final boolean emit) {
        return setSetting(EMIT_TRAILING_WHITESPACE, emit);
    }

    public boolean getEmitTrailingNewline() {
        return (Boolean) getSetting(EMIT_TRAILING_NEWLINE);
    }

    public TreePrinterConfig setEmitTrailingNewline(final boolean emit) {
        return setSetting(EMIT_TRAILING_NEWLINE, emit);
    }

    @NotNull
    public StandardEdgeConfig getEdge() {
        return StandardEdgeConfig.forName((String) getSetting(EDGE));
    }

    public TreePrinterConfig setEdge(@NotNull final StandardEdgeConfig edge) {
        return setSetting(EDGE, edge.getName());
    }

    /**
     * @return style of an item drawn with the configured {@linkplain #getEdge() edge}
     */
    @NotNull
    public ItemStyle getItemStyle(final boolean lastChild) {
        return new ItemStyle(lastChild, getEdge());
    }
}
