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

import org.jetbrains.annotations.NotNull;

/**
 * {@code TreePrinter} prints a tree of text items to a sink, decorated with ruled lines like the UNIX
 * {@code tree} command does. The tree is not built in memory: the caller opens and closes nodes in
 * depth-first order, and output is appended to the sink as soon as it is known.
 * <pre>
 *     final StringBuilder sb = new StringBuilder(".\n");
 *     final TreePrinter&lt;StringBuilder&gt; printer = TreePrinters.newInstance(sb);
 *     printer.openNode(new ItemStyle(false), "foo");
 *     printer.openNode(new ItemStyle(true), "bar");
 *     printer.closeNode();
 *     printer.closeNode();
 *     printer.openNode(new ItemStyle(true), "baz");
 *     printer.finish();
 *     // .
 *     // |-- foo
 *     // |   `-- bar
 *     // `-- baz
 * </pre>
 * A printer is not thread-safe.
 *
 * @param <A> type of the sink
 * @see TreePrinterConfig
 */
public interface TreePrinter<A extends Appendable> {

    /**
     * Opens a child node of the most recently opened node which is not closed yet, or a top-level node.
     * Content may consist of several lines, it is written immediately.
     *
     * @throws SinkWriteException if the sink fails
     */
    void openNode(@NotNull ItemStyle style, @NotNull CharSequence content);

    /**
     * Opens a node like {@linkplain #openNode(ItemStyle, CharSequence)} does, but with content to be
     * appended to the returned {@linkplain Appendable} piece by piece. Appending several pieces gives the
     * same output as the content concatenated. The returned {@code Appendable} is valid until the next
     * node is opened or closed. Its methods throw {@linkplain java.io.IOException} if the sink fails.
     *
     * @throws SinkWriteException if the sink fails
     */
    @NotNull
    Appendable openNode(@NotNull ItemStyle style);

    /**
     * Closes the most recently opened node.
     *
     * @throws ExtraNodeCloseException if there are no open nodes
     * @throws SinkWriteException      if the sink fails
     */
    void closeNode();

    /**
     * @return number of open nodes
     */
    int getDepth();

    @NotNull
    TreePrinterConfig getConfig();

    /**
     * Closes all open nodes, most recently opened first, and returns the sink. The printer can't be used
     * afterwards.
     *
     * @throws SinkWriteException if the sink fails
     */
    @NotNull
    A finish();
}
