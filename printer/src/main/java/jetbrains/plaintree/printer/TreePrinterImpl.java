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
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

public class TreePrinterImpl<A extends Appendable> implements TreePrinter<A> {

    private static final Logger logger = LoggerFactory.getLogger(TreePrinterImpl.class);

    @NotNull
    private final A sink;
    @NotNull
    private final TreePrinterConfig config;
    private final boolean emitTrailingNewline;
    @NotNull
    private final List<ItemWriterState> states;
    @NotNull
    private final ItemWriter writer;
    // a top-level node was closed in the middle of a line which is not terminated yet
    private boolean lineFeedPending;
    // incremented on each open and close, invalidates appendables returned by openNode()
    private long generation;
    private boolean finished;

    public TreePrinterImpl(@NotNull final A sink, @NotNull final TreePrinterConfig config) {
        this.sink = sink;
        this.config = config;
        emitTrailingNewline = config.getEmitTrailingNewline();
        states = new ArrayList<>();
        writer = new ItemWriter(sink, states, config.getEmitTrailingWhitespace());
    }

    @Override
    public void openNode(@NotNull final ItemStyle style, @NotNull final CharSequence content) {
        openNode(style);
        try {
            writer.append(content);
        } catch (IOException e) {
            throw sinkFailed(e);
        }
    }

    @NotNull
    @Override
    public Appendable openNode(@NotNull final ItemStyle style) {
        checkNotFinished();
        ++generation;
        try {
            if (!states.isEmpty()) {
                writer.goToNextLine();
            } else if (lineFeedPending) {
                sink.append('\n');
            }
            lineFeedPending = false;
        } catch (IOException e) {
            throw sinkFailed(e);
        }
        states.add(new ItemWriterState(style));
        return new NodeContentWriter(generation);
    }

    @Override
    public void closeNode() {
        checkNotFinished();
        if (states.isEmpty()) {
            logger.debug("Attempt to close a node but there are no open nodes");
            throw new ExtraNodeCloseException();
        }
        ++generation;
        try {
            if (emitTrailingNewline) {
                writer.goToNextLine();
            } else if (states.size() == 1 && !writer.isAtLineHead()) {
                lineFeedPending = true;
            }
        } catch (IOException e) {
            throw sinkFailed(e);
        }
        states.remove(states.size() - 1);
    }

    @Override
    public int getDepth() {
        return states.size();
    }

    @NotNull
    @Override
    public TreePrinterConfig getConfig() {
        return config;
    }

    @NotNull
    @Override
    public A finish() {
        checkNotFinished();
        final int openNodes = states.size();
        if (openNodes > 0 && logger.isDebugEnabled()) {
            logger.debug("Closing " + openNodes + " open node(s) on finish");
        }
        for (int i = 0; i < openNodes; ++i) {
            closeNode();
        }
        assert states.isEmpty();
        finished = true;
        return sink;
    }

    private void checkNotFinished() {
        if (finished) {
            throw new IllegalStateException("Tree printer is already finished");
        }
    }

    private static SinkWriteException sinkFailed(@NotNull final IOException e) {
        logger.error("Failed to write tree to the sink", e);
        return new SinkWriteException(e);
    }

    private final class NodeContentWriter implements Appendable {

        private final long generation;

        private NodeContentWriter(final long generation) {
            this.generation = generation;
        }

        @Override
        public Appendable append(@Nullable final CharSequence csq) throws IOException {
            checkCurrent();
            writer.append(csq);
            return this;
        }

        @Override
        public Appendable append(@Nullable final CharSequence csq, final int start, final int end) throws IOException {
            checkCurrent();
            writer.append(csq, start, end);
            return this;
        }

        @Override
        public Appendable append(final char c) throws IOException {
            checkCurrent();
            writer.append(c);
            return this;
        }

        private void checkCurrent() {
            checkNotFinished();
            if (generation != TreePrinterImpl.this.generation) {
                throw new IllegalStateException("Node content can't be appended after another node is opened or closed");
            }
        }
    }
}
