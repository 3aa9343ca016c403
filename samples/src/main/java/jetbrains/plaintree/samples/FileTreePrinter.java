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
package jetbrains.plaintree.samples;

import jetbrains.plaintree.edge.EdgeConfig;
import jetbrains.plaintree.edge.StandardEdgeConfig;
import jetbrains.plaintree.printer.ItemStyle;
import jetbrains.plaintree.printer.TreePrinter;
import jetbrains.plaintree.printer.TreePrinterConfig;
import jetbrains.plaintree.printer.TreePrinters;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * This example prints a directory like the UNIX {@code tree} command does:
 * <pre>
 *     FileTreePrinter &lt;directory&gt; [ascii|unicode|unicode-wide]
 * </pre>
 */
public class FileTreePrinter {

    private static final Logger logger = LoggerFactory.getLogger(FileTreePrinter.class);

    @NotNull
    private final EdgeConfig edge;
    private int directories;
    private int files;

    public FileTreePrinter(@NotNull final EdgeConfig edge) {
        this.edge = edge;
    }

    public static void main(String[] args) throws IOException {
        if (args.length == 0) {
            System.err.println("Usage: FileTreePrinter <directory> [ascii|unicode|unicode-wide]");
            return;
        }
        final EdgeConfig edge = args.length > 1 ?
            StandardEdgeConfig.forName(args[1]) : new TreePrinterConfig().getEdge();
        final StringBuilder out = new FileTreePrinter(edge).print(Paths.get(args[0]), new StringBuilder());
        System.out.print(out);
    }

    /**
     * Appends the tree of the directory and the summary line to {@code out}.
     */
    @NotNull
    public <A extends Appendable> A print(@NotNull final Path dir, @NotNull final A out) throws IOException {
        directories = 0;
        files = 0;
        out.append(dir.toString()).append('\n');
        final TreePrinter<A> printer = TreePrinters.newInstance(out, new TreePrinterConfig());
        printChildren(printer, dir);
        printer.finish();
        out.append('\n')
            .append(String.valueOf(directories)).append(directories == 1 ? " directory, " : " directories, ")
            .append(String.valueOf(files)).append(files == 1 ? " file" : " files")
            .append('\n');
        return out;
    }

    private void printChildren(@NotNull final TreePrinter<?> printer, @NotNull final Path dir) throws IOException {
        final List<Path> children = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (final Path child : stream) {
                children.add(child);
            }
        }
        Collections.sort(children);
        for (int i = 0; i < children.size(); ++i) {
            final Path child = children.get(i);
            printer.openNode(new ItemStyle(i == children.size() - 1, edge), child.getFileName().toString());
            if (Files.isDirectory(child)) {
                ++directories;
                try {
                    printChildren(printer, child);
                } catch (IOException e) {
                    logger.warn("Can't list directory " + child, e);
                    printer.openNode(new ItemStyle(true, edge), "[error opening dir]");
                    printer.closeNode();
                }
            } else {
                ++files;
            }
            printer.closeNode();
        }
    }
}
