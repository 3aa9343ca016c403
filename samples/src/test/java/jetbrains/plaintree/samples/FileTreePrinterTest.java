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

import jetbrains.plaintree.edge.StandardEdgeConfig;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;

public class FileTreePrinterTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void emptyDirectory() throws IOException {
        final File root = folder.getRoot();
        final String out = new FileTreePrinter(StandardEdgeConfig.ASCII).print(root.toPath(), new StringBuilder()).toString();
        Assert.assertEquals(root + "\n\n0 directories, 0 files\n", out);
    }

    @Test
    public void nestedDirectories() throws IOException {
        final File root = folder.getRoot();
        folder.newFolder("a", "d");
        Assert.assertTrue(new File(folder.getRoot(), "a/b.txt").createNewFile());
        folder.newFile("c.txt");
        final String out = new FileTreePrinter(StandardEdgeConfig.ASCII).print(root.toPath(), new StringBuilder()).toString();
        Assert.assertEquals(root + "\n" +
            "|-- a\n" +
            "|   |-- b.txt\n" +
            "|   `-- d\n" +
            "`-- c.txt\n" +
            "\n" +
            "2 directories, 2 files\n", out);
    }

    @Test
    public void unicodeEdges() throws IOException {
        final File root = folder.getRoot();
        folder.newFolder("x");
        Assert.assertTrue(new File(folder.getRoot(), "x/y").createNewFile());
        final String out = new FileTreePrinter(StandardEdgeConfig.UNICODE_SINGLE_WIDTH).print(root.toPath(), new StringBuilder()).toString();
        Assert.assertEquals(root + "\n" +
            "└── x\n" +
            "    └── y\n" +
            "\n" +
            "1 directory, 1 file\n", out);
    }
}
