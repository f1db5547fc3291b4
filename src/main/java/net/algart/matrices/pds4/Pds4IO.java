/*
 * The MIT License (MIT)
 *
 * Copyright (c) 2023-2025 Daniel Alievsky, AlgART Laboratory (http://algart.net)
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package net.algart.matrices.pds4;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

public sealed abstract class Pds4IO implements Closeable permits Pds4Reader, Pds4Writer {
    static final System.Logger LOG = System.getLogger(Pds4IO.class.getName());
    static final boolean LOGGABLE_DEBUG = LOG.isLoggable(System.Logger.Level.DEBUG);

    final Path labelFile;
    final Pds4Warnings warnings = new Pds4Warnings();
    final Object fileLock = new Object();

    Pds4ImageFile imageFile = null;

    Pds4IO(Path labelFile) {
        this.labelFile = Objects.requireNonNull(labelFile, "Null label file");
    }

    public Path labelFile() {
        return labelFile;
    }

    /**
     * Returns all recoverable problems, found while reading or writing the label.
     */
    public Pds4Warnings warnings() {
        return warnings;
    }

    public long imageFileLength() throws IOException {
        synchronized (fileLock) {
            return imageFile == null ? 0 : imageFile.fileLength();
        }
    }

    @Override
    public void close() throws IOException {
        synchronized (fileLock) {
            if (imageFile != null) {
                imageFile.close();
            }
        }
    }
}
