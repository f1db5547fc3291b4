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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Collector of recoverable problems, found while reading or writing PDS4 labels.
 * Every problem is logged once at <code>WARNING</code> level and stored in this object,
 * so that the caller can analyse them after the operation.
 */
public final class Pds4Warnings {
    private static final System.Logger LOG = System.getLogger(Pds4Warnings.class.getName());

    private final List<String> messages = new ArrayList<>();

    public void warn(String format, Object... args) {
        Objects.requireNonNull(format, "Null format");
        final String message = args.length == 0 ? format : String.format(Locale.US, format, args);
        LOG.log(System.Logger.Level.WARNING, message);
        messages.add(message);
    }

    public List<String> messages() {
        return Collections.unmodifiableList(messages);
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }

    public boolean contains(String fragment) {
        Objects.requireNonNull(fragment, "Null fragment");
        return messages.stream().anyMatch(m -> m.contains(fragment));
    }

    @Override
    public String toString() {
        return messages.size() + " warnings" + (messages.isEmpty() ? "" : ": " + String.join("; ", messages));
    }
}
