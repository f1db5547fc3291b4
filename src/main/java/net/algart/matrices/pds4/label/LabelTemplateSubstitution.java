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

package net.algart.matrices.pds4.label;

import net.algart.matrices.pds4.Pds4Warnings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Replaces <code>${NAME}</code> placeholders in a label template by the values of
 * <code>VAR_NAME</code> variables.
 *
 * <p>For every variable, both <code>${NAME}</code> (replaced by the value as-is) and its lower-case
 * spelling <code>${name}</code> (replaced by the lower-case value) are substituted.
 * <code>${TITLE}</code>, if there is no <code>VAR_TITLE</code> variable, is replaced by the default title
 * with a warning. Placeholders, which remain after all substitutions, are left as-is with a warning.
 */
public final class LabelTemplateSubstitution {
    public static final String VARIABLE_PREFIX = "VAR_";
    public static final String TITLE_PLACEHOLDER = "${TITLE}";

    private final Map<String, String> variables = new LinkedHashMap<>();
    private final String defaultTitle;
    private final Pds4Warnings warnings;

    /**
     * Creates the substitution engine.
     *
     * @param options      key/value pairs; only keys starting with <code>VAR_</code> (in any case) are used.
     * @param defaultTitle value for <code>${TITLE}</code>, when there is no <code>VAR_TITLE</code>.
     * @param warnings     collector of warnings.
     */
    public LabelTemplateSubstitution(Map<String, String> options, String defaultTitle, Pds4Warnings warnings) {
        Objects.requireNonNull(options, "Null options");
        this.defaultTitle = Objects.requireNonNull(defaultTitle, "Null defaultTitle");
        this.warnings = Objects.requireNonNull(warnings, "Null warnings");
        options.forEach((key, value) -> {
            if (isVariable(key)) {
                variables.put(key.substring(VARIABLE_PREFIX.length()), Objects.requireNonNull(value,
                        "Null value of " + key));
            }
        });
    }

    public static boolean isVariable(String key) {
        return key != null && key.length() > VARIABLE_PREFIX.length()
                && key.regionMatches(true, 0, VARIABLE_PREFIX, 0, VARIABLE_PREFIX.length());
    }

    public Map<String, String> variables() {
        return Collections.unmodifiableMap(variables);
    }

    /**
     * Recursively substitutes variables in all text nodes of the subtree, including attribute values.
     *
     * @param tree label tree.
     * @param node root of the processed subtree.
     */
    public void substitute(LabelTree tree, int node) {
        Objects.requireNonNull(tree, "Null tree");
        if (tree.kind(node) == LabelNodeKind.TEXT) {
            final String text = tree.text(node);
            if (text.contains("${")) {
                tree.setText(node, substitute(text));
            }
            return;
        }
        final List<Integer> list = new ArrayList<>(tree.children(node));
        for (int child : list) {
            substitute(tree, child);
        }
    }

    public String substitute(String text) {
        Objects.requireNonNull(text, "Null text");
        String result = text;
        if (result.contains(TITLE_PLACEHOLDER)) {
            final String title = titleVariable();
            if (title == null) {
                warnings.warn("VAR_TITLE not defined. Using %s by default", defaultTitle);
            }
            result = result.replace(TITLE_PLACEHOLDER, title == null ? defaultTitle : title);
        }
        for (Map.Entry<String, String> e : variables.entrySet()) {
            final String name = e.getKey();
            final String value = e.getValue();
            result = result.replace("${" + name + "}", value);
            result = result.replace("${" + name.toLowerCase(Locale.ROOT) + "}", value.toLowerCase(Locale.ROOT));
        }
        if (result.contains("${")) {
            warnings.warn("%s could not be substituted", result);
        }
        return result;
    }

    private String titleVariable() {
        for (Map.Entry<String, String> e : variables.entrySet()) {
            if (e.getKey().equalsIgnoreCase("TITLE")) {
                return e.getValue();
            }
        }
        return null;
    }
}
