// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package shorthand.workbench;

import shorthand.abbrev.Expander;
import shorthand.abbrev.Expansion;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The state behind an interactive workbench: the most recent expansion and the markup that can be copied or
 * previewed.
 * <p>
 * A failed expansion clears the remembered markup, so stale output is never offered after an error.
 * <p>
 * Sessions are not thread-safe.
 */
public final class Session {
    /**
     * Expands {@code abbreviation} and makes it the current state of this session.
     */
    public Expansion update(final String abbreviation) {
        final var expansion = Expander.expand(abbreviation);
        if (expansion instanceof final Expansion.Success success) {
            lastHtml = success.html();
        } else {
            lastHtml = null;
        }
        return expansion;
    }

    /**
     * Retrieves the markup of the last expansion if it succeeded, or {@code null} otherwise.
     * <p>
     * This is what a copy action should copy.
     */
    public @Nullable String lastHtml() {
        return lastHtml;
    }

    /**
     * Retrieves the preview document for the last expansion, or {@code null} if it failed or there wasn't one.
     */
    public @Nullable String previewDocument() {
        final var html = lastHtml;
        return (html == null) ? null : PreviewDocument.wrap(html);
    }

    private @Nullable String lastHtml = null;
}
