// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package shorthand.workbench;

/**
 * Builds the standalone HTML document used to preview expanded markup in isolation.
 */
public final class PreviewDocument {
    private PreviewDocument() {
    }

    /**
     * Returns a complete HTML5 document whose body contains {@code markup} verbatim.
     * <p>
     * The markup is inserted as is, without escaping: it is already serialized HTML.
     */
    public static String wrap(final String markup) {
        return prefix + markup + suffix;
    }

    private static final String prefix = """
        <!doctype html>
        <html lang="en">
          <head>
            <meta charset="utf-8" />
            <meta name="viewport" content="width=device-width, initial-scale=1.0" />
            <style>
              body { margin: 0; padding: 24px; font-family: sans-serif; line-height: 1.5; }
              ul, ol { padding-left: 1.5rem; }
              table { border-collapse: collapse; }
              td, th { border: 1px solid #cbd5f5; padding: 0.5rem; }
            </style>
          </head>
          <body>
        """;
    private static final String suffix = """

          </body>
        </html>""";
}
