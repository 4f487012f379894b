// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package shorthand.workbench;

import java.util.List;

/**
 * Example abbreviations offered to users who don't know the syntax yet.
 */
public final class Examples {
    private Examples() {
    }

    /**
     * Returns all examples, in the order they are presented.
     */
    public static List<String> all() {
        return examples;
    }

    private static final List<String> examples = List.of(
        "ul>li.item$*3",
        "nav>ul>li*3>a{Link $}",
        "section>h2{Hello}+p{Lorem ipsum dolor sit amet}",
        "form>label[for=email]{Email}+input#email[type=email]"
    );
}
