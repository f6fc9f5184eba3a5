package io.luascript.standalone.hints;

import java.util.Objects;

/** One documentation suggestion returned by the hint service. */
public record DocHint(String title, String url, String snippet) {

    public DocHint {
        Objects.requireNonNull(title, "title must not be null");
        url = url == null ? "" : url;
        snippet = snippet == null ? "" : snippet;
    }
}
