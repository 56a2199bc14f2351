package io.github.joke.mismatch.ty;

import lombok.Value;

/** Identity of a nominal type. {@code name} is the display name, {@code path} the qualified one. */
@Value
public class AdtItem {
    String path;
    String name;

    public static AdtItem of(String path) {
        int idx = path.lastIndexOf("::");
        return new AdtItem(path, idx < 0 ? path : path.substring(idx + 2));
    }
}
