@NullMarked
package io.github.joke.mismatch.ty;

import org.jspecify.annotations.NullMarked;
