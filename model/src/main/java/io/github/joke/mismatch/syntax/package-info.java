@NullMarked
package io.github.joke.mismatch.syntax;

import org.jspecify.annotations.NullMarked;
