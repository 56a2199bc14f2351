@NullMarked
package io.github.joke.mismatch.resolve;

import org.jspecify.annotations.NullMarked;
