@NullMarked
package io.github.joke.mismatch.conversion;

import org.jspecify.annotations.NullMarked;
