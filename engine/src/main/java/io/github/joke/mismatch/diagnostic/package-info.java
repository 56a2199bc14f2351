@NullMarked
package io.github.joke.mismatch.diagnostic;

import org.jspecify.annotations.NullMarked;
