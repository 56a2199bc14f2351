@NullMarked
package io.github.joke.mismatch.coercion;

import org.jspecify.annotations.NullMarked;
