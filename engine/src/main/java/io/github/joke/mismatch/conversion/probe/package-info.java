@NullMarked
package io.github.joke.mismatch.conversion.probe;

import org.jspecify.annotations.NullMarked;
