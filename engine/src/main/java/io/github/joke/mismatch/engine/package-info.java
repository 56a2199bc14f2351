@NullMarked
package io.github.joke.mismatch.engine;

import org.jspecify.annotations.NullMarked;
