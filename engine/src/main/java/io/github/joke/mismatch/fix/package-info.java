@NullMarked
package io.github.joke.mismatch.fix;

import org.jspecify.annotations.NullMarked;
