@NullMarked
package io.github.joke.mismatch.di;

import org.jspecify.annotations.NullMarked;
