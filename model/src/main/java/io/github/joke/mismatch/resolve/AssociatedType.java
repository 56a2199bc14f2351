package io.github.joke.mismatch.resolve;

import lombok.Value;

@Value
public class AssociatedType {
    TraitItem owner;
    String name;
}
