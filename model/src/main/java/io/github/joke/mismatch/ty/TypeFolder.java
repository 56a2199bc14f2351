package io.github.joke.mismatch.ty;

/**
 * Rewrites a type tree. The default implementation rebuilds every node from its folded children,
 * so implementations only override the cases they replace and delegate the rest to
 * {@link Ty#superFoldWith(TypeFolder)}.
 */
public interface TypeFolder {

    default Ty foldTy(Ty ty) {
        return ty.superFoldWith(this);
    }
}
