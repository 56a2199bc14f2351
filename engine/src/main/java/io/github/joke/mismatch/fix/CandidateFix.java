package io.github.joke.mismatch.fix;

import io.github.joke.mismatch.coercion.DerefRefPath;
import io.github.joke.mismatch.ty.Ty;
import java.util.Objects;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.jspecify.annotations.Nullable;

/**
 * One way to reconcile a type mismatch. Which payload fields are set depends on {@link #getKind()};
 * turning the descriptor into a source edit is left to the caller.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CandidateFix {
    FixKind kind;
    @Nullable ConversionTrait trait;
    @Nullable Ty targetTy;
    @Nullable Ty errTy;
    @Nullable DerefRefPath path;
    @Nullable String name;

    public static CandidateFix asCast(Ty target) {
        return new CandidateFix(FixKind.AS_CAST, null, target, null, null, null);
    }

    public static CandidateFix convertVia(ConversionTrait trait, Ty target) {
        return new CandidateFix(FixKind.CONVERT_VIA, trait, target, null, null, null);
    }

    public static CandidateFix convertVia(ConversionTrait trait, Ty target, Ty errTy) {
        return new CandidateFix(FixKind.CONVERT_VIA, trait, target, errTy, null, null);
    }

    /** {@code okTy} is the conversion target, {@code errTy} the error half of the expected {@code Result}. */
    public static CandidateFix convertAndUnpackVia(ConversionTrait trait, Ty okTy, Ty errTy) {
        return new CandidateFix(FixKind.CONVERT_AND_UNPACK_VIA, trait, okTy, errTy, null, null);
    }

    public static CandidateFix changeRefToMutable() {
        return new CandidateFix(FixKind.CHANGE_REF_TO_MUTABLE, null, null, null, null, null);
    }

    public static CandidateFix toImmutableStr() {
        return new CandidateFix(FixKind.TO_IMMUTABLE_STR, null, null, null, null, null);
    }

    public static CandidateFix toMutableStr() {
        return new CandidateFix(FixKind.TO_MUTABLE_STR, null, null, null, null, null);
    }

    public static CandidateFix derefRefBridge(Ty target, DerefRefPath path) {
        return new CandidateFix(FixKind.DEREF_REF_BRIDGE, null, target, null, path, null);
    }

    public static CandidateFix changeReturnType(String function, Ty ty) {
        return new CandidateFix(FixKind.CHANGE_RETURN_TYPE, null, ty, null, null, function);
    }

    public static CandidateFix changeLetDeclType(String binding, Ty ty) {
        return new CandidateFix(FixKind.CHANGE_LET_DECL_TYPE, null, ty, null, null, binding);
    }

    /** Title shown to the user when the fix is offered. */
    public String getText() {
        switch (kind) {
            case AS_CAST:
                return "Add safe cast to `" + targetTy + "`";
            case CONVERT_VIA:
                return "Convert to `" + targetTy + "` using `" + traitName() + "` trait"
                        + (errTy != null ? " and unwrap" : "");
            case CONVERT_AND_UNPACK_VIA:
                return "Convert to `" + targetTy + "` using `" + traitName() + "` trait";
            case CHANGE_REF_TO_MUTABLE:
                return "Change reference to mutable";
            case TO_IMMUTABLE_STR:
                return "Convert to `&str` using `as_str` method";
            case TO_MUTABLE_STR:
                return "Convert to `&mut str` using `as_mut_str` method";
            case DEREF_REF_BRIDGE:
                return "Convert to `" + targetTy + "` using dereferences and/or references";
            case CHANGE_RETURN_TYPE:
                return "Change return type of function `" + name + "` to `" + targetTy + "`";
            case CHANGE_LET_DECL_TYPE:
                return "Change type of `" + name + "` to `" + targetTy + "`";
            default:
                throw new IllegalStateException("Unknown fix kind: " + kind);
        }
    }

    private String traitName() {
        return Objects.requireNonNull(trait, "trait").getTraitName();
    }

    @Override
    public String toString() {
        return trait == null ? kind.name() : kind + "(" + trait + ")";
    }
}
