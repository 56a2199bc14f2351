package io.github.joke.mismatch.testing;

import static io.github.joke.mismatch.testing.StdItems.BOX_ITEM;
import static io.github.joke.mismatch.testing.StdItems.PARSE_INT_ERROR;
import static io.github.joke.mismatch.testing.StdItems.STRING;
import static io.github.joke.mismatch.testing.StdItems.box;
import static io.github.joke.mismatch.ty.TyReference.ref;
import static io.github.joke.mismatch.ty.TyReference.refMut;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.joke.mismatch.resolve.AssociatedType;
import io.github.joke.mismatch.resolve.ProjectionResult;
import io.github.joke.mismatch.resolve.TraitRef;
import io.github.joke.mismatch.ty.AdtItem;
import io.github.joke.mismatch.ty.Ty;
import io.github.joke.mismatch.ty.TyAdt;
import io.github.joke.mismatch.ty.TyNumeric;
import io.github.joke.mismatch.ty.TyStr;
import java.util.Objects;
import org.junit.jupiter.api.Test;

class InMemoryTraitOracleTest {

    private final InMemoryTraitOracle oracle = StdItems.stdlib().build();

    @Test
    void coercionSequenceStripsReferencesThenFollowsDeref() {
        assertThat(oracle.coercionSequence(refMut(ref(STRING))))
                .containsExactly(refMut(ref(STRING)), ref(STRING), STRING, TyStr.INSTANCE);
    }

    @Test
    void coercionSequenceOfPlainTypeIsJustTheType() {
        assertThat(oracle.coercionSequence(TyNumeric.I32)).containsExactly(TyNumeric.I32);
    }

    @Test
    void selectsOnlyExactImplementations() {
        assertThat(oracle.canSelect(new TraitRef(TyNumeric.I64, StdItems.FROM.withSubst(TyNumeric.I32))))
                .isTrue();
        assertThat(oracle.canSelect(new TraitRef(TyNumeric.I32, StdItems.FROM.withSubst(TyNumeric.I64))))
                .isFalse();
    }

    @Test
    void canSelectWithDerefFollowsCoercionSequence() {
        TraitRef toString = new TraitRef(ref(ref(TyStr.INSTANCE)), StdItems.TO_STRING.bound());

        assertThat(oracle.canSelect(toString)).isFalse();
        assertThat(oracle.canSelectWithDeref(toString)).isTrue();
    }

    @Test
    void projectsBoundAssociatedType() {
        AssociatedType err = Objects.requireNonNull(StdItems.FROM_STR.findAssociatedType("Err"));

        ProjectionResult result =
                oracle.selectProjectionStrict(new TraitRef(TyNumeric.U8, StdItems.FROM_STR.bound()), err);

        assertThat(result.ok()).isEqualTo(PARSE_INT_ERROR);
    }

    @Test
    void reportsMissingAndAmbiguousImplementations() {
        AssociatedType error = Objects.requireNonNull(StdItems.TRY_FROM.findAssociatedType("Error"));
        InMemoryTraitOracle twice = StdItems.stdlib()
                .impl(ImplDef.of(StdItems.TRY_FROM, TyNumeric.U8, TyNumeric.I32).bind("Error", PARSE_INT_ERROR))
                .impl(StdItems.TRY_FROM, TyNumeric.U16, TyNumeric.I32)
                .build();

        assertThat(twice.selectProjectionStrict(
                        new TraitRef(TyNumeric.U8, StdItems.TRY_FROM.withSubst(TyNumeric.I32)), error)
                .getStatus())
                .isEqualTo(ProjectionResult.Status.AMBIGUOUS);
        assertThat(twice.selectProjectionStrict(
                        new TraitRef(TyNumeric.U16, StdItems.TRY_FROM.withSubst(TyNumeric.I32)), error)
                .getStatus())
                .isEqualTo(ProjectionResult.Status.NO_BINDING);
        assertThat(twice.selectProjectionStrict(
                        new TraitRef(TyNumeric.U64, StdItems.TRY_FROM.withSubst(TyNumeric.I32)), error)
                .getStatus())
                .isEqualTo(ProjectionResult.Status.NO_IMPL);
    }

    @Test
    void rejectsDerefCycles() {
        Ty wrapper = TyAdt.of(AdtItem.of("app::Wrapper"));
        InMemoryTraitOracle.Builder builder = StdItems.stdlib().deref(wrapper, box(wrapper));

        assertThatThrownBy(() -> builder.deref(box(wrapper), wrapper))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cycle");
    }

    @Test
    void rejectsSecondDerefTarget() {
        InMemoryTraitOracle.Builder builder = StdItems.stdlib();

        assertThatThrownBy(() -> builder.deref(STRING, TyNumeric.U8))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("already implements Deref");
    }

    @Test
    void builtOracleIsUnaffectedByLaterRegistrations() {
        Ty boxed = TyAdt.of(BOX_ITEM, TyNumeric.I32);
        InMemoryTraitOracle.Builder builder = StdItems.stdlib();
        InMemoryTraitOracle before = builder.build();

        builder.deref(boxed, TyNumeric.I32);

        assertThat(before.coercionSequence(boxed)).containsExactly(boxed);
        assertThat(builder.build().coercionSequence(boxed)).containsExactly(boxed, TyNumeric.I32);
    }
}
