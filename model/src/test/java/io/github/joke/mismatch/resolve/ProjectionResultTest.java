package io.github.joke.mismatch.resolve;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.joke.mismatch.ty.TyNumeric;
import org.junit.jupiter.api.Test;

class ProjectionResultTest {

    @Test
    void onlyOkCarriesAValue() {
        assertThat(ProjectionResult.ok(TyNumeric.U8).ok()).isEqualTo(TyNumeric.U8);
        assertThat(ProjectionResult.noImpl().ok()).isNull();
        assertThat(ProjectionResult.ambiguous().ok()).isNull();
        assertThat(ProjectionResult.noBinding().ok()).isNull();
    }

    @Test
    void failuresAreDistinguishable() {
        assertThat(ProjectionResult.noImpl().getStatus()).isEqualTo(ProjectionResult.Status.NO_IMPL);
        assertThat(ProjectionResult.noBinding().getStatus()).isEqualTo(ProjectionResult.Status.NO_BINDING);
        assertThat(ProjectionResult.ambiguous().isOk()).isFalse();
    }

    @Test
    void traitItemDerivesNameAndAssociatedTypes() {
        TraitItem tryFrom = TraitItem.of("core::convert::TryFrom", "Error");

        assertThat(tryFrom.getName()).isEqualTo("TryFrom");
        assertThat(tryFrom.findAssociatedType("Error")).isEqualTo(new AssociatedType(tryFrom, "Error"));
        assertThat(tryFrom.findAssociatedType("Err")).isNull();
    }
}
