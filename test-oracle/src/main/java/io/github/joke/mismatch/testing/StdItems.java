package io.github.joke.mismatch.testing;

import static io.github.joke.mismatch.ty.TyReference.ref;

import io.github.joke.mismatch.resolve.KnownItems;
import io.github.joke.mismatch.resolve.TraitItem;
import io.github.joke.mismatch.ty.AdtItem;
import io.github.joke.mismatch.ty.Ty;
import io.github.joke.mismatch.ty.TyAdt;
import io.github.joke.mismatch.ty.TyBool;
import io.github.joke.mismatch.ty.TyChar;
import io.github.joke.mismatch.ty.TyNumeric;
import io.github.joke.mismatch.ty.TyStr;

/** A slice of {@code core}/{@code alloc}/{@code std} large enough for conversion scenarios. */
public final class StdItems {

    public static final AdtItem STRING_ITEM = AdtItem.of("alloc::string::String");
    public static final AdtItem RESULT_ITEM = AdtItem.of("core::result::Result");
    public static final AdtItem BOX_ITEM = AdtItem.of("alloc::boxed::Box");
    public static final AdtItem PARSE_INT_ERROR_ITEM = AdtItem.of("core::num::ParseIntError");
    public static final AdtItem PARSE_FLOAT_ERROR_ITEM = AdtItem.of("core::num::ParseFloatError");
    public static final AdtItem TRY_FROM_INT_ERROR_ITEM = AdtItem.of("core::num::TryFromIntError");

    public static final TraitItem FROM = TraitItem.of("core::convert::From");
    public static final TraitItem TRY_FROM = TraitItem.of("core::convert::TryFrom", "Error");
    public static final TraitItem FROM_STR = TraitItem.of("core::str::FromStr", "Err");
    public static final TraitItem TO_OWNED = TraitItem.of("alloc::borrow::ToOwned", "Owned");
    public static final TraitItem TO_STRING = TraitItem.of("alloc::string::ToString");
    public static final TraitItem BORROW = TraitItem.of("core::borrow::Borrow");
    public static final TraitItem BORROW_MUT = TraitItem.of("core::borrow::BorrowMut");
    public static final TraitItem AS_REF = TraitItem.of("core::convert::AsRef");
    public static final TraitItem AS_MUT = TraitItem.of("core::convert::AsMut");

    public static final Ty STRING = TyAdt.of(STRING_ITEM);
    public static final Ty PARSE_INT_ERROR = TyAdt.of(PARSE_INT_ERROR_ITEM);
    public static final Ty PARSE_FLOAT_ERROR = TyAdt.of(PARSE_FLOAT_ERROR_ITEM);
    public static final Ty TRY_FROM_INT_ERROR = TyAdt.of(TRY_FROM_INT_ERROR_ITEM);

    private StdItems() {}

    public static Ty result(Ty ok, Ty err) {
        return TyAdt.of(RESULT_ITEM, ok, err);
    }

    public static Ty box(Ty inner) {
        return TyAdt.of(BOX_ITEM, inner);
    }

    public static KnownItems knownItems() {
        return KnownItems.builder()
                .fromTrait(FROM)
                .tryFromTrait(TRY_FROM)
                .fromStrTrait(FROM_STR)
                .toOwnedTrait(TO_OWNED)
                .toStringTrait(TO_STRING)
                .borrowTrait(BORROW)
                .borrowMutTrait(BORROW_MUT)
                .asRefTrait(AS_REF)
                .asMutTrait(AS_MUT)
                .resultItem(RESULT_ITEM)
                .stringItem(STRING_ITEM)
                .build();
    }

    /** An oracle builder preloaded with the standard implementations the scenarios rely on. */
    public static InMemoryTraitOracle.Builder stdlib() {
        Ty str = TyStr.INSTANCE;
        InMemoryTraitOracle.Builder builder = InMemoryTraitOracle.builder(knownItems())
                .deref(STRING, str)
                .impl(FROM, STRING, ref(str))
                .impl(FROM, STRING, TyChar.INSTANCE)
                .impl(FROM, TyNumeric.U16, TyNumeric.U8)
                .impl(FROM, TyNumeric.U32, TyNumeric.U8)
                .impl(FROM, TyNumeric.I32, TyNumeric.U8)
                .impl(FROM, TyNumeric.I64, TyNumeric.I32)
                .impl(FROM, TyNumeric.F64, TyNumeric.I32)
                .impl(FROM, TyNumeric.F64, TyNumeric.F32)
                .impl(ImplDef.of(TRY_FROM, TyNumeric.U8, TyNumeric.I32).bind("Error", TRY_FROM_INT_ERROR))
                .impl(ImplDef.of(TRY_FROM, TyNumeric.I32, TyNumeric.I64).bind("Error", TRY_FROM_INT_ERROR))
                .impl(ImplDef.of(TO_OWNED, str).bind("Owned", STRING))
                .impl(ImplDef.of(TO_OWNED, STRING).bind("Owned", STRING))
                .impl(BORROW, STRING, str)
                .impl(BORROW_MUT, STRING, str)
                .impl(AS_REF, STRING, str)
                .impl(AS_REF, str, str)
                .impl(AS_MUT, STRING, str)
                .impl(AS_MUT, str, str);
        for (Ty integer : new Ty[] {TyNumeric.U8, TyNumeric.U32, TyNumeric.I32, TyNumeric.I64}) {
            builder.impl(ImplDef.of(FROM_STR, integer).bind("Err", PARSE_INT_ERROR));
        }
        for (Ty display : new Ty[] {str, STRING, TyNumeric.I32, TyNumeric.U8, TyNumeric.F64, TyBool.INSTANCE,
            TyChar.INSTANCE}) {
            builder.impl(TO_STRING, display);
        }
        return builder
                .impl(ImplDef.of(FROM_STR, TyNumeric.F64).bind("Err", PARSE_FLOAT_ERROR))
                .impl(ImplDef.of(FROM_STR, TyNumeric.F32).bind("Err", PARSE_FLOAT_ERROR));
    }
}
