package io.github.joke.mismatch.fix;

/** Standard conversion traits a candidate fix can go through. */
public enum ConversionTrait {
    FROM("From"),
    TRY_FROM("TryFrom"),
    FROM_STR("FromStr"),
    TO_OWNED("ToOwned"),
    TO_STRING("ToString"),
    BORROW("Borrow"),
    BORROW_MUT("BorrowMut"),
    AS_REF("AsRef"),
    AS_MUT("AsMut");

    private final String traitName;

    ConversionTrait(String traitName) {
        this.traitName = traitName;
    }

    public String getTraitName() {
        return traitName;
    }
}
