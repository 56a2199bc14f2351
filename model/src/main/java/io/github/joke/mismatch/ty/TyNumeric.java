package io.github.joke.mismatch.ty;

import java.util.EnumMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

public final class TyNumeric extends Ty {

    private static final Map<Kind, TyNumeric> BY_KIND = new EnumMap<>(Kind.class);

    static {
        for (Kind kind : Kind.values()) {
            BY_KIND.put(kind, new TyNumeric(kind));
        }
    }

    public static final TyNumeric I8 = of(Kind.I8);
    public static final TyNumeric I16 = of(Kind.I16);
    public static final TyNumeric I32 = of(Kind.I32);
    public static final TyNumeric I64 = of(Kind.I64);
    public static final TyNumeric U8 = of(Kind.U8);
    public static final TyNumeric U16 = of(Kind.U16);
    public static final TyNumeric U32 = of(Kind.U32);
    public static final TyNumeric U64 = of(Kind.U64);
    public static final TyNumeric USIZE = of(Kind.USIZE);
    public static final TyNumeric F32 = of(Kind.F32);
    public static final TyNumeric F64 = of(Kind.F64);

    private final Kind kind;

    private TyNumeric(Kind kind) {
        this.kind = kind;
    }

    public static TyNumeric of(Kind kind) {
        return BY_KIND.get(kind);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isFloat() {
        return kind.isFloat();
    }

    @Override
    public Ty superFoldWith(TypeFolder folder) {
        return this;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        return o instanceof TyNumeric && ((TyNumeric) o).kind == kind;
    }

    @Override
    public int hashCode() {
        return kind.hashCode();
    }

    public enum Kind {
        I8("i8"),
        I16("i16"),
        I32("i32"),
        I64("i64"),
        I128("i128"),
        ISIZE("isize"),
        U8("u8"),
        U16("u16"),
        U32("u32"),
        U64("u64"),
        U128("u128"),
        USIZE("usize"),
        F32("f32"),
        F64("f64");

        private final String name;

        Kind(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }

        public boolean isFloat() {
            return this == F32 || this == F64;
        }
    }
}
