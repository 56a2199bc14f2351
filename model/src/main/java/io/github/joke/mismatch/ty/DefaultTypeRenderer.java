package io.github.joke.mismatch.ty;

import static java.util.stream.Collectors.joining;

import java.util.Set;

/** Renders types in Rust surface syntax. */
public final class DefaultTypeRenderer implements TypeRenderer {

    public static final DefaultTypeRenderer INSTANCE = new DefaultTypeRenderer();

    @Override
    public String render(Ty ty, Set<AdtItem> qualify) {
        if (ty instanceof TyNumeric) return ((TyNumeric) ty).getKind().getName();
        if (ty instanceof TyBool) return "bool";
        if (ty instanceof TyChar) return "char";
        if (ty instanceof TyStr) return "str";
        if (ty instanceof TyReference) return renderReference((TyReference) ty, qualify);
        if (ty instanceof TyAdt) return renderAdt((TyAdt) ty, qualify);
        if (ty instanceof TyInfer.IntVar) return "{integer}";
        if (ty instanceof TyInfer.FloatVar) return "{float}";
        if (ty instanceof TyInfer.TyVar) return "_";
        if (ty instanceof TyUnknown) return "{unknown}";
        if (ty instanceof TyAnon) return renderAnon((TyAnon) ty);
        throw new IllegalArgumentException("Unknown type: " + ty.getClass().getSimpleName());
    }

    private static String renderAnon(TyAnon ty) {
        return ty.getBounds().isEmpty() ? "impl" : "impl " + String.join(" + ", ty.getBounds());
    }

    private String renderReference(TyReference ty, Set<AdtItem> qualify) {
        String prefix = ty.getMutability().isMut() ? "&mut " : "&";
        return prefix + render(ty.getReferenced(), qualify);
    }

    private String renderAdt(TyAdt ty, Set<AdtItem> qualify) {
        AdtItem item = ty.getItem();
        String name = qualify.contains(item) ? item.getPath() : item.getName();
        if (ty.getTypeArguments().isEmpty()) {
            return name;
        }
        return ty.getTypeArguments().stream()
                .map(arg -> render(arg, qualify))
                .collect(joining(", ", name + "<", ">"));
    }
}
