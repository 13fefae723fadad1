package org.pragmatica.rsfmt.syntax;

import java.util.List;
import java.util.Optional;

/**
 * Type parameter at the declaration site: {@code T: Bound + 'a = Default}.
 */
public record TyParam(String ident, List<TyParamBound> bounds, Optional<Ty> defaultTy, Span span)
        implements Rewritable {

    public TyParam {
        bounds = List.copyOf(bounds);
    }
}
