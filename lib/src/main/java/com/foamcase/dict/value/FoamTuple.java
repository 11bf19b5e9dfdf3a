package com.foamcase.dict.value;

import java.util.List;

/** A parenthesized {@code (...)} run of values with no named entries. */
public final class FoamTuple extends FoamSequence {

    public FoamTuple(List<? extends FoamValue> elements) {
        super(elements);
    }

    public static FoamTuple of(FoamValue... elements) {
        return new FoamTuple(List.of(elements));
    }
}
