package com.foamcase.dict.value;

import java.util.List;

/** A bracketed {@code [...]} run of scalars. */
public final class FoamList extends FoamSequence {

    public FoamList(List<? extends FoamValue> elements) {
        super(elements);
    }

    public static FoamList of(FoamValue... elements) {
        return new FoamList(List.of(elements));
    }
}
