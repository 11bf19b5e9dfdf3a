package com.foamcase.dict.value;

import java.util.List;

/**
 * Two or more values written one after another under a single key, as in
 * {@code hex (0 1 2 3) (20 20 1) simpleGrading (1 1 1);}. Builds back without enclosing brackets.
 */
public final class FoamMultiValue extends FoamSequence {

    public FoamMultiValue(List<? extends FoamValue> elements) {
        super(elements);
        if (elements.size() < 2) {
            throw new IllegalArgumentException(
                    "A multi-value needs at least two elements, got " + elements.size());
        }
    }

    public static FoamMultiValue of(FoamValue... elements) {
        return new FoamMultiValue(List.of(elements));
    }
}
