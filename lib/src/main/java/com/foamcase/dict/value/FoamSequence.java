package com.foamcase.dict.value;

import java.util.List;

/** Ordered, immutable run of values. */
public sealed abstract class FoamSequence extends FoamValue permits FoamList, FoamTuple, FoamMultiValue {
    private final List<FoamValue> elements;

    FoamSequence(List<? extends FoamValue> elements) {
        this.elements = List.copyOf(elements);
    }

    public List<FoamValue> getElements() {
        return elements;
    }

    public FoamValue get(int index) {
        return elements.get(index);
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        return elements.equals(((FoamSequence) obj).elements);
    }

    @Override
    public int hashCode() {
        return 31 * getClass().hashCode() + elements.hashCode();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName().substring("Foam".length()) + elements;
    }
}
