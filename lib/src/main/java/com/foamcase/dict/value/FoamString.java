package com.foamcase.dict.value;

import java.util.Objects;

/** A bare word or quoted literal. The parser does not distinguish the two once reduced. */
public final class FoamString extends FoamValue {
    private final String value;

    public FoamString(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof FoamString)) {
            return false;
        }
        return value.equals(((FoamString) obj).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Str(" + value + ")";
    }
}
