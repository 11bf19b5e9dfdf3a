package com.foamcase.dict.value;

public final class FoamInt extends FoamValue {
    private final long value;

    public FoamInt(long value) {
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof FoamInt)) {
            return false;
        }
        return value == ((FoamInt) obj).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "Int(" + value + ")";
    }
}
