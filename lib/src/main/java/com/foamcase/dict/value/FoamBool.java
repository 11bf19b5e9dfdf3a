package com.foamcase.dict.value;

/**
 * Boolean input for the builder. Parsing never produces one: {@code true} and {@code false} come back as
 * {@link FoamString}.
 */
public final class FoamBool extends FoamValue {
    public static final FoamBool TRUE = new FoamBool(true);
    public static final FoamBool FALSE = new FoamBool(false);

    private final boolean value;

    private FoamBool(boolean value) {
        this.value = value;
    }

    public static FoamBool of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof FoamBool)) {
            return false;
        }
        return value == ((FoamBool) obj).value;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(value);
    }

    @Override
    public String toString() {
        return "Bool(" + value + ")";
    }
}
