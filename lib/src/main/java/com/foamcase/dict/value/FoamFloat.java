package com.foamcase.dict.value;

public final class FoamFloat extends FoamValue {
    private final double value;

    public FoamFloat(double value) {
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof FoamFloat)) {
            return false;
        }
        return Double.compare(value, ((FoamFloat) obj).value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }

    @Override
    public String toString() {
        return "Float(" + value + ")";
    }
}
