package com.foamcase.dict.value;

/**
 * A node of a parsed dictionary document. The hierarchy is closed: scalars, the three ordered sequence
 * shapes and the two keyed mapping shapes.
 */
public sealed abstract class FoamValue
        permits FoamInt, FoamFloat, FoamString, FoamBool, FoamSequence, FoamMapping {

    FoamValue() {}
}
