package com.foamcase.dict.value;

import java.util.Map;

/**
 * A parenthesized block holding named entries rather than bare values, e.g. the patch list of a
 * {@code boundary ( movingWall { ... } fixedWalls { ... } );} entry.
 */
public final class FoamDictTuple extends FoamMapping {

    public FoamDictTuple() {}

    public FoamDictTuple(Map<String, ? extends FoamValue> entries) {
        super(entries);
    }
}
