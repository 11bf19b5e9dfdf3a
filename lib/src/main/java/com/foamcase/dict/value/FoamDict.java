package com.foamcase.dict.value;

import java.util.Map;

/** A braced {@code {...}} block, or a whole document. */
public final class FoamDict extends FoamMapping {

    public FoamDict() {}

    public FoamDict(Map<String, ? extends FoamValue> entries) {
        super(entries);
    }
}
