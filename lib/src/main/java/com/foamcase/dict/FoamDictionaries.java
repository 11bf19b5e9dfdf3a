package com.foamcase.dict;

import com.foamcase.dict.parser.FoamDictBuilder;
import com.foamcase.dict.parser.FoamDictParser;
import com.foamcase.dict.parser.FoamParseException;
import com.foamcase.dict.value.FoamDict;
import com.foamcase.dict.value.FoamMapping;

/** One-shot parsing and building for callers that do not need file identity. */
public final class FoamDictionaries {

    /** Entry of a solver control dictionary that names the application to run. */
    public static final String APPLICATION_KEY = "application";

    private FoamDictionaries() {}

    public static FoamDict parse(String text) throws FoamParseException {
        return new FoamDictParser().parse(text);
    }

    public static String build(FoamMapping dictionary) {
        return new FoamDictBuilder().build(dictionary);
    }

    /**
     * Reads the {@code application} entry of a control dictionary.
     *
     * @return the application name, or null when the text has no such string entry
     */
    public static String applicationName(String controlDictText) throws FoamParseException {
        return parse(controlDictText).getString(APPLICATION_KEY);
    }
}
