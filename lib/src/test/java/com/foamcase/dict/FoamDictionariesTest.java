package com.foamcase.dict;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.foamcase.dict.parser.FoamParseException;
import com.foamcase.dict.testing.TestResources;
import com.foamcase.dict.value.FoamDict;
import org.junit.jupiter.api.Test;

class FoamDictionariesTest {

    @Test
    void readsApplicationFromControlDictionary() throws Exception {
        assertEquals("icoFoam", FoamDictionaries.applicationName(TestResources.dictionary("controlDict")));
    }

    @Test
    void applicationIsNullWhenMissing() throws Exception {
        assertNull(FoamDictionaries.applicationName("startTime 0;"));
        assertNull(FoamDictionaries.applicationName("application (a b);"));
    }

    @Test
    void applicationNameFailsOnBrokenText() {
        assertThrows(FoamParseException.class, () -> FoamDictionaries.applicationName("application {"));
    }

    @Test
    void parseAndBuildAgree() throws Exception {
        FoamDict dict = FoamDictionaries.parse("a 1;\nb (x y);");

        assertEquals("a 1;\nb (x y);", FoamDictionaries.build(dict));
    }
}
