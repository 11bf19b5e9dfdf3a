package com.foamcase.dict.value;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FoamMappingTest {

    @Test
    void replacingAValueKeepsItsPosition() {
        FoamDict dict = new FoamDict();
        dict.put("a", new FoamInt(1));
        dict.put("b", new FoamInt(2));
        dict.put("a", new FoamInt(3));

        assertEquals(List.of("a", "b"), dict.keys());
        assertEquals(new FoamInt(3), dict.get("a"));
    }

    @Test
    void equalityDependsOnOrder() {
        Map<String, FoamValue> ab = new LinkedHashMap<>();
        ab.put("a", new FoamInt(1));
        ab.put("b", new FoamInt(2));
        Map<String, FoamValue> ba = new LinkedHashMap<>();
        ba.put("b", new FoamInt(2));
        ba.put("a", new FoamInt(1));

        assertEquals(new FoamDict(ab), new FoamDict(ab));
        assertNotEquals(new FoamDict(ab), new FoamDict(ba));
    }

    @Test
    void dictionaryAndDictionaryTupleAreDistinct() {
        assertNotEquals(new FoamDict(), new FoamDictTuple());
        assertNotEquals(FoamTuple.of(new FoamInt(1)), FoamList.of(new FoamInt(1)));
    }

    @Test
    void typedAccessorsReturnNullOnShapeMismatch() {
        FoamDict dict = new FoamDict();
        dict.put("n", new FoamInt(1));
        dict.put("s", new FoamString("x"));

        assertNull(dict.getString("n"));
        assertNull(dict.getDict("s"));
        assertNull(dict.getString("missing"));
        assertEquals("x", dict.getString("s"));
    }

    @Test
    void rejectsNullEntries() {
        FoamDict dict = new FoamDict();

        assertThrows(NullPointerException.class, () -> dict.put(null, new FoamInt(1)));
        assertThrows(NullPointerException.class, () -> dict.put("a", null));
    }

    @Test
    void multiValueNeedsTwoElements() {
        assertThrows(IllegalArgumentException.class, () -> FoamMultiValue.of(new FoamInt(1)));
        assertEquals(2, FoamMultiValue.of(new FoamInt(1), new FoamInt(2)).size());
    }

    @Test
    void floatsCompareByValue() {
        assertEquals(new FoamFloat(0.1), new FoamFloat(0.1));
        assertNotEquals(new FoamFloat(1.0), new FoamInt(1));
    }
}
