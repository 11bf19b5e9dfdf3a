package com.foamcase.dict.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.foamcase.dict.testing.TestResources;
import com.foamcase.dict.value.FoamDict;
import com.foamcase.dict.value.FoamDictTuple;
import com.foamcase.dict.value.FoamFloat;
import com.foamcase.dict.value.FoamInt;
import com.foamcase.dict.value.FoamList;
import com.foamcase.dict.value.FoamMultiValue;
import com.foamcase.dict.value.FoamString;
import com.foamcase.dict.value.FoamTuple;
import java.util.List;
import org.junit.jupiter.api.Test;

class FoamDictParserTest {

    private final FoamDictParser parser = new FoamDictParser();

    @Test
    void classifiesNumbersAndMalformedNumbers() throws Exception {
        FoamDict dict = parser.parse("i 1; f 1.0; e 1e5; n 1e;");

        assertEquals(new FoamInt(1), dict.get("i"));
        assertEquals(new FoamFloat(1.0), dict.get("f"));
        assertEquals(new FoamFloat(100000.0), dict.get("e"));
        assertEquals(new FoamString("1e"), dict.get("n"));
    }

    @Test
    void commentsDoNotChangeTheTree() throws Exception {
        assertEquals(parser.parse("a 1;"), parser.parse("a 1; // c\n"));
        assertEquals(parser.parse("a 1;"), parser.parse("/* lead */ a /* mid */ 1;"));
    }

    @Test
    void braceWithOrWithoutSemicolonParsesTheSame() throws Exception {
        FoamDict plain = parser.parse("a { b 1; }");

        assertEquals(plain, parser.parse("a { b 1; };"));
        FoamDict inner = assertInstanceOf(FoamDict.class, plain.get("a"));
        assertEquals(new FoamInt(1), inner.get("b"));
    }

    @Test
    void singleBracketedValueStaysATuple() throws Exception {
        FoamDict dict = parser.parse("g (1 1 1);");

        assertEquals(FoamTuple.of(new FoamInt(1), new FoamInt(1), new FoamInt(1)), dict.get("g"));
    }

    @Test
    void severalValuesUnderOneNameCollapseIntoAMultiValue() throws Exception {
        FoamDict dict = parser.parse("k (1) (2);\nhex (0 1) (2 2) g (1 1);");

        assertEquals(
                FoamMultiValue.of(FoamTuple.of(new FoamInt(1)), FoamTuple.of(new FoamInt(2))), dict.get("k"));
        assertEquals(
                FoamMultiValue.of(
                        FoamTuple.of(new FoamInt(0), new FoamInt(1)),
                        FoamTuple.of(new FoamInt(2), new FoamInt(2)),
                        new FoamString("g"),
                        FoamTuple.of(new FoamInt(1), new FoamInt(1))),
                dict.get("hex"));
    }

    @Test
    void parenthesesHoldingNamedEntriesBecomeADictTuple() throws Exception {
        FoamDict dict = parser.parse("boundary ( name { type wall; } );\nv (1 2 3);");

        FoamDictTuple boundary = assertInstanceOf(FoamDictTuple.class, dict.get("boundary"));
        assertEquals(List.of("name"), boundary.keys());
        assertEquals(new FoamString("wall"), boundary.getDict("name").get("type"));
        assertEquals(FoamTuple.of(new FoamInt(1), new FoamInt(2), new FoamInt(3)), dict.get("v"));
    }

    @Test
    void parenthesesWithPairsInsideBecomeADictTuple() throws Exception {
        FoamDict dict = parser.parse("coeffs (a 1; b (2 3););");

        FoamDictTuple coeffs = assertInstanceOf(FoamDictTuple.class, dict.get("coeffs"));
        assertEquals(new FoamInt(1), coeffs.get("a"));
        assertEquals(FoamTuple.of(new FoamInt(2), new FoamInt(3)), coeffs.get("b"));
    }

    @Test
    void bracketsGiveListsOrDictionaries() throws Exception {
        FoamDict dict = parser.parse("dimensions [0 2 -1 0 0 0 0];\nnested [[1 2] 3];\nnamed [a 1; b 2;];");

        assertEquals(
                new FoamList(
                        List.of(new FoamInt(0), new FoamInt(2), new FoamInt(-1), new FoamInt(0), new FoamInt(0),
                                new FoamInt(0), new FoamInt(0))),
                dict.get("dimensions"));
        assertEquals(
                FoamList.of(FoamList.of(new FoamInt(1), new FoamInt(2)), new FoamInt(3)), dict.get("nested"));
        FoamDict named = assertInstanceOf(FoamDict.class, dict.get("named"));
        assertEquals(List.of("a", "b"), named.keys());
    }

    @Test
    void quotedStringsKeepWhitespace() throws Exception {
        FoamDict dict = parser.parse("title \"lid driven cavity\";\nlibs ('libsampling.so');");

        assertEquals(new FoamString("lid driven cavity"), dict.get("title"));
        assertEquals(FoamTuple.of(new FoamString("libsampling.so")), dict.get("libs"));
    }

    @Test
    void keysKeepSourceOrder() throws Exception {
        FoamDict dict = parser.parse("c 1; a 2; b { z 1; y 2; }");

        assertEquals(List.of("c", "a", "b"), dict.keys());
        assertEquals(List.of("z", "y"), dict.getDict("b").keys());
    }

    @Test
    void duplicateKeysAreRejected() {
        FoamParseException ex = assertThrows(FoamParseException.class, () -> parser.parse("a 1;\na 2;"));
        assertTrue(ex.getMessage().contains("Duplicate key 'a'"), ex.getMessage());
        assertThrows(FoamParseException.class, () -> parser.parse("d { x 1; x 1; }"));
    }

    @Test
    void sameKeyAtDifferentLevelsIsAllowed() throws Exception {
        FoamDict dict = parser.parse("type a; inner { type b; }");

        assertEquals(new FoamString("a"), dict.get("type"));
        assertEquals(new FoamString("b"), dict.getDict("inner").get("type"));
    }

    @Test
    void lastPairMayOmitItsSemicolon() throws Exception {
        assertEquals(parser.parse("a 1; b 2;"), parser.parse("a 1; b 2"));
    }

    @Test
    void emptyInputGivesAnEmptyDictionary() throws Exception {
        assertTrue(parser.parse("").isEmpty());
        assertTrue(parser.parse("// only a comment\n").isEmpty());
    }

    @Test
    void emptyBlocks() throws Exception {
        FoamDict dict = parser.parse("edges ();\nbox [];\nsub {}");

        assertEquals(FoamTuple.of(), dict.get("edges"));
        assertEquals(FoamList.of(), dict.get("box"));
        assertEquals(new FoamDict(), dict.get("sub"));
    }

    @Test
    void reportsUnbalancedBrackets() {
        for (String text :
                List.of("a (1 2;", "a 1 2);", "a [1 2;", "a 1];", "a { b 1;", "a b 1; }", "a \"open;",
                        "a 'open;")) {
            assertThrows(FoamParseException.class, () -> parser.parse(text), text);
        }
    }

    @Test
    void reportsMalformedPairs() {
        for (String text : List.of("a;", "; a 1;", "1 2;", "1 a 2;", "a 1; b", "a { b; }", "t (1 [2]);")) {
            assertThrows(FoamParseException.class, () -> parser.parse(text), text);
        }
    }

    @Test
    void errorMessagesCarryThePosition() {
        FoamParseException ex = assertThrows(FoamParseException.class, () -> parser.parse("a 1;\nb (2;"));

        assertTrue(ex.getMessage().startsWith("line 2:3 "), ex.getMessage());
    }

    @Test
    void parsesBlockMeshDictionary() throws Exception {
        FoamDict dict = parser.parse(TestResources.dictionary("blockMeshDict"));

        assertEquals(List.of("FoamFile", "scale", "vertices", "blocks", "edges", "boundary"), dict.keys());
        assertEquals(new FoamFloat(2.0), dict.getDict("FoamFile").get("version"));
        assertEquals(new FoamFloat(0.1), dict.get("scale"));

        FoamTuple vertices = assertInstanceOf(FoamTuple.class, dict.get("vertices"));
        assertEquals(8, vertices.size());
        assertEquals(FoamTuple.of(new FoamInt(0), new FoamInt(1), new FoamFloat(0.1)), vertices.get(7));

        FoamTuple blocks = assertInstanceOf(FoamTuple.class, dict.get("blocks"));
        assertEquals(new FoamString("hex"), blocks.get(0));
        assertEquals(FoamTuple.of(new FoamInt(20), new FoamInt(20), new FoamInt(1)), blocks.get(2));
        assertEquals(new FoamString("simpleGrading"), blocks.get(3));

        assertEquals(FoamTuple.of(), dict.get("edges"));

        FoamDictTuple boundary = assertInstanceOf(FoamDictTuple.class, dict.get("boundary"));
        assertEquals(List.of("movingWall", "fixedWalls", "frontAndBack"), boundary.keys());
        FoamDict fixedWalls = boundary.getDict("fixedWalls");
        assertEquals(new FoamString("wall"), fixedWalls.get("type"));
        assertEquals(3, assertInstanceOf(FoamTuple.class, fixedWalls.get("faces")).size());
    }
}
