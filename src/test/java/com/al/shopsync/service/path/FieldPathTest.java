package com.al.shopsync.service.path;

import com.al.shopsync.exception.InvalidPathException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FieldPathTest {

    @Test
    public void testParse_DottedKeys() {
        FieldPath path = FieldPath.parse("mainDetail.number");

        assertEquals(2, path.size());
        assertEquals(PathSegment.key("mainDetail"), path.segment(0));
        assertEquals(PathSegment.key("number"), path.segment(1));
        assertFalse(path.hasEach());
    }

    @Test
    public void testParse_EachAndIndex() {
        FieldPath path = FieldPath.parse("variants[].images[0].src");

        assertEquals(5, path.size());
        assertEquals(PathSegment.Kind.EACH, path.segment(1).getKind());
        assertEquals(PathSegment.Kind.INDEX, path.segment(3).getKind());
        assertEquals(0, path.segment(3).getIndex());
        assertTrue(path.hasEach());
    }

    @Test
    public void testParse_MultipleBrackets() {
        FieldPath path = FieldPath.parse("matrix[][1]");

        assertEquals(3, path.size());
        assertEquals(PathSegment.Kind.EACH, path.segment(1).getKind());
        assertEquals(1, path.segment(2).getIndex());
    }

    @Test
    public void testParse_RootArray() {
        FieldPath path = FieldPath.parse("[].id");

        assertEquals(PathSegment.Kind.EACH, path.segment(0).getKind());
        assertEquals("id", path.segment(1).getKey());
    }

    @Test
    public void testParse_Rejected() {
        assertThrows(InvalidPathException.class, () -> FieldPath.parse(""));
        assertThrows(InvalidPathException.class, () -> FieldPath.parse("   "));
        assertThrows(InvalidPathException.class, () -> FieldPath.parse("a..b"));
        assertThrows(InvalidPathException.class, () -> FieldPath.parse("a."));
        assertThrows(InvalidPathException.class, () -> FieldPath.parse("a[b]"));
        assertThrows(InvalidPathException.class, () -> FieldPath.parse("a[0"));
        assertThrows(InvalidPathException.class, () -> FieldPath.parse("a]"));
        assertThrows(InvalidPathException.class, () -> FieldPath.parse("a.[0]"));
        assertThrows(InvalidPathException.class, () -> FieldPath.parse("a[0]x"));
    }

    @Test
    public void testNormalized_ReplacesIndexes() {
        assertEquals("variants[].price", FieldPath.parse("variants[0].price").normalized());
        assertEquals("variants[].price", FieldPath.parse("variants[].price").normalized());
        assertEquals("title", FieldPath.parse(" title ").normalized());
    }

    @Test
    public void testEquals_SameSegments() {
        assertEquals(FieldPath.parse("a.b[]"), FieldPath.parse("a.b[]"));
        assertNotEquals(FieldPath.parse("a.b[]"), FieldPath.parse("a.b[0]"));
    }
}
