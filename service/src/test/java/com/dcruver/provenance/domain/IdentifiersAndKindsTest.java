package com.dcruver.provenance.domain;

import com.dcruver.provenance.error.ValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IdentifiersAndKindsTest {

    @Test
    void testIdentifiersAreCanonicalized() {
        String id = Identifiers.newId();
        assertEquals(id, Identifiers.require("  " + id.toUpperCase() + " ", "fragment id"));
        assertThrows(ValidationException.class, () -> Identifiers.require("fragment-1", "fragment id"));
        assertThrows(ValidationException.class, () -> Identifiers.require(null, "fragment id"));
    }

    @Test
    void testKindsParseWireValuesAndNames() {
        assertEquals(SourceKind.MEETING_VIDEO, SourceKind.fromValue("meeting_video"));
        assertEquals(SourceKind.QUICK_CAPTURE, SourceKind.fromValue("QUICK_CAPTURE"));
        assertEquals(LinkKind.RELATES_TO, LinkKind.fromValue("relates_to"));
        assertEquals(AssumptionValidity.INVALID, AssumptionValidity.fromValue("Invalid"));
        assertEquals("notes", SourceKind.NOTES.getValue());
    }

    @Test
    void testUnknownKindsAreRejected() {
        assertThrows(ValidationException.class, () -> SourceKind.fromValue("email"));
        assertThrows(ValidationException.class, () -> LinkKind.fromValue("duplicates"));
        assertThrows(ValidationException.class, () -> AssumptionValidity.fromValue("maybe"));
    }
}
