package ai.bridgegen.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

public class QualifiedNameTest {

    @Test
    void parsesNamespaceAndName() {
        final QualifiedName qn = QualifiedName.of("std::os::raw::c_int");

        assertEquals(List.of("std", "os", "raw"), qn.namespace());
        assertEquals("c_int", qn.name());
        assertFalse(qn.topLevel());
        assertEquals("std::os::raw::c_int", qn.toString());
    }

    @Test
    void leadingSeparatorIsIgnored() {
        assertEquals(QualifiedName.of("a::B"), QualifiedName.of("::a::B"));
        assertTrue(QualifiedName.of("Point").topLevel());
    }

    @Test
    void blankNameIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> QualifiedName.of("a::"));
        assertThrows(IllegalArgumentException.class, () -> QualifiedName.of(List.of()));
    }

    @Test
    void serialisesAsText() throws Exception {
        final ObjectMapper mapper = new ObjectMapper();

        assertEquals("\"a::B\"", mapper.writeValueAsString(QualifiedName.of("a::B")));
        assertEquals(QualifiedName.of("a::B"), mapper.readValue("\"a::B\"", QualifiedName.class));
    }
}
