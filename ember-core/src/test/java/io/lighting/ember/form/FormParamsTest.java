package io.lighting.ember.form;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class FormParamsTest {

    public static class Signup {
        public String name;
        public int age;
        public List<String> tags;
        public Address address;
    }

    public static class Address {
        public String city;
        public String zip;
    }

    @Test
    void decodesUrlEncodedText() {
        FormParams params = FormParams.parseUrlEncoded("name=Ann+Lee&city=G%C3%B6teborg&flag&&tags%5B%5D=a");

        assertEquals(Optional.of("Ann Lee"), params.first("name"));
        assertEquals(Optional.of("Göteborg"), params.first("city"));
        assertEquals(Optional.of(""), params.first("flag"));
        assertEquals(List.of("a"), params.all("tags[]"));
        assertEquals(4, params.pairs().size());
    }

    @Test
    void emptyTextHasNoParameters() {
        assertTrue(FormParams.parseUrlEncoded("").isEmpty());
        assertTrue(FormParams.parseUrlEncoded(null).isEmpty());
    }

    @Test
    void malformedEscapeIsRejected() {
        assertThrows(FormDataException.class, () -> FormParams.parseUrlEncoded("a=%zz"));
    }

    @Test
    void readsTypedValues() {
        FormParams params = FormParams.of(List.of(
            Map.entry("n", "42"),
            Map.entry("s", "Hello"),
            Map.entry("b", "true")
        ));

        assertEquals(Optional.of(42), params.value("n", Integer.class));
        assertEquals(Optional.of("Hello"), params.value("s", String.class));
        assertEquals(Optional.of(Boolean.TRUE), params.value("b", Boolean.class));
        assertEquals(Optional.empty(), params.value("s", Integer.class));
        assertEquals(Optional.empty(), params.value("missing", String.class));
    }

    @Test
    void convertsToJson() {
        JsonNode json = FormParams.parseUrlEncoded("arr[]=1&arr[]=2&m[k]=v").toJson();

        assertEquals("2", json.get("arr").get(1).asText());
        assertEquals("v", json.get("m").get("k").asText());
    }

    @Test
    void bindsNestedStructure() {
        Signup signup = FormParams
            .parseUrlEncoded("name=Ann&age=31&tags[]=x&tags[]=y&address[city]=Lund&address[zip]=22100&extra=1")
            .bind(Signup.class);

        assertEquals("Ann", signup.name);
        assertEquals(31, signup.age);
        assertEquals(List.of("x", "y"), signup.tags);
        assertEquals("Lund", signup.address.city);
        assertEquals("22100", signup.address.zip);
    }

    @Test
    void bindFailureNamesTargetType() {
        FormBindingException error = assertThrows(
            FormBindingException.class,
            () -> FormParams.parseUrlEncoded("age=old").bind(Signup.class)
        );

        assertEquals(Signup.class, error.targetType());
    }

    @Test
    void structuralConflictSurfacesOnConversion() {
        FormParams params = FormParams.parseUrlEncoded("a=1&a=2");

        assertEquals(List.of("1", "2"), params.all("a"));
        assertThrows(FormDataException.class, params::toFormData);
    }
}
