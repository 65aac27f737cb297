package com.queryguard.service.core.shape;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class QueryShapeHasherTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final QueryShapeHasher hasher = new QueryShapeHasher();

    @Test
    void literalsDoNotChangeTheShape() throws Exception {
        String a = hasher.shapeKey(json("{\"find\":\"power\",\"filter\":{\"ts\":{\"$gt\":\"2024-01-01\"}},\"limit\":10}"));
        String b = hasher.shapeKey(json("{\"limit\":50,\"filter\":{\"ts\":{\"$gt\":\"2024-06-01\"}},\"find\":\"power\"}"));

        assertThat(a).isEqualTo(b).hasSize(64).matches("[0-9A-F]{64}");
    }

    @Test
    void structureAndFieldReferencesChangeTheShape() throws Exception {
        String byDevice = hasher.shapeKey(json("{\"$group\":{\"_id\":\"$device\",\"avg\":{\"$avg\":\"$power\"}}}"));
        String byCategory = hasher.shapeKey(json("{\"$group\":{\"_id\":\"$category\",\"avg\":{\"$avg\":\"$power\"}}}"));
        String withCount = hasher.shapeKey(json("{\"$group\":{\"_id\":\"$device\",\"n\":{\"$sum\":1}}}"));

        assertThat(byDevice).isNotEqualTo(byCategory).isNotEqualTo(withCount);
    }

    @Test
    void literalListsOfAnyLengthShareAShape() throws Exception {
        String two = hasher.shapeKey(json("{\"device\":{\"$in\":[1,2]}}"));
        String five = hasher.shapeKey(json("{\"device\":{\"$in\":[\"a\",\"b\",\"c\",\"d\",\"e\"]}}"));

        assertThat(two).isEqualTo(five);
        assertThat(hasher.template(json("{\"device\":{\"$in\":[1,2]}}")))
                .isEqualTo("{\"device\":{\"$in\":\"?array\"}}");
    }

    @Test
    void remembersTemplatesOfHashedShapes() throws Exception {
        String key = hasher.shapeKey(json("{\"find\":\"power\",\"flag\":true,\"x\":null}"));

        assertThat(hasher.templateFor(key.toLowerCase()))
                .hasValue("{\"find\":\"?string\",\"flag\":\"?bool\",\"x\":\"?null\"}");
        assertThat(hasher.templateFor("F".repeat(64))).isEmpty();
    }

    @Test
    void rejectsMissingQuery() {
        assertThatThrownBy(() -> hasher.shapeKey(null)).isInstanceOf(IllegalArgumentException.class);
    }

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }
}
