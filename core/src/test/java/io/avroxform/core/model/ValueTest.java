package io.avroxform.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.avroxform.core.model.Value.ArrayValue;
import io.avroxform.core.model.Value.BytesValue;
import io.avroxform.core.model.Value.ObjectValue;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for the {@link Value} variants and factories. */
@DisplayName("Value")
class ValueTest {

    @Test
    @DisplayName("Factories map Java values to tags; null text and bytes become NULL")
    void factoryTags() {
        assertThat(Value.nil().tag()).isEqualTo(Value.Tag.NULL);
        assertThat(Value.of(true).tag()).isEqualTo(Value.Tag.BOOL);
        assertThat(Value.of(42L).tag()).isEqualTo(Value.Tag.INT);
        assertThat(Value.of(1.5).tag()).isEqualTo(Value.Tag.FLOAT);
        assertThat(Value.of("x").tag()).isEqualTo(Value.Tag.TEXT);
        assertThat(Value.ofBytes(new byte[] {1}).tag()).isEqualTo(Value.Tag.BYTES);
        assertThat(Value.of((String) null)).isSameAs(Value.nil());
        assertThat(Value.ofBytes(null)).isSameAs(Value.nil());
    }

    @Test
    @DisplayName("Bytes compare by content")
    void bytesContentEquality() {
        BytesValue a = new BytesValue(new byte[] {65, 66});
        BytesValue b = new BytesValue(new byte[] {65, 66});

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a).isNotEqualTo(new BytesValue(new byte[] {65}));
        assertThat(a.toString()).isEqualTo("BytesValue[65, 66]");
    }

    @Test
    @DisplayName("Array elements are copied defensively")
    void arrayCopied() {
        List<Value> source = new ArrayList<>(List.of(Value.of(1L)));
        ArrayValue array = new ArrayValue(source);

        source.add(Value.of(2L));

        assertThat(array.size()).isEqualTo(1);
        assertThatThrownBy(() -> array.elements().add(Value.nil())).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Object keeps field order and returns null for missing keys")
    void objectFields() {
        Map<String, Value> fields = new LinkedHashMap<>();
        fields.put("b", Value.of(1L));
        fields.put("a", Value.of(2L));
        ObjectValue object = new ObjectValue(fields);

        assertThat(object.fields().keySet()).containsExactly("b", "a");
        assertThat(object.get("a")).isEqualTo(Value.of(2L));
        assertThat(object.get("zzz")).isNull();
    }
}
