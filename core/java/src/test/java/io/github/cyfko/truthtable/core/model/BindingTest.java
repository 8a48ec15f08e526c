package io.github.cyfko.truthtable.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Binding Tests")
class BindingTest {

    @Test
    @DisplayName("Should keep binding order")
    void shouldKeepBindingOrder() {
        Binding binding = Binding.builder().bind('c', true).bind('a', false).build();

        assertEquals(List.of('c', 'a'), binding.variables());
        assertEquals(List.of(true, false), binding.values());
        assertEquals("Binding[c=1, a=0]", binding.toString());
    }

    @Test
    @DisplayName("Should report unbound variables as empty")
    void shouldReportUnbound() {
        Binding binding = Binding.builder().bind('a', true).build();

        assertTrue(binding.isBound('a'));
        assertFalse(binding.isBound('b'));
        assertTrue(binding.valueOf('b').isEmpty());
    }

    @Test
    @DisplayName("Should copy maps and stay immutable")
    void shouldCopyMaps() {
        Map<Character, Boolean> source = new LinkedHashMap<>();
        source.put('a', true);
        Binding binding = Binding.of(source);
        source.put('b', false);

        assertEquals(1, binding.size());
        assertThrows(UnsupportedOperationException.class, () -> binding.asMap().put('z', true));
    }

    @Test
    @DisplayName("Should compare by content")
    void shouldCompareByContent() {
        Binding first = Binding.builder().bind('a', true).bind('b', false).build();
        Binding second = Binding.of(Map.of('a', true, 'b', false));

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, Binding.builder().bind('a', true).bind('b', true).build());
    }

    @Test
    @DisplayName("Should reject null keys and values")
    void shouldRejectNulls() {
        Binding.Builder builder = Binding.builder();

        assertThrows(NullPointerException.class, () -> builder.bind(null, true));
        assertThrows(NullPointerException.class, () -> builder.bind('a', null));
    }
}
