package com.mimecast.wren.config;

import org.junit.jupiter.api.Test;

import javax.naming.ConfigurationException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigFoundationTest {

    @Test
    void parseJson5() throws ConfigurationException {
        Map<String, Object> map = ConfigFoundation.parse("{\n  // comment\n  name: 'wren',\n  size: 3,\n  on: true,\n  list: [1, 2],\n  nested: { a: 1 }\n}", "test");
        ConfigFoundation config = new ConfigFoundation(map);

        assertEquals("wren", config.getStringProperty("name", null));
        assertEquals(3L, config.getLongProperty("size", 0L));
        assertEquals(3.0, config.getDoubleProperty("size", 0.0), 0.0001);
        assertTrue(config.getBooleanProperty("on", false));
        assertEquals(2, config.getListProperty("list").size());
        assertEquals(1.0, ((Number) config.getMapProperty("nested").get("a")).doubleValue(), 0.0001);
    }

    @Test
    void defaultsWhenMissing() {
        ConfigFoundation config = new ConfigFoundation((Map<String, Object>) null);

        assertFalse(config.hasProperty("name"));
        assertEquals("def", config.getStringProperty("name", "def"));
        assertEquals(7L, config.getLongProperty("size", 7L));
        assertTrue(config.getBooleanProperty("on", true));
        assertEquals(List.of(), config.getListProperty("list"));
        assertTrue(config.getMapProperty("nested").isEmpty());
    }

    @Test
    void parseRejectsNonObject() {
        assertThrows(ConfigurationException.class, () -> ConfigFoundation.parse("[1, 2]", "test"));
        assertThrows(ConfigurationException.class, () -> ConfigFoundation.parse("", "test"));
    }
}
