package com.nanik.agentbridge;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class MainTest {

    @Test
    void mapsLogLevelNames() {
        Assertions.assertEquals("debug", Main.toSimpleLoggerLevel("DEBUG"));
        Assertions.assertEquals("warn", Main.toSimpleLoggerLevel("WARNING"));
        Assertions.assertEquals("error", Main.toSimpleLoggerLevel(" critical "));
        Assertions.assertEquals("info", Main.toSimpleLoggerLevel("verbose"));
    }
}
