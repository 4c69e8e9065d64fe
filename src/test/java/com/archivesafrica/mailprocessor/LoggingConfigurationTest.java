package com.archivesafrica.mailprocessor;

import com.archivesafrica.mailprocessor.pipeline.DirectoryLayout;
import org.apache.logging.log4j.LogManager;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

class LoggingConfigurationTest {

    @Test
    void slf4jIsBackedByLog4jCore() {
        assertTrue(LoggerFactory.getILoggerFactory().getClass().getName().startsWith("org.apache.logging.slf4j"));
        assertEquals("org.apache.logging.log4j.core.LoggerContext", LogManager.getContext(false).getClass().getName());
    }

    @Test
    void log4jApiMatchesCore() {
        // log4j-core 2.23 needs this class; it is missing from the older log4j-api poi-ooxml pulls in.
        assertDoesNotThrow(() -> Class.forName("org.apache.logging.log4j.util.Lazy"));
    }

    @Test
    void classesWithStaticLoggersInitialize() {
        assertDoesNotThrow(() -> Class.forName(DirectoryLayout.class.getName(), true, getClass().getClassLoader()));
        assertDoesNotThrow(() -> Class.forName(CollectionMailProcessor.class.getName(), true, getClass().getClassLoader()));
    }
}
