package com.trustplatform.response;

import com.trustplatform.response.executor.ExecutorRegistry;
import com.trustplatform.response.service.IncidentResponseEngine;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class TrustEngineApplicationTest {

    @Autowired
    private IncidentResponseEngine engine;

    @Autowired
    private ExecutorRegistry registry;

    @Test
    void contextWiresAllExecutors() {
        assertEquals(4, registry.names().size());
        assertTrue(registry.names().containsAll(List.of("isolation", "scaling", "configuration", "workflow")));
        assertTrue(engine.getActiveIncidents().isEmpty());
    }
}
