package com.example.sandstormtracker;

import com.example.sandstormtracker.service.IngestionOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
class SandstormTrackerApplicationTests {

	@Autowired
	private IngestionOrchestrator orchestrator;

	@Test
	void contextLoads() {
		// No servers are configured for tests, so nothing is tailed
		assertTrue(orchestrator.getStatus().isEmpty());
	}

}
