package com.di.userflow;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Basic smoke test for UserFlowApplication. The full context needs a reachable database, so
 * this checks the entry point only.
 */
@DisplayName("UserFlowApplication Tests")
class UserFlowApplicationTests {

	@Test
	@DisplayName("Should have main method")
	void testMainMethodExists() throws NoSuchMethodException {
		var mainMethod = UserFlowApplication.class.getMethod("main", String[].class);
		assertNotNull(mainMethod);
		assertTrue(java.lang.reflect.Modifier.isStatic(mainMethod.getModifiers()));
		assertTrue(java.lang.reflect.Modifier.isPublic(mainMethod.getModifiers()));
	}

	@Test
	@DisplayName("Should enable scheduling for the daily trigger")
	void testAnnotations() {
		assertTrue(UserFlowApplication.class.isAnnotationPresent(SpringBootApplication.class));
		assertTrue(UserFlowApplication.class.isAnnotationPresent(EnableScheduling.class));
	}
}
