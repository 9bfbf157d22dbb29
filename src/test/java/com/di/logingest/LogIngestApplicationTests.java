package com.di.logingest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Smoke test for LogIngestApplication. The full context needs cloud credentials, so only
 * the entry point is checked here.
 */
@DisplayName("LogIngestApplication Tests")
class LogIngestApplicationTests {

	@Test
	@DisplayName("Should have main class")
	void testMainClassExists() {
		Class<?> mainClass = LogIngestApplication.class;
		assertNotNull(mainClass.getAnnotation(org.springframework.boot.autoconfigure.SpringBootApplication.class));
		assertEquals("LogIngestApplication", mainClass.getSimpleName());
	}

	@Test
	@DisplayName("Should have public static main method")
	void testMainMethodExists() throws NoSuchMethodException {
		Method main = LogIngestApplication.class.getMethod("main", String[].class);
		assertTrue(Modifier.isStatic(main.getModifiers()));
		assertTrue(Modifier.isPublic(main.getModifiers()));
	}
}
