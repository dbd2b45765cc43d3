package com.example.jestadapter;

import com.example.jestadapter.config.AdapterProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "adapter.runner.extra-args=--ci")
class JestAdapterApplicationTests {

	@Autowired
	private AdapterProperties properties;

	@Test
	void contextLoadsWithBoundProperties() {
		assertEquals("npx jest", properties.runner().command());
		assertEquals("--ci", properties.runner().extraArgs());
		assertEquals(3, properties.execution().maxAttempts());
		assertEquals(Duration.ofSeconds(1), properties.execution().retryBackoff());
		assertEquals("coverage/clover.xml", properties.coverage().artifact());
		assertEquals("clover_xml", properties.coverage().format());
	}

}
