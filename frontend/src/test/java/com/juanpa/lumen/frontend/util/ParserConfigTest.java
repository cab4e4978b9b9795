package com.juanpa.lumen.frontend.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class ParserConfigTest
{
	@AfterEach
	void tearDown()
	{
		Debug.setEnabled(false);
	}

	@Test
	void testDefaults()
	{
		System.out.println("--- Running test: testDefaults ---");
		ParserConfig config = ParserConfig.defaults();
		assertFalse(config.isTraceEnabled());
		assertTrue(config.isEchoDiagnostics());
	}

	@Test
	void testPropertiesOverrideDefaults()
	{
		System.out.println("--- Running test: testPropertiesOverrideDefaults ---");
		Properties props = new Properties();
		props.setProperty("parser.trace", " true ");
		props.setProperty("parser.echo_diagnostics", "false");
		ParserConfig config = new ParserConfig(props);
		assertTrue(config.isTraceEnabled());
		assertFalse(config.isEchoDiagnostics());
	}

	@Test
	void testLoadFromClasspath()
	{
		System.out.println("--- Running test: testLoadFromClasspath ---");
		ParserConfig config = ParserConfig.load("lumen-test.properties");
		assertTrue(config.isTraceEnabled());
		assertFalse(config.isEchoDiagnostics());
	}

	@Test
	void testMissingResourceFallsBackToDefaults()
	{
		System.out.println("--- Running test: testMissingResourceFallsBackToDefaults ---");
		ParserConfig config = ParserConfig.load("does-not-exist.properties");
		assertFalse(config.isTraceEnabled());
		assertTrue(config.isEchoDiagnostics());
	}

	@Test
	void testBundledResourceLoads()
	{
		System.out.println("--- Running test: testBundledResourceLoads ---");
		ParserConfig config = ParserConfig.load();
		assertFalse(config.isTraceEnabled());
		assertTrue(config.isEchoDiagnostics());
	}

	@Test
	void testDebugTraceFollowsConfig()
	{
		System.out.println("--- Running test: testDebugTraceFollowsConfig ---");
		Properties props = new Properties();
		props.setProperty("parser.trace", "true");
		Debug.setEnabled(new ParserConfig(props).isTraceEnabled());
		assertTrue(Debug.isEnabled());
		Debug.indent();
		Debug.log("Tracing %s", "works");
		Debug.dedent();
		Debug.dedent();
	}
}
