// File: src/main/java/com/juanpa/lumen/frontend/util/ParserConfig.java
package com.juanpa.lumen.frontend.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Holds configuration settings for the Lumen parser, loaded from a properties file.
 * Provides sensible defaults if settings are not specified.
 */
public class ParserConfig
{
	public static final String RESOURCE_NAME = "lumen.properties";

	private final boolean traceEnabled;
	private final boolean echoDiagnostics;

	public ParserConfig(Properties props)
	{
		this.traceEnabled = Boolean.parseBoolean(props.getProperty("parser.trace", "false").trim());
		this.echoDiagnostics = Boolean.parseBoolean(props.getProperty("parser.echo_diagnostics", "true").trim());
	}

	public static ParserConfig defaults()
	{
		return new ParserConfig(new Properties());
	}

	/**
	 * Loads {@value #RESOURCE_NAME} from the classpath, falling back to the defaults
	 * when it is missing or cannot be read.
	 */
	public static ParserConfig load()
	{
		return load(RESOURCE_NAME);
	}

	static ParserConfig load(String resourceName)
	{
		Properties props = new Properties();
		try (InputStream input = ParserConfig.class.getClassLoader().getResourceAsStream(resourceName))
		{
			if (input == null)
			{
				System.out.println("--- No " + resourceName + " found on the classpath. Using default parser settings. ---");
			}
			else
			{
				props.load(input);
			}
		}
		catch (IOException e)
		{
			System.err.println("Warning: Could not read " + resourceName + ". Using default settings. Error: " + e.getMessage());
		}
		return new ParserConfig(props);
	}

	public boolean isTraceEnabled()
	{
		return traceEnabled;
	}

	public boolean isEchoDiagnostics()
	{
		return echoDiagnostics;
	}
}
