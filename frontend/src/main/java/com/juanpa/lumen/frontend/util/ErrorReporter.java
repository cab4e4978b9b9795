// File: src/main/java/com/juanpa/lumen/frontend/util/ErrorReporter.java
package com.juanpa.lumen.frontend.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the syntax errors of a parse and optionally echoes them to stderr.
 */
public class ErrorReporter
{
	private final List<Diagnostic> diagnostics = new ArrayList<>();
	private final boolean echo; // Whether reported errors are also printed to System.err

	public ErrorReporter()
	{
		this(true);
	}

	public ErrorReporter(boolean echo)
	{
		this.echo = echo;
	}

	public ErrorReporter(ParserConfig config)
	{
		this(config.isEchoDiagnostics());
	}

	/**
	 * Reports a syntax error.
	 *
	 * @param diagnostic The error to record.
	 */
	public void report(Diagnostic diagnostic)
	{
		diagnostics.add(diagnostic);
		if (echo)
		{
			System.err.println("[Error] Line " + diagnostic.line() + ", Column " + diagnostic.column() + ": " + diagnostic.message());
		}
	}

	/**
	 * Reports an error that does not fit one of the parser's categories.
	 *
	 * @param line    The line number where the error occurred.
	 * @param column  The column number where the error occurred.
	 * @param message The error message.
	 */
	public void report(int line, int column, String message)
	{
		report(Diagnostic.general(line, column, message));
	}

	/**
	 * Checks if any errors have been reported.
	 *
	 * @return True if errors exist, false otherwise.
	 */
	public boolean hasErrors()
	{
		return !diagnostics.isEmpty();
	}

	public int getErrorCount()
	{
		return diagnostics.size();
	}

	public List<Diagnostic> getDiagnostics()
	{
		return Collections.unmodifiableList(diagnostics);
	}

	/**
	 * Forgets every reported error.
	 */
	public void reset()
	{
		diagnostics.clear();
	}
}
