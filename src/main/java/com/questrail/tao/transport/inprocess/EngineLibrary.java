package com.questrail.tao.transport.inprocess;

/**
 * EngineLibrary
 * -----------------------------------------------------------------------------
 * Binding to an engine that runs inside this JVM (for example through a
 * native library wrapper).
 *
 * <p>The engine prints human-readable output to the process standard output
 * and buffers structured output as numbered scratch lines. Implementations
 * report failures by throwing unchecked exceptions.</p>
 */
public interface EngineLibrary
{
    void setInitArgs(String initArgs);

    /**
     * Executes one command. Output is printed to {@link System#out}.
     */
    void command(String command);

    int scratchLineCount();

    /**
     * @param index 1-based
     */
    String scratchLine(int index);

    String getcwd();

    void chdir(String path);
}
