package com.branchwork.core.branch;

import java.io.Serializable;
import java.time.Instant;

/**
 * A tool call made during a reasoning step.
 */
public record ToolExecution(
    String toolName,
    String arguments,
    String output,
    Instant timestamp
) implements Serializable {}
