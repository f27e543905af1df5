package com.loopclaw.approval;

import com.loopclaw.tools.ToolCall;
import com.loopclaw.tools.ToolDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;

public class CliApprovalStrategy implements ApprovalStrategy {

    private static final Logger log = LoggerFactory.getLogger(CliApprovalStrategy.class);

    private final BufferedReader reader;
    private final PrintStream out;

    public CliApprovalStrategy() {
        this(new BufferedReader(new InputStreamReader(System.in)), System.out);
    }

    public CliApprovalStrategy(BufferedReader reader, PrintStream out) {
        this.reader = reader;
        this.out = out;
    }

    @Override
    public synchronized boolean approve(ToolCall call, ToolDefinition definition) {
        out.printf("[APPROVAL] Tool '%s' requires confirmation.%n", definition.name());
        out.printf("  Arguments: %s%n", call.input());
        out.print("  Allow? (y/n): ");
        out.flush();
        try {
            var line = reader.readLine();
            return line != null && line.trim().equalsIgnoreCase("y");
        } catch (IOException e) {
            log.warn("Approval prompt failed for {}: {}", definition.name(), e.getMessage());
            return false;
        }
    }
}
