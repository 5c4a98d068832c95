package com.apispec.schemaGraph.resolver;

import com.apispec.schemaGraph.resolver.cli.ResolveCommand;
import picocli.CommandLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        logger.info("Starting schema graph resolver");

        CommandLine cmd = new CommandLine(new ResolveCommand());
        int exitCode = cmd.execute(args);

        logger.info("Resolver completed with exit code: {}", exitCode);
        System.exit(exitCode);
    }
}
