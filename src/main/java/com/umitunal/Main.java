package com.umitunal;

import com.umitunal.examples.*;

/**
 * Main class that runs all cronrelay examples.
 */
public class Main {
    public static void main(String[] args) throws Exception {
        System.out.println("=== cronrelay Examples ===\n");

        // Run all examples
        ScheduledJobsExample.main(args);
        BackgroundWorkersExample.main(args);
        RecoveryExample.main(args);
        WhitelistExample.main(args);

        System.out.println("\n=== All Examples Complete ===");
    }
}
