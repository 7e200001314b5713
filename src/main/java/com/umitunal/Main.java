package com.umitunal;

import com.umitunal.examples.*;

/**
 * Main class that runs all cronlite examples.
 */
public class Main {
    public static void main(String[] args) throws Exception {
        System.out.println("=== cronlite Examples ===\n");

        BasicExample.main(args);
        RecurringJobsExample.main(args);
        RecoveryExample.main(args);

        System.out.println("\n=== All Examples Complete ===");
    }
}
